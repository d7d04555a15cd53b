package db.tpch.model;

import java.math.BigDecimal;

import db.tpch.catalog.TpchSchema;
import db.tpch.storage.KeyTuple;
import db.tpch.storage.Record;

public record Part(long partKey,
                   String name,
                   String mfgr,
                   String brand,
                   String type,
                   int size,
                   String container,
                   BigDecimal retailPrice,
                   String comment) implements Entity {

    @Override
    public String table() { return TpchSchema.PART; }

    @Override
    public KeyTuple key() { return KeyTuple.of(partKey); }

    @Override
    public Record toRecord() {
        return Record.of(partKey, name, mfgr, brand, type, size, container, retailPrice, comment);
    }

    public static Part fromRecord(Record r) {
        return new Part((Long) r.get(0), (String) r.get(1), (String) r.get(2), (String) r.get(3),
            (String) r.get(4), (Integer) r.get(5), (String) r.get(6), (BigDecimal) r.get(7), (String) r.get(8));
    }
}
