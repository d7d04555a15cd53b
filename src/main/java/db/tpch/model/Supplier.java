package db.tpch.model;

import java.math.BigDecimal;

import db.tpch.catalog.TpchSchema;
import db.tpch.storage.KeyTuple;
import db.tpch.storage.Record;

public record Supplier(long suppKey,
                       String name,
                       String address,
                       int nationKey,
                       String phone,
                       BigDecimal acctBal,
                       String comment) implements Entity {

    @Override
    public String table() { return TpchSchema.SUPPLIER; }

    @Override
    public KeyTuple key() { return KeyTuple.of(suppKey); }

    @Override
    public Record toRecord() {
        return Record.of(suppKey, name, address, nationKey, phone, acctBal, comment);
    }

    public static Supplier fromRecord(Record r) {
        return new Supplier((Long) r.get(0), (String) r.get(1), (String) r.get(2), (Integer) r.get(3),
            (String) r.get(4), (BigDecimal) r.get(5), (String) r.get(6));
    }
}
