package db.tpch.model;

import java.math.BigDecimal;

import db.tpch.catalog.TpchSchema;
import db.tpch.storage.KeyTuple;
import db.tpch.storage.Record;

public record Customer(long custKey,
                       String name,
                       String address,
                       int nationKey,
                       String phone,
                       BigDecimal acctBal,
                       String mktSegment,
                       String comment) implements Entity {

    @Override
    public String table() { return TpchSchema.CUSTOMER; }

    @Override
    public KeyTuple key() { return KeyTuple.of(custKey); }

    @Override
    public Record toRecord() {
        return Record.of(custKey, name, address, nationKey, phone, acctBal, mktSegment, comment);
    }

    public static Customer fromRecord(Record r) {
        return new Customer((Long) r.get(0), (String) r.get(1), (String) r.get(2), (Integer) r.get(3),
            (String) r.get(4), (BigDecimal) r.get(5), (String) r.get(6), (String) r.get(7));
    }
}
