package db.tpch.model;

import java.math.BigDecimal;

import db.tpch.catalog.TpchSchema;
import db.tpch.storage.KeyTuple;
import db.tpch.storage.Record;

/**
 * Stocking relationship between a part and a supplier. Its key is the (part, supplier)
 * pair that line items reference as one unit.
 */
public record PartSupp(long partKey,
                       long suppKey,
                       long availQty,
                       BigDecimal supplyCost,
                       String comment) implements Entity {

    @Override
    public String table() { return TpchSchema.PARTSUPP; }

    @Override
    public KeyTuple key() { return KeyTuple.of(partKey, suppKey); }

    @Override
    public Record toRecord() {
        return Record.of(partKey, suppKey, availQty, supplyCost, comment);
    }

    public static PartSupp fromRecord(Record r) {
        return new PartSupp((Long) r.get(0), (Long) r.get(1), (Long) r.get(2), (BigDecimal) r.get(3), (String) r.get(4));
    }
}
