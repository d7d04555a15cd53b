package db.tpch.model;

import java.math.BigDecimal;
import java.time.LocalDate;

import db.tpch.catalog.TpchSchema;
import db.tpch.storage.KeyTuple;
import db.tpch.storage.Record;

// Row of the orders table.
public record Order(long orderKey,
                    long custKey,
                    String orderStatus,
                    BigDecimal totalPrice,
                    LocalDate orderDate,
                    String orderPriority,
                    String clerk,
                    int shipPriority,
                    String comment) implements Entity {

    @Override
    public String table() { return TpchSchema.ORDERS; }

    @Override
    public KeyTuple key() { return KeyTuple.of(orderKey); }

    @Override
    public Record toRecord() {
        return Record.of(orderKey, custKey, orderStatus, totalPrice, orderDate, orderPriority, clerk, shipPriority, comment);
    }

    public static Order fromRecord(Record r) {
        return new Order((Long) r.get(0), (Long) r.get(1), (String) r.get(2), (BigDecimal) r.get(3),
            (LocalDate) r.get(4), (String) r.get(5), (String) r.get(6), (Integer) r.get(7), (String) r.get(8));
    }
}
