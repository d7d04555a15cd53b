package db.tpch.model;

import java.math.BigDecimal;
import java.time.LocalDate;

import db.tpch.catalog.TpchSchema;
import db.tpch.storage.KeyTuple;
import db.tpch.storage.Record;

/**
 * Row of the lineitem table. The supplying part/supplier pair is exposed as one
 * {@link #partSupp()} key, matching the composite reference to partsupp.
 */
public record LineItem(long orderKey,
                       long partKey,
                       long suppKey,
                       long lineNumber,
                       BigDecimal quantity,
                       BigDecimal extendedPrice,
                       BigDecimal discount,
                       BigDecimal tax,
                       String returnFlag,
                       String lineStatus,
                       LocalDate shipDate,
                       LocalDate commitDate,
                       LocalDate receiptDate,
                       String shipInstruct,
                       String shipMode,
                       String comment) implements Entity {

    @Override
    public String table() { return TpchSchema.LINEITEM; }

    @Override
    public KeyTuple key() { return KeyTuple.of(orderKey, lineNumber); }

    public KeyTuple partSupp() { return KeyTuple.of(partKey, suppKey); }

    public BigDecimal charge() {
        return charge(extendedPrice, discount, tax);
    }

    // extendedprice * (1 - discount) * (1 + tax), unrounded
    public static BigDecimal charge(BigDecimal extendedPrice, BigDecimal discount, BigDecimal tax) {
        return extendedPrice.multiply(BigDecimal.ONE.subtract(discount)).multiply(BigDecimal.ONE.add(tax));
    }

    @Override
    public Record toRecord() {
        return Record.of(orderKey, partKey, suppKey, lineNumber, quantity, extendedPrice, discount, tax,
            returnFlag, lineStatus, shipDate, commitDate, receiptDate, shipInstruct, shipMode, comment);
    }

    public static LineItem fromRecord(Record r) {
        return new LineItem((Long) r.get(0), (Long) r.get(1), (Long) r.get(2), (Long) r.get(3),
            (BigDecimal) r.get(4), (BigDecimal) r.get(5), (BigDecimal) r.get(6), (BigDecimal) r.get(7),
            (String) r.get(8), (String) r.get(9), (LocalDate) r.get(10), (LocalDate) r.get(11),
            (LocalDate) r.get(12), (String) r.get(13), (String) r.get(14), (String) r.get(15));
    }
}
