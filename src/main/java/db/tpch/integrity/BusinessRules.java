package db.tpch.integrity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import db.tpch.catalog.TableSchema;
import db.tpch.catalog.TpchSchema;
import db.tpch.integrity.AttributeViolation.Rule;
import db.tpch.model.LineItem;
import db.tpch.storage.KeyTuple;
import db.tpch.storage.Record;
import db.tpch.storage.TableData;

/**
 * Conventional TPC-H expectations that the DDL does not encode. Both rules are off unless
 * enabled through configuration.
 *
 * <ul>
 *   <li>date order: {@code l_shipdate <= l_commitdate <= l_receiptdate} per line item</li>
 *   <li>order totals: {@code o_totalprice} equals the sum of
 *       {@code l_extendedprice * (1 - l_discount) * (1 + l_tax)} over the order's line items,
 *       within a tolerance</li>
 * </ul>
 *
 * A total mismatch rejects the lineitem batch; the violation names the order's first line item
 * and carries the order key in its message.
 */
public final class BusinessRules {
    private static final int MONEY_SCALE = 2;

    private final boolean checkDateOrder;
    private final boolean checkOrderTotals;
    private final BigDecimal totalPriceTolerance;

    public BusinessRules(boolean checkDateOrder, boolean checkOrderTotals, BigDecimal totalPriceTolerance) {
        if (totalPriceTolerance == null || totalPriceTolerance.signum() < 0) {
            throw new IllegalArgumentException("totalPriceTolerance must be >= 0 (got " + totalPriceTolerance + ")");
        }
        this.checkDateOrder = checkDateOrder;
        this.checkOrderTotals = checkOrderTotals;
        this.totalPriceTolerance = totalPriceTolerance;
    }

    public static BusinessRules disabled() {
        return new BusinessRules(false, false, BigDecimal.ZERO);
    }

    public boolean isEnabled() { return checkDateOrder || checkOrderTotals; }

    // Row-local rules; safe to call from validation workers
    public void checkRow(TableSchema schema, Record row, KeyTuple rowKey) {
        if (!checkDateOrder || !TpchSchema.LINEITEM.equals(schema.name())) return;
        LocalDate ship = (LocalDate) row.get(schema.columnIndex("l_shipdate"));
        LocalDate commit = (LocalDate) row.get(schema.columnIndex("l_commitdate"));
        LocalDate receipt = (LocalDate) row.get(schema.columnIndex("l_receiptdate"));
        if (ship.isAfter(commit)) {
            throw new AttributeViolation(schema.name(), rowKey, "l_commitdate", Rule.DATE_ORDER,
                "l_shipdate " + ship + " is after l_commitdate " + commit);
        }
        if (commit.isAfter(receipt)) {
            throw new AttributeViolation(schema.name(), rowKey, "l_receiptdate", Rule.DATE_ORDER,
                "l_commitdate " + commit + " is after l_receiptdate " + receipt);
        }
    }

    /**
     * Rules spanning the whole batch. For line items, every order that has line items in the
     * batch is compared with its registered {@code orders} row.
     */
    public void checkBatch(TableSchema schema, List<Record> rows, TableData orders) {
        if (!checkOrderTotals || !TpchSchema.LINEITEM.equals(schema.name()) || orders == null) return;
        int orderKeyPos = schema.columnIndex("l_orderkey");
        int pricePos = schema.columnIndex("l_extendedprice");
        int discountPos = schema.columnIndex("l_discount");
        int taxPos = schema.columnIndex("l_tax");

        Map<KeyTuple, BigDecimal> sums = new LinkedHashMap<>();
        Map<KeyTuple, Record> firstLine = new LinkedHashMap<>();
        for (Record r : rows) {
            BigDecimal charge = LineItem.charge((BigDecimal) r.get(pricePos), (BigDecimal) r.get(discountPos),
                (BigDecimal) r.get(taxPos));
            KeyTuple orderKey = KeyTuple.of(r.get(orderKeyPos));
            sums.merge(orderKey, charge, BigDecimal::add);
            firstLine.putIfAbsent(orderKey, r);
        }

        int totalPos = orders.schema().columnIndex("o_totalprice");
        for (Map.Entry<KeyTuple, BigDecimal> e : sums.entrySet()) {
            Record order = orders.findByKey(e.getKey());
            if (order == null) continue; // dangling keys are reported by reference validation
            BigDecimal expected = e.getValue().setScale(MONEY_SCALE, RoundingMode.HALF_UP);
            BigDecimal actual = (BigDecimal) order.get(totalPos);
            if (expected.subtract(actual).abs().compareTo(totalPriceTolerance) > 0) {
                KeyTuple rowKey = firstLine.get(e.getKey()).key(schema.primaryKeyPositions());
                throw new AttributeViolation(schema.name(), rowKey, "l_orderkey", Rule.TOTAL_PRICE_MISMATCH,
                    "order " + e.getKey() + " has o_totalprice " + actual.toPlainString()
                        + " but its line items sum to " + expected.toPlainString());
            }
        }
    }
}
