package db.tpch.integrity;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import db.tpch.TpchFixtures;
import db.tpch.catalog.CatalogManager;
import db.tpch.catalog.TableSchema;
import db.tpch.model.LineItem;
import db.tpch.storage.KeyTuple;
import db.tpch.storage.Record;

public class BusinessRulesTest {
    private final CatalogManager catalog = CatalogManager.tpch();
    private final TableSchema lineitem = catalog.requireTable("lineitem");

    private static LineItem withDates(LineItem li, int commitOffset, int receiptOffset) {
        return new LineItem(li.orderKey(), li.partKey(), li.suppKey(), li.lineNumber(), li.quantity(),
            li.extendedPrice(), li.discount(), li.tax(), li.returnFlag(), li.lineStatus(), li.shipDate(),
            li.shipDate().plusDays(commitOffset), li.shipDate().plusDays(receiptOffset),
            li.shipInstruct(), li.shipMode(), li.comment());
    }

    @Test
    void disabledRulesAcceptAnything() {
        BusinessRules rules = BusinessRules.disabled();
        assertFalse(rules.isEnabled());
        LineItem backwards = withDates(TpchFixtures.lineItem(1, 1, 1, 1), -3, -5);
        assertDoesNotThrow(() -> rules.checkRow(lineitem, backwards.toRecord(), backwards.key()));
    }

    @Test
    void shipAfterCommitIsRejected() {
        BusinessRules rules = new BusinessRules(true, false, BigDecimal.ONE);
        LineItem li = withDates(TpchFixtures.lineItem(1, 1, 1, 1), -1, 5);

        AttributeViolation v = assertThrows(AttributeViolation.class,
            () -> rules.checkRow(lineitem, li.toRecord(), li.key()));
        assertEquals(AttributeViolation.Rule.DATE_ORDER, v.rule());
        assertEquals("l_commitdate", v.column());
        assertEquals(KeyTuple.of(1L, 1L), v.rowKey());
    }

    @Test
    void commitAfterReceiptIsRejected() {
        BusinessRules rules = new BusinessRules(true, false, BigDecimal.ONE);
        LineItem li = withDates(TpchFixtures.lineItem(1, 1, 1, 1), 5, 4);

        AttributeViolation v = assertThrows(AttributeViolation.class,
            () -> rules.checkRow(lineitem, li.toRecord(), li.key()));
        assertEquals("l_receiptdate", v.column());
    }

    @Test
    void sameDayShipCommitAndReceiptIsAccepted() {
        BusinessRules rules = new BusinessRules(true, false, BigDecimal.ONE);
        LineItem li = withDates(TpchFixtures.lineItem(1, 1, 1, 1), 0, 0);
        assertDoesNotThrow(() -> rules.checkRow(lineitem, li.toRecord(), li.key()));
    }

    @Test
    void dateRuleOnlyAppliesToLineItems() {
        BusinessRules rules = new BusinessRules(true, true, BigDecimal.ZERO);
        Record region = TpchFixtures.region(1).toRecord();
        assertDoesNotThrow(() -> rules.checkRow(catalog.requireTable("region"), region, KeyTuple.of(1)));
    }

    @Test
    void fixtureTotalsMatchExactly() {
        ReferentialGraph graph = new ReferentialGraph(catalog);
        Map<String, List<Record>> batches = TpchFixtures.batches();
        for (String t : List.of("region", "nation", "part", "supplier", "partsupp", "customer", "orders")) {
            graph.registerEntity(t, batches.get(t));
        }
        BusinessRules rules = new BusinessRules(false, true, BigDecimal.ZERO);
        assertDoesNotThrow(() -> rules.checkBatch(lineitem, batches.get("lineitem"), graph.table("orders")));
    }

    @Test
    void totalOutsideToleranceIsRejected() {
        ReferentialGraph graph = new ReferentialGraph(catalog);
        Map<String, List<Record>> batches = TpchFixtures.batches();
        for (String t : List.of("region", "nation", "part", "supplier", "partsupp", "customer")) {
            graph.registerEntity(t, batches.get(t));
        }
        // order 4 carries two line items; its stored total is off by 5.00
        List<Record> orders = new ArrayList<>(batches.get("orders"));
        List<Record> lineItems = batches.get("lineitem");
        BigDecimal sum = BigDecimal.ZERO;
        for (Record r : lineItems) {
            LineItem li = LineItem.fromRecord(r);
            if (li.orderKey() == 4) sum = sum.add(li.charge());
        }
        BigDecimal skewed = sum.setScale(2, RoundingMode.HALF_UP).add(new BigDecimal("5.00"));
        orders.set(3, TpchFixtures.order(4, 5, skewed).toRecord());
        graph.registerEntity("orders", orders);

        BusinessRules strict = new BusinessRules(false, true, new BigDecimal("1.00"));
        AttributeViolation v = assertThrows(AttributeViolation.class,
            () -> strict.checkBatch(lineitem, lineItems, graph.table("orders")));
        assertEquals(AttributeViolation.Rule.TOTAL_PRICE_MISMATCH, v.rule());
        assertEquals("lineitem", v.entity());
        assertEquals(KeyTuple.of(4L, 1L), v.rowKey());
        assertEquals("l_orderkey", v.column());
        assertTrue(v.getMessage().contains("order 4 has o_totalprice"), v.getMessage());

        BusinessRules lenient = new BusinessRules(false, true, new BigDecimal("5.00"));
        assertDoesNotThrow(() -> lenient.checkBatch(lineitem, lineItems, graph.table("orders")));
    }

    @Test
    void totalsRuleRejectsLineItemLoadThroughGraph() {
        BusinessRules rules = new BusinessRules(false, true, BigDecimal.ZERO);
        ReferentialGraph graph = new ReferentialGraph(catalog, rules, null, 1000);
        Map<String, List<Record>> batches = TpchFixtures.batches();
        List<Record> orders = new ArrayList<>(batches.get("orders"));
        Record first = orders.get(0);
        orders.set(0, TpchFixtures.order(1, 2, ((BigDecimal) first.get(3)).add(new BigDecimal("0.01"))).toRecord());
        batches.put("orders", orders);
        for (String t : graph.loadOrder()) {
            if (t.equals("lineitem")) break;
            graph.registerEntity(t, batches.get(t));
        }

        AttributeViolation v = assertThrows(AttributeViolation.class,
            () -> graph.registerEntity("lineitem", batches.get("lineitem")));
        assertEquals("lineitem", v.entity());
        assertEquals(KeyTuple.of(1L, 1L), v.rowKey());
        assertFalse(graph.isRegistered("lineitem"));
    }

    @Test
    void negativeToleranceIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BusinessRules(false, true, new BigDecimal("-0.01")));
        assertThrows(IllegalArgumentException.class, () -> new BusinessRules(false, true, null));
    }
}
