package db.tpch.integrity;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Test;

import db.tpch.TpchFixtures;
import db.tpch.catalog.CatalogManager;
import db.tpch.model.LineItem;
import db.tpch.model.Supplier;
import db.tpch.storage.KeyTuple;
import db.tpch.storage.Record;
import db.tpch.storage.TableData;

public class ReferentialGraphTest {
    private static final List<String> ORDER =
        List.of("region", "nation", "part", "supplier", "partsupp", "customer", "orders", "lineitem");

    private final CatalogManager catalog = CatalogManager.tpch();

    private static void registerUpTo(ReferentialGraph graph, Map<String, List<Record>> batches, String lastExclusive) {
        for (String table : ORDER) {
            if (table.equals(lastExclusive)) return;
            graph.registerEntity(table, batches.get(table));
        }
    }

    @Test
    void loadOrderFollowsForeignKeys() {
        ReferentialGraph graph = new ReferentialGraph(catalog);
        assertEquals(ORDER, graph.loadOrder());
        assertEquals(8, graph.edges().size());
    }

    @Test
    void fullFixtureRegisters() {
        ReferentialGraph graph = new ReferentialGraph(catalog);
        Map<String, List<Record>> batches = TpchFixtures.batches();
        registerUpTo(graph, batches, null);
        for (String table : ORDER) assertTrue(graph.isRegistered(table), table);
        assertEquals(25, graph.table("nation").size());
        assertNotNull(graph.table("partsupp").findByKey(KeyTuple.of(1L, TpchFixtures.supplierOf(1, 1))));
    }

    @Test
    void duplicateRegionKeyIsUniquenessViolation() {
        ReferentialGraph graph = new ReferentialGraph(catalog);
        List<Record> regions = new ArrayList<>(TpchFixtures.batches().get("region"));
        regions.add(Record.of(2, "ASIA AGAIN", null));

        UniquenessViolation v = assertThrows(UniquenessViolation.class, () -> graph.registerEntity("region", regions));
        assertEquals("region", v.entity());
        assertEquals(KeyTuple.of(2), v.key());
        assertEquals(2, v.firstRow());
        assertEquals(5, v.duplicateRow());
        assertFalse(graph.isRegistered("region"));
    }

    @Test
    void duplicateCompositeKeyIsUniquenessViolation() {
        ReferentialGraph graph = new ReferentialGraph(catalog);
        Map<String, List<Record>> batches = TpchFixtures.batches();
        registerUpTo(graph, batches, "partsupp");
        List<Record> partsupp = new ArrayList<>(batches.get("partsupp"));
        partsupp.add(TpchFixtures.partSupp(1, TpchFixtures.supplierOf(1, 0)).toRecord());

        UniquenessViolation v = assertThrows(UniquenessViolation.class, () -> graph.registerEntity("partsupp", partsupp));
        assertEquals(KeyTuple.of(1L, TpchFixtures.supplierOf(1, 0)), v.key());
    }

    @Test
    void supplierWithUnknownNationIsDangling() {
        ReferentialGraph graph = new ReferentialGraph(catalog);
        Map<String, List<Record>> batches = TpchFixtures.batches();
        registerUpTo(graph, batches, "supplier");
        List<Record> suppliers = new ArrayList<>(batches.get("supplier"));
        Supplier orphan = TpchFixtures.supplier(11, 999);
        suppliers.add(orphan.toRecord());

        DanglingReference v = assertThrows(DanglingReference.class, () -> graph.registerEntity("supplier", suppliers));
        assertEquals("supplier", v.entity());
        assertEquals(KeyTuple.of(999), v.key());
        assertEquals("nation", v.targetEntity());
        assertEquals(List.of("n_nationkey"), v.targetKey());
        assertEquals(List.of("s_nationkey"), v.columns());
        assertEquals(KeyTuple.of(11L), v.rowKey());
        assertFalse(graph.isRegistered("supplier"));
    }

    @Test
    void compositeReferenceNeedsTheStockedPair() {
        ReferentialGraph graph = new ReferentialGraph(catalog);
        graph.registerEntity("region", List.of(TpchFixtures.region(0).toRecord()));
        graph.registerEntity("nation", List.of(TpchFixtures.nation(0, 0).toRecord()));
        graph.registerEntity("part", List.of(TpchFixtures.part(10).toRecord()));
        graph.registerEntity("supplier", List.of(TpchFixtures.supplier(20, 0).toRecord(), TpchFixtures.supplier(30, 0).toRecord()));
        graph.registerEntity("partsupp", List.of(TpchFixtures.partSupp(10, 30).toRecord()));
        graph.registerEntity("customer", List.of(TpchFixtures.customer(1, 0).toRecord()));
        graph.registerEntity("orders", List.of(TpchFixtures.order(1, 1, new BigDecimal("100.00")).toRecord()));

        // part 10 and supplier 20 both exist, but were never stocked together
        assertNotNull(graph.table("part").findByKey(KeyTuple.of(10L)));
        assertNotNull(graph.table("supplier").findByKey(KeyTuple.of(20L)));
        LineItem unstocked = TpchFixtures.lineItem(1, 1, 10, 20);
        DanglingReference v = assertThrows(DanglingReference.class,
            () -> graph.registerEntity("lineitem", List.of(unstocked.toRecord())));
        assertEquals("partsupp", v.targetEntity());
        assertEquals(unstocked.partSupp(), v.key());
        assertEquals(List.of("l_partkey", "l_suppkey"), v.columns());
        assertEquals(List.of("ps_partkey", "ps_suppkey"), v.targetKey());

        LineItem stocked = TpchFixtures.lineItem(1, 1, 10, 30);
        assertDoesNotThrow(() -> graph.validateReferences("lineitem", stocked.toRecord()));
        assertEquals(1, graph.registerEntity("lineitem", List.of(stocked.toRecord())).size());
    }

    @Test
    void lineItemBeforeOrdersIsOutOfOrder() {
        ReferentialGraph graph = new ReferentialGraph(catalog);
        Map<String, List<Record>> batches = TpchFixtures.batches();
        registerUpTo(graph, batches, "orders");

        OutOfOrderLoad v = assertThrows(OutOfOrderLoad.class, () -> graph.registerEntity("lineitem", batches.get("lineitem")));
        assertEquals("lineitem", v.entity());
        assertEquals("orders", v.missingDependency());
        assertThrows(OutOfOrderLoad.class, () -> graph.validateReferences("lineitem", batches.get("lineitem").get(0)));
    }

    @Test
    void nationOnEmptyGraphNamesRegion() {
        ReferentialGraph graph = new ReferentialGraph(catalog);
        OutOfOrderLoad v = assertThrows(OutOfOrderLoad.class, () -> graph.registerEntity("nation", List.of()));
        assertEquals("region", v.missingDependency());
    }

    @Test
    void registeredEntitiesAreImmutableUntilReset() {
        ReferentialGraph graph = new ReferentialGraph(catalog);
        List<Record> regions = TpchFixtures.batches().get("region");
        graph.registerEntity("region", regions);
        assertThrows(IllegalStateException.class, () -> graph.registerEntity("region", regions));
        assertThrows(UnsupportedOperationException.class, () -> graph.table("region").rows().add(Record.of(9, "X", null)));

        graph.reset();
        assertFalse(graph.isRegistered("region"));
        assertEquals(5, graph.registerEntity("region", regions).size());
    }

    @Test
    void completionSignalsPublication() throws Exception {
        ReferentialGraph graph = new ReferentialGraph(catalog);
        CompletableFuture<TableData> regionDone = graph.completion("region");
        assertFalse(regionDone.isDone());

        List<Record> bad = List.of(Record.of(1, "A", null), Record.of(1, "B", null));
        assertThrows(UniquenessViolation.class, () -> graph.registerEntity("region", bad));
        assertFalse(regionDone.isDone());

        TableData data = graph.registerEntity("region", TpchFixtures.batches().get("region"));
        assertSame(data, regionDone.get());
    }

    @Test
    void parallelValidationReportsLowestRowFirst() {
        ExecutorService workers = Executors.newFixedThreadPool(4);
        try {
            ReferentialGraph graph = new ReferentialGraph(catalog, BusinessRules.disabled(), workers, 3);
            Map<String, List<Record>> batches = TpchFixtures.batches();
            registerUpTo(graph, batches, "lineitem");

            List<Record> lineitems = new ArrayList<>(batches.get("lineitem"));
            int size = lineitems.size();
            lineitems.set(size - 1, TpchFixtures.lineItem(88888, 1, 1, TpchFixtures.supplierOf(1, 0)).toRecord());
            lineitems.set(7, TpchFixtures.lineItem(99999, 1, 1, TpchFixtures.supplierOf(1, 0)).toRecord());

            DanglingReference v = assertThrows(DanglingReference.class, () -> graph.registerEntity("lineitem", lineitems));
            assertEquals(KeyTuple.of(99999L), v.key());
            assertEquals(1, v.getSuppressed().length);
            assertFalse(graph.isRegistered("lineitem"));

            assertEquals(size, graph.registerEntity("lineitem", batches.get("lineitem")).size());
        } finally {
            workers.shutdownNow();
        }
    }

    @Test
    void attributeViolationRejectsWholeBatch() {
        ReferentialGraph graph = new ReferentialGraph(catalog);
        List<Record> regions = new ArrayList<>(TpchFixtures.batches().get("region"));
        regions.set(4, Record.of(4, "MIDDLE EAST", "x".repeat(153)));

        AttributeViolation v = assertThrows(AttributeViolation.class, () -> graph.registerEntity("region", regions));
        assertEquals(AttributeViolation.Rule.TOO_LONG, v.rule());
        assertNull(graph.table("region"));
    }

    @Test
    void unknownEntityIsRejected() {
        ReferentialGraph graph = new ReferentialGraph(catalog);
        assertThrows(IllegalArgumentException.class, () -> graph.registerEntity("warehouse", List.of()));
    }

    @Test
    void shortRowIsArityViolationNotProjectionFailure() {
        ReferentialGraph graph = new ReferentialGraph(catalog);
        Map<String, List<Record>> batches = TpchFixtures.batches();
        registerUpTo(graph, batches, "part");

        AttributeViolation v = assertThrows(AttributeViolation.class,
            () -> graph.validateReferences("supplier", Record.of(1L, "x")));
        assertEquals(AttributeViolation.Rule.ARITY, v.rule());
        assertEquals("supplier", v.entity());
        assertNull(v.rowKey());
    }
}
