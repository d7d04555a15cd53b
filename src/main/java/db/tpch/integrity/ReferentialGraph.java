package db.tpch.integrity;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.tpch.catalog.CatalogManager;
import db.tpch.catalog.ForeignKey;
import db.tpch.catalog.TableSchema;
import db.tpch.catalog.TpchSchema;
import db.tpch.storage.KeyTuple;
import db.tpch.storage.Record;
import db.tpch.storage.TableData;

/**
 * Foreign-key graph over the catalog and the gatekeeper for entity loads.
 *
 * <p>An entity is accepted only once every entity it references has been registered. Each batch
 * is validated as a whole (attribute domains, foreign keys, key uniqueness, enabled business
 * rules) and is published only if no row fails; a rejected batch leaves no trace. Published
 * {@link TableData} is immutable, so validation workers of later entities read it without locks.
 */
public class ReferentialGraph {
    private static final Logger log = LoggerFactory.getLogger(ReferentialGraph.class);

    // Extra violations attached to the thrown one as suppressed exceptions
    static final int MAX_REPORTED = 10;

    private final CatalogManager catalog;
    private final BusinessRules rules;
    private final ExecutorService workers; // null -> validate on the calling thread
    private final int chunkSize;

    private final Map<String, TableData> registered = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<TableData>> completions = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public ReferentialGraph(CatalogManager catalog) {
        this(catalog, BusinessRules.disabled(), null, Integer.MAX_VALUE);
    }

    public ReferentialGraph(CatalogManager catalog, BusinessRules rules, ExecutorService workers, int chunkSize) {
        if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be >= 1 (got " + chunkSize + ")");
        this.catalog = catalog;
        this.rules = rules;
        this.workers = workers;
        this.chunkSize = chunkSize;
        checkEdges();
    }

    /** Every foreign-key edge of the catalog, in table declaration order. */
    public List<ForeignKey> edges() {
        List<ForeignKey> out = new ArrayList<>();
        for (TableSchema ts : catalog.allTables()) out.addAll(ts.foreignKeys());
        return out;
    }

    /**
     * Referenced-before-referencing order of all catalog tables. Among tables whose
     * dependencies are satisfied, the one declared first goes first.
     */
    public List<String> loadOrder() {
        List<TableSchema> remaining = new ArrayList<>(catalog.allTables());
        Set<String> done = new LinkedHashSet<>();
        while (!remaining.isEmpty()) {
            TableSchema next = null;
            for (TableSchema ts : remaining) {
                if (done.containsAll(ts.dependencies())) {
                    next = ts;
                    break;
                }
            }
            if (next == null) {
                throw new IllegalStateException("Foreign-key cycle among tables: " + remaining.stream().map(TableSchema::name).toList());
            }
            remaining.remove(next);
            done.add(next.name());
        }
        return List.copyOf(done);
    }

    /**
     * Validate and publish the complete batch for one entity.
     *
     * @throws OutOfOrderLoad if a referenced entity is not registered yet
     * @throws IntegrityViolation for the lowest-numbered offending row; the batch is discarded
     * @throws IllegalStateException if the entity is already registered or being loaded
     */
    public TableData registerEntity(String name, List<Record> rows) {
        TableSchema schema = catalog.requireTable(name);
        if (rows == null) throw new IllegalArgumentException("rows must not be null");
        for (String dep : schema.dependencies()) {
            if (!registered.containsKey(dep)) throw new OutOfOrderLoad(name, dep);
        }
        if (!inFlight.add(name)) {
            throw new IllegalStateException("A load of " + name + " is already in flight");
        }
        try {
            if (registered.containsKey(name)) {
                throw new IllegalStateException(name + " is already loaded; reset before reloading");
            }
            long t0 = System.nanoTime();
            validateRows(schema, rows);
            Map<KeyTuple, Integer> keys = buildKeySet(schema, rows);
            rules.checkBatch(schema, rows, registered.get(TpchSchema.ORDERS));

            TableData data = new TableData(schema, rows, keys);
            registered.put(name, data);
            completion(name).complete(data);
            log.info("Registered {}: {} rows validated in {} ms", name, rows.size(), (System.nanoTime() - t0) / 1_000_000);
            return data;
        } finally {
            inFlight.remove(name);
        }
    }

    /**
     * Check every foreign key of {@code row} against the registered target key sets.
     * Keys with a null column are not checked.
     *
     * @throws AttributeViolation if the row does not have one value per column
     */
    public void validateReferences(String entity, Record row) {
        TableSchema schema = catalog.requireTable(entity);
        if (row.arity() != schema.columns().size()) {
            throw new AttributeViolation(entity, null, "*", AttributeViolation.Rule.ARITY,
                "expected " + schema.columns().size() + " values, got " + row.arity());
        }
        validateReferences(schema, row, RecordValidator.rowKey(schema, row));
    }

    private void validateReferences(TableSchema schema, Record row, KeyTuple rowKey) {
        for (ForeignKey fk : schema.foreignKeys()) {
            KeyTuple key = row.key(schema.positions(fk.columns()));
            if (key.hasNull()) continue;
            TableData target = registered.get(fk.targetTable());
            if (target == null) throw new OutOfOrderLoad(schema.name(), fk.targetTable());
            if (!target.containsKey(key)) {
                throw new DanglingReference(schema.name(), rowKey, fk.columns(), key, fk.targetTable(), fk.targetColumns());
            }
        }
    }

    public boolean isRegistered(String name) {
        return registered.containsKey(name);
    }

    public TableData table(String name) {
        return registered.get(name);
    }

    /** Completed with the entity's data when it is published; never completes for a rejected batch. */
    public CompletableFuture<TableData> completion(String name) {
        catalog.requireTable(name);
        return completions.computeIfAbsent(name, n -> new CompletableFuture<>());
    }

    /** Drop every registered entity, as between two benchmark iterations. */
    public void reset() {
        if (!inFlight.isEmpty()) throw new IllegalStateException("Loads in flight: " + inFlight);
        registered.clear();
        completions.clear();
        log.debug("Referential graph reset");
    }

    private void validateRows(TableSchema schema, List<Record> rows) {
        List<IntegrityViolation> found = new ArrayList<>();
        if (workers == null || rows.size() <= chunkSize) {
            found.addAll(validateChunk(schema, rows, 0, rows.size()));
        } else {
            List<Future<List<IntegrityViolation>>> parts = new ArrayList<>();
            for (int from = 0; from < rows.size(); from += chunkSize) {
                int start = from;
                int end = Math.min(rows.size(), from + chunkSize);
                parts.add(workers.submit(() -> validateChunk(schema, rows, start, end)));
            }
            log.debug("Validating {} rows of {} in {} chunks", rows.size(), schema.name(), parts.size());
            for (Future<List<IntegrityViolation>> part : parts) {
                found.addAll(await(schema.name(), part));
            }
        }
        if (!found.isEmpty()) throw withSuppressed(found);
    }

    private List<IntegrityViolation> validateChunk(TableSchema schema, List<Record> rows, int from, int to) {
        List<IntegrityViolation> out = new ArrayList<>();
        for (int i = from; i < to && out.size() < MAX_REPORTED; i++) {
            Record row = rows.get(i);
            try {
                RecordValidator.validate(schema, row);
                KeyTuple rowKey = RecordValidator.rowKey(schema, row);
                validateReferences(schema, row, rowKey);
                rules.checkRow(schema, row, rowKey);
            } catch (IntegrityViolation v) {
                out.add(v);
            }
        }
        return out;
    }

    private Map<KeyTuple, Integer> buildKeySet(TableSchema schema, List<Record> rows) {
        int[] pkPositions = schema.primaryKeyPositions();
        Map<KeyTuple, Integer> keys = new HashMap<>(Math.max(16, rows.size() * 2));
        for (int i = 0; i < rows.size(); i++) {
            KeyTuple key = rows.get(i).key(pkPositions);
            Integer first = keys.putIfAbsent(key, i);
            if (first != null) throw new UniquenessViolation(schema.name(), key, first, i);
        }
        return keys;
    }

    private List<IntegrityViolation> await(String entity, Future<List<IntegrityViolation>> part) {
        try {
            return part.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while validating " + entity, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw new IllegalStateException("Validation of " + entity + " failed", e.getCause());
        }
    }

    private static IntegrityViolation withSuppressed(List<IntegrityViolation> found) {
        IntegrityViolation first = found.get(0);
        for (int i = 1; i < found.size() && i < MAX_REPORTED; i++) first.addSuppressed(found.get(i));
        return first;
    }

    // Every edge must point at an existing table's full primary key
    private void checkEdges() {
        for (ForeignKey fk : edges()) {
            TableSchema target = catalog.requireTable(fk.targetTable());
            if (!target.primaryKey().equals(fk.targetColumns())) {
                throw new IllegalArgumentException("Foreign key " + fk + " does not reference the primary key of " + target.name());
            }
        }
    }
}
