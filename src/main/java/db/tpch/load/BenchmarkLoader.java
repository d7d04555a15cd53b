package db.tpch.load;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.tpch.catalog.CatalogManager;
import db.tpch.catalog.TableSchema;
import db.tpch.index.IndexManager;
import db.tpch.integrity.ReferentialGraph;
import db.tpch.storage.Record;
import db.tpch.storage.TableData;

/**
 * Runs a full benchmark load: every catalog table, referenced-before-referencing.
 *
 * <p>Each table is one stage. A stage starts only when the stages of all tables it references
 * have completed, so dependents always validate against fully published key sets. With
 * {@code concurrentStages} off, stages run one at a time. A rejected batch fails its stage and
 * every stage depending on it; tables loaded before the failure stay registered.
 */
public class BenchmarkLoader implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BenchmarkLoader.class);

    private final CatalogManager catalog;
    private final LoaderConfig config;
    private final ExecutorService workers;
    private final ExecutorService stages;
    private final ReferentialGraph graph;
    private final IndexManager indexes;

    public BenchmarkLoader(CatalogManager catalog, LoaderConfig config) {
        this.catalog = catalog;
        this.config = config;
        this.workers = config.validationThreads > 1 ? Executors.newFixedThreadPool(config.validationThreads) : null;
        this.stages = config.concurrentStages
            ? Executors.newFixedThreadPool(Math.max(2, catalog.allTables().size()))
            : Executors.newSingleThreadExecutor();
        this.graph = new ReferentialGraph(catalog, config.businessRules(), workers, config.chunkSize);
        this.indexes = new IndexManager(catalog, config.indexOrder);
    }

    public ReferentialGraph graph() { return graph; }

    public IndexManager indexes() { return indexes; }

    /**
     * Load every table from {@code source}, replacing any previously loaded data.
     *
     * @throws IOException if the source cannot be read
     * @throws db.tpch.integrity.IntegrityViolation for the first rejected table in load order
     */
    public LoadReport load(RowSource source) throws IOException {
        graph.reset();
        indexes.dropAll();
        long t0 = System.nanoTime();
        List<String> order = graph.loadOrder();
        log.info("Loading {} tables in order {}", order.size(), order);

        Map<String, CompletableFuture<TableLoadStats>> stageResults = new LinkedHashMap<>();
        for (String table : order) {
            TableSchema ts = catalog.requireTable(table);
            CompletableFuture<?>[] deps = ts.dependencies().stream()
                .map(stageResults::get)
                .toArray(CompletableFuture[]::new);
            stageResults.put(table, CompletableFuture.allOf(deps)
                .thenApplyAsync(v -> loadStage(ts, source), stages));
        }

        try {
            CompletableFuture.allOf(stageResults.values().toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            throw rootFailure(stageResults);
        }

        List<TableLoadStats> stats = new ArrayList<>();
        for (CompletableFuture<TableLoadStats> f : stageResults.values()) stats.add(f.join());
        if (config.deferIndexBuild) stats = buildDeferredIndexes(stats);

        LoadReport report = new LoadReport(stats, (System.nanoTime() - t0) / 1_000_000);
        log.info("Total load time: {} ms, {} rows, {} indexes", report.totalMillis(), report.totalRows(), report.totalIndexes());
        return report;
    }

    private TableLoadStats loadStage(TableSchema ts, RowSource source) {
        long t0 = System.nanoTime();
        List<Record> rows;
        try {
            rows = source.rows(ts);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        long t1 = System.nanoTime();
        TableData data = graph.registerEntity(ts.name(), rows);
        long t2 = System.nanoTime();
        TableLoadStats stats = new TableLoadStats(ts.name(), data.size(), millis(t0, t1), millis(t1, t2), 0, 0);
        if (!config.deferIndexBuild) {
            int built = indexes.buildIndexes(data).size();
            stats = stats.withIndexes(millis(t2, System.nanoTime()), built);
        }
        log.info("  {}: {} rows (read {} ms, validate {} ms)", ts.name(), data.size(), stats.readMillis(), stats.validateMillis());
        return stats;
    }

    // Indexes are rebuilt once all data is in, as after a bulk load with indexes dropped
    private List<TableLoadStats> buildDeferredIndexes(List<TableLoadStats> stats) {
        List<TableLoadStats> out = new ArrayList<>(stats.size());
        for (TableLoadStats s : stats) {
            long t0 = System.nanoTime();
            int built = indexes.buildIndexes(graph.table(s.table())).size();
            out.add(s.withIndexes(millis(t0, System.nanoTime()), built));
        }
        log.info("Indexes created: {}", out.stream().mapToInt(TableLoadStats::indexes).sum());
        return out;
    }

    // The earliest failed stage in load order holds the original cause; later ones only propagate it.
    private RuntimeException rootFailure(Map<String, CompletableFuture<TableLoadStats>> stageResults) throws IOException {
        for (Map.Entry<String, CompletableFuture<TableLoadStats>> e : stageResults.entrySet()) {
            if (!e.getValue().isCompletedExceptionally()) continue;
            Throwable cause;
            try {
                e.getValue().join();
                continue;
            } catch (CompletionException ce) {
                cause = ce.getCause();
            }
            log.error("Load of {} rejected: {}", e.getKey(), cause.getMessage());
            if (cause instanceof UncheckedIOException io) throw io.getCause();
            if (cause instanceof RuntimeException re) return re;
            if (cause instanceof Error err) throw err;
            return new IllegalStateException("Load of " + e.getKey() + " failed", cause);
        }
        return new IllegalStateException("Load failed without a failed stage");
    }

    private static long millis(long fromNanos, long toNanos) {
        return (toNanos - fromNanos) / 1_000_000;
    }

    @Override
    public void close() {
        stages.shutdown();
        if (workers != null) workers.shutdown();
    }
}
