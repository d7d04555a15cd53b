package db.tpch.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.tpch.catalog.CatalogManager;
import db.tpch.catalog.ColumnSchema;
import db.tpch.catalog.DataType;
import db.tpch.catalog.IndexSchema;
import db.tpch.storage.KeyTuple;
import db.tpch.storage.Record;
import db.tpch.storage.TableData;

/**
 * Builds and serves the secondary indexes declared in the catalog. Indexes are derived from
 * loaded {@link TableData} and can be dropped and rebuilt at any time; a lookup returns the
 * same rows, in row order, as a scan filtering on the indexed column.
 */
public class IndexManager {
    private static final Logger log = LoggerFactory.getLogger(IndexManager.class);

    private final CatalogManager catalog;
    private final int order;
    private final Map<String, IndexState> indexStates = new ConcurrentHashMap<>();

    public IndexManager(CatalogManager catalog, int order) {
        this.catalog = catalog;
        this.order = order;
    }

    /** Build every index the catalog declares on the given table. */
    public List<IndexSchema> buildIndexes(TableData data) {
        List<IndexSchema> built = new ArrayList<>();
        for (IndexSchema iSchema : catalog.indexSpec(data.name())) {
            createIndex(iSchema, data);
            built.add(iSchema);
        }
        return built;
    }

    public void createIndex(IndexSchema iSchema, TableData data) {
        if (!iSchema.table().equals(data.name())) {
            throw new IllegalArgumentException("Index " + iSchema.name() + " is declared on " + iSchema.table() + ", not " + data.name());
        }
        if (iSchema.columns().size() != 1) {
            throw new IllegalArgumentException("Only single-column indexes are supported: " + iSchema.name());
        }
        int colIndex = data.schema().columnIndex(iSchema.columns().get(0));
        if (colIndex == -1) throw new IllegalArgumentException("Column not found: " + iSchema.columns().get(0));

        long t0 = System.nanoTime();
        BPlusTree<Comparable<Object>> tree = new BPlusTree<>(order);
        data.scan((rowId, rec) -> {
            Comparable<Object> key = asKey(rec.get(colIndex));
            if (key != null) tree.insert(key, rowId); // null keys are never matched by equality or range
        });
        indexStates.put(iSchema.name(), new IndexState(data, data.schema().columns().get(colIndex), tree));
        log.debug("Built index {} on {}({}): {} entries in {} ms", iSchema.name(), iSchema.table(),
            iSchema.columns().get(0), tree.size(), (System.nanoTime() - t0) / 1_000_000);
    }

    public List<Record> lookup(String indexName, Object key) {
        IndexState state = requireIndex(indexName);
        if (key == null) return List.of();
        return toRecords(state, state.tree.search(asKey(state, key)));
    }

    /**
     * Range lookup using an index. Returns all records whose indexed key is in [lowInclusive, highInclusive].
     * If the range is empty (low > high) an empty list is returned.
     */
    public List<Record> rangeLookup(String indexName, Object lowInclusive, Object highInclusive) {
        IndexState state = requireIndex(indexName);
        if (lowInclusive == null || highInclusive == null) throw new IllegalArgumentException("Range bounds must not be null");
        return toRecords(state, state.tree.rangeSearch(asKey(state, lowInclusive), asKey(state, highInclusive)));
    }

    public boolean isBuilt(String indexName) {
        return indexStates.containsKey(indexName);
    }

    public int entryCount(String indexName) {
        return requireIndex(indexName).tree.size();
    }

    public void dropAll() {
        indexStates.clear();
    }

    private IndexState requireIndex(String indexName) {
        IndexState state = indexStates.get(indexName);
        if (state == null) throw new IllegalArgumentException("Index not found: " + indexName);
        return state;
    }

    private static List<Record> toRecords(IndexState state, List<Integer> rowIds) {
        List<Record> out = new ArrayList<>(rowIds.size());
        for (int rowId : rowIds) out.add(state.data.row(rowId));
        return out;
    }

    // Integral columns accept any integral key; everything else must match the column's value class
    private static Comparable<Object> asKey(IndexState state, Object value) {
        ColumnSchema col = state.column;
        boolean integral = col.type() == DataType.INT || col.type() == DataType.BIGINT;
        boolean matches = integral
            ? value instanceof Integer || value instanceof Long || value instanceof Short
            : col.type().valueClass().isInstance(value);
        if (!matches) {
            throw new IllegalArgumentException("Key " + value + " (" + value.getClass().getSimpleName()
                + ") does not match " + col.name() + " " + col.sqlType());
        }
        return asKey(value);
    }

    @SuppressWarnings("unchecked")
    private static Comparable<Object> asKey(Object value) {
        Object v = KeyTuple.normalize(value);
        if (v != null && !(v instanceof Comparable)) {
            throw new IllegalArgumentException("Index key is not comparable: " + v.getClass().getSimpleName());
        }
        return (Comparable<Object>) v;
    }

    // Runtime index state holder
    private static final class IndexState {
        final TableData data;
        final ColumnSchema column;
        final BPlusTree<Comparable<Object>> tree;

        IndexState(TableData data, ColumnSchema column, BPlusTree<Comparable<Object>> tree) {
            this.data = data;
            this.column = column;
            this.tree = tree;
        }
    }
}
