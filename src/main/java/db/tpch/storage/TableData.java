package db.tpch.storage;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

import db.tpch.catalog.TableSchema;

/**
 * Fully loaded, immutable contents of one entity together with its primary-key index.
 * Instances are published only after every row passed validation and are then shared
 * read-only across threads.
 */
public final class TableData {
    private final TableSchema schema;
    private final List<Record> rows;
    private final Map<KeyTuple, Integer> primaryKeys; // key -> row id

    public TableData(TableSchema schema, List<Record> rows, Map<KeyTuple, Integer> primaryKeys) {
        this.schema = schema;
        this.rows = List.copyOf(rows);
        this.primaryKeys = Collections.unmodifiableMap(primaryKeys);
    }

    public String name() { return schema.name(); }

    public TableSchema schema() { return schema; }

    public int size() { return rows.size(); }

    public Record row(int rowId) { return rows.get(rowId); }

    public List<Record> rows() { return rows; }

    public boolean containsKey(KeyTuple key) {
        return primaryKeys.containsKey(key);
    }

    public Record findByKey(KeyTuple key) {
        Integer rowId = primaryKeys.get(key);
        return rowId == null ? null : rows.get(rowId);
    }

    // Scan in row-id order
    public void scan(BiConsumer<Integer, Record> consumer) {
        for (int i = 0; i < rows.size(); i++) consumer.accept(i, rows.get(i));
    }
}
