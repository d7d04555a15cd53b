package db.tpch.catalog;

import java.util.List;

// Immutable data carrier for a secondary index definition.
public record IndexSchema(String name, String table, List<String> columns) {
    public IndexSchema {
        if (name == null || table == null) throw new IllegalArgumentException("Index name and table are required");
        if (columns == null || columns.isEmpty()) throw new IllegalArgumentException("Index " + name + " has no columns");
        columns = List.copyOf(columns);
    }
}
