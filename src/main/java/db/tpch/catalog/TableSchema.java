package db.tpch.catalog;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

// Immutable data carrier for a table schema: columns in storage order, primary key, foreign keys.
public record TableSchema(String name, List<ColumnSchema> columns, List<String> primaryKey, List<ForeignKey> foreignKeys) {

    public TableSchema {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Table name must not be blank");
        if (columns == null || columns.isEmpty()) throw new IllegalArgumentException("Table " + name + " has no columns");
        if (primaryKey == null || primaryKey.isEmpty()) throw new IllegalArgumentException("Table " + name + " has no primary key");
        columns = List.copyOf(columns);
        primaryKey = List.copyOf(primaryKey);
        foreignKeys = foreignKeys == null ? List.of() : List.copyOf(foreignKeys);
        for (String pk : primaryKey) {
            if (indexOf(columns, pk) < 0) throw new IllegalArgumentException("Primary key column not found: " + name + "." + pk);
        }
        for (ForeignKey fk : foreignKeys) {
            for (String c : fk.columns()) {
                if (indexOf(columns, c) < 0) throw new IllegalArgumentException("Foreign key column not found: " + name + "." + c);
            }
        }
    }

    public ColumnSchema column(String columnName) {
        int i = columnIndex(columnName);
        if (i < 0) throw new IllegalArgumentException("Column not found: " + name + "." + columnName);
        return columns.get(i);
    }

    // Returns -1 if not found.
    public int columnIndex(String columnName) { return indexOf(columns, columnName); }

    public int[] positions(List<String> columnNames) {
        int[] out = new int[columnNames.size()];
        for (int i = 0; i < out.length; i++) {
            int pos = columnIndex(columnNames.get(i));
            if (pos < 0) throw new IllegalArgumentException("Column not found: " + name + "." + columnNames.get(i));
            out[i] = pos;
        }
        return out;
    }

    public int[] primaryKeyPositions() { return positions(primaryKey); }

    public boolean hasCompositeKey() { return primaryKey.size() > 1; }

    // Tables this one references, in foreign-key declaration order.
    public Set<String> dependencies() {
        Set<String> deps = new LinkedHashSet<>();
        for (ForeignKey fk : foreignKeys) deps.add(fk.targetTable());
        return deps;
    }

    public List<String> columnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (ColumnSchema c : columns) names.add(c.name());
        return names;
    }

    private static int indexOf(List<ColumnSchema> cols, String columnName) {
        for (int i = 0; i < cols.size(); i++) {
            if (cols.get(i).name().equals(columnName)) return i;
        }
        return -1;
    }
}
