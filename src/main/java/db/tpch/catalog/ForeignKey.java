package db.tpch.catalog;

import java.util.List;

/**
 * A foreign-key edge of the referential graph. Single-column and composite keys share
 * this shape; a composite key is always matched as one tuple against the target key.
 */
public record ForeignKey(String table, List<String> columns, String targetTable, List<String> targetColumns) {

    public ForeignKey {
        columns = List.copyOf(columns);
        targetColumns = List.copyOf(targetColumns);
        if (columns.isEmpty() || columns.size() != targetColumns.size()) {
            throw new IllegalArgumentException("Foreign key " + table + columns
                + " does not match target " + targetTable + targetColumns);
        }
    }

    public boolean isComposite() { return columns.size() > 1; }

    @Override
    public String toString() {
        return table + "(" + String.join(", ", columns) + ") -> "
            + targetTable + "(" + String.join(", ", targetColumns) + ")";
    }
}
