package db.tpch.load;

import java.util.List;

/**
 * Summary of a completed load, one entry per entity in load order.
 */
public record LoadReport(List<TableLoadStats> tables, long totalMillis) {

    public LoadReport {
        tables = List.copyOf(tables);
    }

    public long totalRows() {
        long sum = 0;
        for (TableLoadStats t : tables) sum += t.rows();
        return sum;
    }

    public TableLoadStats stats(String table) {
        for (TableLoadStats t : tables) {
            if (t.table().equals(table)) return t;
        }
        return null;
    }

    public int totalIndexes() {
        int sum = 0;
        for (TableLoadStats t : tables) sum += t.indexes();
        return sum;
    }
}
