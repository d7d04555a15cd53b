package db.tpch.load;

// Per-entity outcome of a successful load stage. Timings in milliseconds.
public record TableLoadStats(String table, int rows, long readMillis, long validateMillis, long indexMillis, int indexes) {

    public TableLoadStats withIndexes(long millis, int count) {
        return new TableLoadStats(table, rows, readMillis, validateMillis, millis, count);
    }
}
