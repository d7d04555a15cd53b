package db.tpch.catalog;

/**
 * Supported column data types and the Java value class each one is stored as.
 */
public enum DataType {
    INT("INTEGER", Integer.class),
    BIGINT("BIGINT", Long.class),
    DECIMAL("DECIMAL", java.math.BigDecimal.class),
    DATE("DATE", java.time.LocalDate.class),
    VARCHAR("VARCHAR", String.class);

    private final String sqlName;
    private final Class<?> valueClass;

    DataType(String sqlName, Class<?> valueClass) {
        this.sqlName = sqlName;
        this.valueClass = valueClass;
    }

    public String sqlName() { return sqlName; }

    public Class<?> valueClass() { return valueClass; }
}
