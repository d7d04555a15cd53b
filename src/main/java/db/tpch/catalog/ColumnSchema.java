package db.tpch.catalog;

import java.util.List;

// Immutable data carrier for a table column.
// length: VARCHAR width or DECIMAL precision, 0 for fixed-size types.
// scale: fractional digits of a DECIMAL, 0 otherwise.
// allowedValues: closed enumeration for code columns, empty when unrestricted.
public record ColumnSchema(String name,
                           DataType type,
                           int length,
                           int scale,
                           boolean nullable,
                           boolean nonNegative,
                           List<String> allowedValues) {

    public ColumnSchema {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Column name must not be blank");
        if (type == null) throw new IllegalArgumentException("Column type must not be null: " + name);
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
    }

    public static ColumnSchema integer(String name) {
        return new ColumnSchema(name, DataType.INT, 0, 0, false, false, List.of());
    }

    public static ColumnSchema bigint(String name) {
        return new ColumnSchema(name, DataType.BIGINT, 0, 0, false, false, List.of());
    }

    public static ColumnSchema decimal(String name, int precision, int scale) {
        return new ColumnSchema(name, DataType.DECIMAL, precision, scale, false, false, List.of());
    }

    public static ColumnSchema date(String name) {
        return new ColumnSchema(name, DataType.DATE, 0, 0, false, false, List.of());
    }

    public static ColumnSchema varchar(String name, int width) {
        return new ColumnSchema(name, DataType.VARCHAR, width, 0, false, false, List.of());
    }

    public ColumnSchema asNullable() {
        return new ColumnSchema(name, type, length, scale, true, nonNegative, allowedValues);
    }

    public ColumnSchema asNonNegative() {
        return new ColumnSchema(name, type, length, scale, nullable, true, allowedValues);
    }

    public ColumnSchema oneOf(String... values) {
        return new ColumnSchema(name, type, length, scale, nullable, nonNegative, List.of(values));
    }

    // SQL rendering of the declared type, e.g. VARCHAR(25) or DECIMAL(15,2)
    public String sqlType() {
        return switch (type) {
            case VARCHAR -> "VARCHAR(" + length + ")";
            case DECIMAL -> "DECIMAL(" + length + "," + scale + ")";
            default -> type.sqlName();
        };
    }
}
