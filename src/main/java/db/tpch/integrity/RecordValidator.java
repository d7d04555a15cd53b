package db.tpch.integrity;

import java.math.BigDecimal;
import java.util.List;

import db.tpch.catalog.ColumnSchema;
import db.tpch.catalog.TableSchema;
import db.tpch.integrity.AttributeViolation.Rule;
import db.tpch.storage.KeyTuple;
import db.tpch.storage.Record;

/**
 * Checks a single record against its entity's column definitions: arity, nullability,
 * value class, VARCHAR width, DECIMAL precision and scale, sign and enumerations.
 * Pure; nothing is normalized or repaired.
 */
public final class RecordValidator {

    private RecordValidator() {}

    public static void validate(TableSchema schema, Record record) {
        List<ColumnSchema> columns = schema.columns();
        if (record.arity() != columns.size()) {
            throw new AttributeViolation(schema.name(), null, "*", Rule.ARITY,
                "expected " + columns.size() + " values, got " + record.arity());
        }
        KeyTuple rowKey = rowKey(schema, record);
        for (int i = 0; i < columns.size(); i++) {
            validateValue(schema.name(), rowKey, columns.get(i), record.get(i));
        }
    }

    // Best-effort key for error reports; the key columns themselves may still be invalid.
    public static KeyTuple rowKey(TableSchema schema, Record record) {
        if (record.arity() != schema.columns().size()) return null;
        return record.key(schema.primaryKeyPositions());
    }

    static void validateValue(String entity, KeyTuple rowKey, ColumnSchema col, Object v) {
        if (v == null) {
            if (!col.nullable()) {
                throw new AttributeViolation(entity, rowKey, col.name(), Rule.NULL_NOT_ALLOWED, "value is absent");
            }
            return;
        }
        if (!col.type().valueClass().isInstance(v)) {
            throw new AttributeViolation(entity, rowKey, col.name(), Rule.WRONG_TYPE,
                "expected " + col.sqlType() + ", got " + v.getClass().getSimpleName());
        }
        switch (col.type()) {
            case INT -> checkSign(entity, rowKey, col, (Integer) v < 0, v);
            case BIGINT -> checkSign(entity, rowKey, col, (Long) v < 0, v);
            case DECIMAL -> {
                BigDecimal d = (BigDecimal) v;
                if (d.scale() > col.scale()) {
                    throw new AttributeViolation(entity, rowKey, col.name(), Rule.PRECISION,
                        d.toPlainString() + " has more than " + col.scale() + " fractional digits");
                }
                if (d.setScale(col.scale()).precision() > col.length()) {
                    throw new AttributeViolation(entity, rowKey, col.name(), Rule.PRECISION,
                        d.toPlainString() + " exceeds " + col.sqlType());
                }
                checkSign(entity, rowKey, col, d.signum() < 0, v);
            }
            case VARCHAR -> {
                String s = (String) v;
                int len = s.codePointCount(0, s.length());
                if (col.length() > 0 && len > col.length()) {
                    throw new AttributeViolation(entity, rowKey, col.name(), Rule.TOO_LONG,
                        "max=" + col.length() + " characters, got=" + len);
                }
                if (!col.allowedValues().isEmpty() && !col.allowedValues().contains(s)) {
                    throw new AttributeViolation(entity, rowKey, col.name(), Rule.NOT_IN_ENUMERATION,
                        "'" + s + "' not in " + col.allowedValues());
                }
            }
            case DATE -> { }
        }
    }

    private static void checkSign(String entity, KeyTuple rowKey, ColumnSchema col, boolean negative, Object v) {
        if (negative && col.nonNegative()) {
            throw new AttributeViolation(entity, rowKey, col.name(), Rule.NEGATIVE, "got " + v);
        }
    }
}
