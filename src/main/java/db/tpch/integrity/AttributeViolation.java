package db.tpch.integrity;

import db.tpch.storage.KeyTuple;

/**
 * A value outside its column's declared domain.
 */
public class AttributeViolation extends IntegrityViolation {

    public enum Rule {
        ARITY,
        NULL_NOT_ALLOWED,
        WRONG_TYPE,
        TOO_LONG,
        PRECISION,
        NEGATIVE,
        NOT_IN_ENUMERATION,
        DATE_ORDER,
        TOTAL_PRICE_MISMATCH
    }

    private final String column;
    private final Rule rule;

    public AttributeViolation(String entity, KeyTuple rowKey, String column, Rule rule, String detail) {
        super(entity, rowKey, entity + "." + column + " " + rule + " (row " + rowKey + "): " + detail);
        this.column = column;
        this.rule = rule;
    }

    public String column() { return column; }

    public Rule rule() { return rule; }
}
