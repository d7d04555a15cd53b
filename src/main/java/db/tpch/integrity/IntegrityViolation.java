package db.tpch.integrity;

import db.tpch.storage.KeyTuple;

/**
 * Base of every data-quality failure detected while validating an entity batch.
 * Violations are deterministic; the input has to be corrected, a retry cannot succeed.
 */
public abstract class IntegrityViolation extends RuntimeException {
    private final String entity;
    private final KeyTuple rowKey;

    protected IntegrityViolation(String entity, KeyTuple rowKey, String message) {
        super(message);
        this.entity = entity;
        this.rowKey = rowKey;
    }

    public String entity() { return entity; }

    // Primary key of the offending row; null when the row could not be keyed
    public KeyTuple rowKey() { return rowKey; }
}
