package db.tpch.integrity;

import db.tpch.storage.KeyTuple;

// Duplicate primary or composite key within one entity.
public class UniquenessViolation extends IntegrityViolation {
    private final int firstRow;
    private final int duplicateRow;

    public UniquenessViolation(String entity, KeyTuple key, int firstRow, int duplicateRow) {
        super(entity, key, "Duplicate key " + key + " in " + entity
            + " (rows " + firstRow + " and " + duplicateRow + ")");
        this.firstRow = firstRow;
        this.duplicateRow = duplicateRow;
    }

    public KeyTuple key() { return rowKey(); }

    public int firstRow() { return firstRow; }

    public int duplicateRow() { return duplicateRow; }
}
