package db.tpch.integrity;

import java.util.List;

import db.tpch.storage.KeyTuple;

/**
 * A foreign key, single or composite, with no matching row in its target entity.
 */
public class DanglingReference extends IntegrityViolation {
    private final List<String> columns;
    private final KeyTuple key;
    private final String targetEntity;
    private final List<String> targetKey;

    public DanglingReference(String entity, KeyTuple rowKey, List<String> columns, KeyTuple key,
                             String targetEntity, List<String> targetKey) {
        super(entity, rowKey, "DanglingReference{entity: " + entity + ", key: " + key
            + ", targetEntity: " + targetEntity + ", targetKey: " + String.join(", ", targetKey)
            + "} at row " + rowKey);
        this.columns = List.copyOf(columns);
        this.key = key;
        this.targetEntity = targetEntity;
        this.targetKey = List.copyOf(targetKey);
    }

    // Referencing columns in the offending entity
    public List<String> columns() { return columns; }

    // The foreign-key value that found no target
    public KeyTuple key() { return key; }

    public String targetEntity() { return targetEntity; }

    public List<String> targetKey() { return targetKey; }
}
