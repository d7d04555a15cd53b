package db.tpch.model;

import db.tpch.storage.KeyTuple;
import db.tpch.storage.Record;

/**
 * Typed view of one row of a TPC-H entity.
 */
public interface Entity {

    // Catalog table this row belongs to
    String table();

    KeyTuple key();

    // Column values in catalog order
    Record toRecord();
}
