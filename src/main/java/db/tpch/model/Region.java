package db.tpch.model;

import db.tpch.catalog.TpchSchema;
import db.tpch.storage.KeyTuple;
import db.tpch.storage.Record;

public record Region(int regionKey, String name, String comment) implements Entity {

    @Override
    public String table() { return TpchSchema.REGION; }

    @Override
    public KeyTuple key() { return KeyTuple.of(regionKey); }

    @Override
    public Record toRecord() { return Record.of(regionKey, name, comment); }

    public static Region fromRecord(Record r) {
        return new Region((Integer) r.get(0), (String) r.get(1), (String) r.get(2));
    }
}
