package db.tpch.model;

import db.tpch.catalog.TpchSchema;
import db.tpch.storage.KeyTuple;
import db.tpch.storage.Record;

public record Nation(int nationKey, String name, int regionKey, String comment) implements Entity {

    @Override
    public String table() { return TpchSchema.NATION; }

    @Override
    public KeyTuple key() { return KeyTuple.of(nationKey); }

    @Override
    public Record toRecord() { return Record.of(nationKey, name, regionKey, comment); }

    public static Nation fromRecord(Record r) {
        return new Nation((Integer) r.get(0), (String) r.get(1), (Integer) r.get(2), (String) r.get(3));
    }
}
