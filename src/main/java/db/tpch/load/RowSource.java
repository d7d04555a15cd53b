package db.tpch.load;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import db.tpch.catalog.TableSchema;
import db.tpch.storage.Record;

/**
 * Producer of entity batches, typically the output of the benchmark data generator.
 * The loader asks for each entity once, in dependency order.
 */
@FunctionalInterface
public interface RowSource {

    List<Record> rows(TableSchema schema) throws IOException;

    // Batches held in memory; a table without an entry yields an empty batch
    static RowSource of(Map<String, List<Record>> batches) {
        return schema -> batches.getOrDefault(schema.name(), List.of());
    }
}
