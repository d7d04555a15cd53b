package db.tpch.catalog;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.reflect.TypeToken;

/**
 * Registry of table and index schemas. Declaration order is preserved and used as the
 * tie-breaker for load ordering. The catalog can be exported to and re-read from a
 * directory holding {@code tables.json} and {@code indexes.json}.
 */
public class CatalogManager {
    private static final Logger log = LoggerFactory.getLogger(CatalogManager.class);

    static final String TABLES_FILE = "tables.json";
    static final String INDEXES_FILE = "indexes.json";

    private final Map<String, TableSchema> tables = new LinkedHashMap<>();
    private final Map<String, IndexSchema> indexes = new LinkedHashMap<>();

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public CatalogManager() {}

    // Catalog preloaded with the eight TPC-H tables and their secondary indexes
    public static CatalogManager tpch() {
        CatalogManager catalog = new CatalogManager();
        for (TableSchema t : TpchSchema.tables()) catalog.registerTable(t);
        for (IndexSchema i : TpchSchema.indexes()) catalog.registerIndex(i);
        return catalog;
    }

    public boolean registerTable(TableSchema tSchema) {
        if (tables.containsKey(tSchema.name())) return false;
        tables.put(tSchema.name(), tSchema);
        return true;
    }

    public TableSchema getTableSchema(String name) {
        return tables.get(name);
    }

    public TableSchema requireTable(String name) {
        TableSchema ts = tables.get(name);
        if (ts == null) throw new IllegalArgumentException("Table not found: " + name);
        return ts;
    }

    public boolean registerIndex(IndexSchema iSchema) {
        TableSchema ts = requireTable(iSchema.table());
        for (String c : iSchema.columns()) {
            if (ts.columnIndex(c) < 0) throw new IllegalArgumentException("Column not found: " + ts.name() + "." + c);
        }
        if (indexes.containsKey(iSchema.name())) return false;
        indexes.put(iSchema.name(), iSchema);
        return true;
    }

    public IndexSchema getIndexSchema(String name) {
        return indexes.get(name);
    }

    /** Index definitions declared on the given table, in declaration order. */
    public List<IndexSchema> indexSpec(String table) {
        requireTable(table);
        List<IndexSchema> out = new ArrayList<>();
        for (IndexSchema i : indexes.values()) {
            if (i.table().equals(table)) out.add(i);
        }
        return out;
    }

    public List<TableSchema> allTables() {
        return List.copyOf(tables.values());
    }

    public Map<String, IndexSchema> allIndexSchemas() {
        return Collections.unmodifiableMap(indexes);
    }

    public void save(Path dir) throws IOException {
        Files.createDirectories(dir);
        writeMap(tables, dir.resolve(TABLES_FILE));
        writeMap(indexes, dir.resolve(INDEXES_FILE));
    }

    /**
     * Replace the in-memory catalog with the one exported under {@code dir}. A missing file
     * keeps the corresponding part of the current catalog. The result is checked as
     * {@link #registerTable} and {@link #registerIndex} would; if any file is unreadable or
     * any entry fails, the error is logged and the catalog is left untouched.
     */
    public void load(Path dir) {
        Path tablesFile = dir.resolve(TABLES_FILE);
        Path indexesFile = dir.resolve(INDEXES_FILE);
        CatalogManager staged = new CatalogManager();
        try {
            Map<String, TableSchema> loadedTables = readMap(tablesFile, new TypeToken<LinkedHashMap<String, TableSchema>>(){}.getType());
            Map<String, IndexSchema> loadedIndexes = readMap(indexesFile, new TypeToken<LinkedHashMap<String, IndexSchema>>(){}.getType());
            if (loadedTables == null && loadedIndexes == null) return;

            for (TableSchema t : (loadedTables != null ? loadedTables : tables).values()) {
                if (t == null) throw new IllegalArgumentException("Empty table entry in " + tablesFile);
                if (!staged.registerTable(t)) throw new IllegalArgumentException("Duplicate table: " + t.name());
            }
            for (IndexSchema i : (loadedIndexes != null ? loadedIndexes : indexes).values()) {
                if (i == null) throw new IllegalArgumentException("Empty index entry in " + indexesFile);
                if (!staged.registerIndex(i)) throw new IllegalArgumentException("Duplicate index: " + i.name());
            }
        } catch (IOException | RuntimeException e) {
            log.error("Failed loading catalog from {}; keeping the current catalog", dir, e);
            return;
        }
        tables.clear();
        tables.putAll(staged.tables);
        indexes.clear();
        indexes.putAll(staged.indexes);
        log.info("Loaded catalog from {}: {} tables, {} indexes", dir, tables.size(), indexes.size());
    }

    // Null when the file does not exist
    private <T> Map<String, T> readMap(Path file, Type type) throws IOException {
        if (!Files.exists(file)) {
            log.warn("Catalog file not found: {}", file);
            return null;
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Map<String, T> loaded = gson.fromJson(reader, type);
            if (loaded == null) throw new IllegalArgumentException("Empty catalog file: " + file);
            return loaded;
        }
    }

    private <T> void writeMap(Map<String, T> map, Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            gson.toJson(map, writer);
        }
    }
}
