package db.tpch.catalog;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the catalog as SQL DDL: the contract handed to a database engine.
 *
 * <p>Single-column foreign keys are declared inline on tables with a single-column primary key;
 * tables with a composite primary key carry table-level PRIMARY KEY and FOREIGN KEY clauses.
 * {@link #foreignKeyStatements} produces the ALTER TABLE form used to re-attach constraints
 * after a bulk load.
 */
public final class DdlRenderer {
    private static final String INDENT = "    ";

    private final String schemaName;

    public DdlRenderer(String schemaName) {
        this.schemaName = schemaName;
    }

    public String render(CatalogManager catalog) {
        StringBuilder sb = new StringBuilder();
        sb.append("CREATE SCHEMA IF NOT EXISTS ").append(schemaName).append(";\n");
        sb.append("SET search_path TO ").append(schemaName).append(";\n");
        for (TableSchema ts : catalog.allTables()) {
            sb.append('\n').append(createTable(ts)).append('\n');
        }
        sb.append('\n');
        for (IndexSchema is : catalog.allIndexSchemas().values()) {
            sb.append(createIndex(is, false)).append('\n');
        }
        return sb.toString();
    }

    public String createTable(TableSchema ts) {
        boolean inlineKeys = !ts.hasCompositeKey();
        int nameWidth = 0;
        int typeWidth = 0;
        for (ColumnSchema c : ts.columns()) {
            nameWidth = Math.max(nameWidth, c.name().length());
            typeWidth = Math.max(typeWidth, c.sqlType().length());
        }

        List<String> lines = new ArrayList<>();
        for (ColumnSchema c : ts.columns()) {
            StringBuilder line = new StringBuilder(INDENT)
                .append(pad(c.name(), nameWidth + 2))
                .append(pad(c.sqlType(), typeWidth));
            if (!c.nullable()) line.append(" NOT NULL");
            if (inlineKeys && ts.primaryKey().contains(c.name())) line.append(" PRIMARY KEY");
            if (inlineKeys) {
                for (ForeignKey fk : ts.foreignKeys()) {
                    if (!fk.isComposite() && fk.columns().get(0).equals(c.name())) {
                        line.append(" REFERENCES ").append(fk.targetTable())
                            .append('(').append(fk.targetColumns().get(0)).append(')');
                    }
                }
            }
            lines.add(stripTrailing(line));
        }
        if (!inlineKeys) {
            lines.add(INDENT + "PRIMARY KEY (" + String.join(", ", ts.primaryKey()) + ")");
            for (ForeignKey fk : ts.foreignKeys()) {
                lines.add(INDENT + "FOREIGN KEY (" + String.join(", ", fk.columns()) + ") REFERENCES "
                    + fk.targetTable() + "(" + String.join(", ", fk.targetColumns()) + ")");
            }
        }
        return "CREATE TABLE " + ts.name() + " (\n" + String.join(",\n", lines) + "\n);";
    }

    public String createIndex(IndexSchema is, boolean qualified) {
        String table = qualified ? schemaName + "." + is.table() : is.table();
        return "CREATE INDEX IF NOT EXISTS " + is.name() + " ON " + table + "(" + String.join(", ", is.columns()) + ");";
    }

    public List<String> foreignKeyStatements(CatalogManager catalog) {
        List<String> out = new ArrayList<>();
        for (TableSchema ts : catalog.allTables()) {
            for (ForeignKey fk : ts.foreignKeys()) {
                out.add("ALTER TABLE " + schemaName + "." + ts.name()
                    + " ADD FOREIGN KEY (" + String.join(", ", fk.columns()) + ") REFERENCES "
                    + schemaName + "." + fk.targetTable() + "(" + String.join(", ", fk.targetColumns()) + ");");
            }
        }
        return out;
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) return s;
        StringBuilder sb = new StringBuilder(width);
        sb.append(s);
        for (int i = s.length(); i < width; i++) sb.append(' ');
        return sb.toString();
    }

    private static String stripTrailing(StringBuilder sb) {
        return sb.toString().stripTrailing();
    }
}
