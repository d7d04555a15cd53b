package db.tpch.load;

import java.io.BufferedReader;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.tpch.catalog.ColumnSchema;
import db.tpch.catalog.TableSchema;
import db.tpch.integrity.AttributeViolation;
import db.tpch.integrity.AttributeViolation.Rule;
import db.tpch.storage.Record;

/**
 * Reads generator output files, one per table, from a directory.
 *
 * <ul>
 *   <li>{@link Format#CSV}: {@code <table>.csv}, comma separated, header row naming the
 *       columns (DuckDB {@code COPY ... (FORMAT CSV, HEADER TRUE)})</li>
 *   <li>{@link Format#TBL}: {@code <table>.tbl}, dbgen's pipe separated output without a
 *       header and with a trailing separator</li>
 * </ul>
 *
 * An unquoted empty field is an absent value; a quoted empty field ({@code ""}) is an empty string.
 */
public class CsvRowSource implements RowSource {
    private static final Logger log = LoggerFactory.getLogger(CsvRowSource.class);

    public enum Format {
        CSV(',', true, ".csv"),
        TBL('|', false, ".tbl");

        final char delimiter;
        final boolean header;
        final String extension;

        Format(char delimiter, boolean header, String extension) {
            this.delimiter = delimiter;
            this.header = header;
            this.extension = extension;
        }
    }

    private final Path dir;
    private final Format format;

    public CsvRowSource(Path dir, Format format) {
        this.dir = dir;
        this.format = format;
    }

    public Path fileFor(String table) {
        return dir.resolve(table + format.extension);
    }

    @Override
    public List<Record> rows(TableSchema schema) throws IOException {
        Path file = fileFor(schema.name());
        if (!Files.exists(file)) throw new NoSuchFileException(file.toString());
        List<Record> out = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            int[] layout = null; // file field index -> schema column position
            int lineNo = 0;
            List<Field> fields;
            while ((fields = readFields(reader)) != null) {
                lineNo++;
                if (fields.size() == 1 && isBlank(fields.get(0))) continue; // empty line
                if (layout == null) {
                    if (format.header) {
                        layout = headerLayout(schema, fields, file);
                        continue;
                    }
                    layout = identityLayout(schema);
                }
                if (format == Format.TBL && !fields.isEmpty() && isBlank(fields.get(fields.size() - 1))) {
                    fields.remove(fields.size() - 1); // trailing '|'
                }
                out.add(toRecord(schema, layout, fields, lineNo));
            }
        }
        log.debug("Read {} rows from {}", out.size(), file);
        return out;
    }

    private Record toRecord(TableSchema schema, int[] layout, List<Field> fields, int lineNo) {
        if (fields.size() != layout.length) {
            throw new AttributeViolation(schema.name(), null, "*", Rule.ARITY,
                "line " + lineNo + ": expected " + layout.length + " fields, got " + fields.size());
        }
        Object[] values = new Object[schema.columns().size()];
        for (int i = 0; i < fields.size(); i++) {
            ColumnSchema col = schema.columns().get(layout[i]);
            values[layout[i]] = convert(schema.name(), col, fields.get(i), lineNo);
        }
        return Record.of(values);
    }

    static Object convert(String entity, ColumnSchema col, Field field, int lineNo) {
        if (field.text.isEmpty() && !field.quoted) return null;
        String raw = field.text;
        try {
            return switch (col.type()) {
                case INT -> Integer.valueOf(raw.trim());
                case BIGINT -> Long.valueOf(raw.trim());
                case DECIMAL -> new BigDecimal(raw.trim());
                case DATE -> LocalDate.parse(raw.trim());
                case VARCHAR -> raw;
            };
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new AttributeViolation(entity, null, col.name(), Rule.WRONG_TYPE,
                "line " + lineNo + ": cannot parse '" + raw + "' as " + col.sqlType());
        }
    }

    private static int[] headerLayout(TableSchema schema, List<Field> header, Path file) {
        if (header.size() != schema.columns().size()) {
            throw new IllegalArgumentException("Header of " + file + " has " + header.size()
                + " columns, " + schema.name() + " has " + schema.columns().size());
        }
        int[] layout = new int[header.size()];
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i).text.trim();
            int pos = schema.columnIndex(name);
            if (pos < 0) throw new IllegalArgumentException("Unknown column '" + name + "' in header of " + file);
            layout[i] = pos;
        }
        return layout;
    }

    private static int[] identityLayout(TableSchema schema) {
        int[] layout = new int[schema.columns().size()];
        for (int i = 0; i < layout.length; i++) layout[i] = i;
        return layout;
    }

    private static boolean isBlank(Field f) {
        return f.text.isEmpty() && !f.quoted;
    }

    /**
     * Split the next logical record into fields. Quoted fields may contain the delimiter,
     * doubled quotes and line breaks. Returns null at end of input.
     */
    List<Field> readFields(BufferedReader reader) throws IOException {
        String line = reader.readLine();
        if (line == null) return null;
        List<Field> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        boolean inQuotes = false;
        int i = 0;
        while (true) {
            if (i >= line.length()) {
                if (inQuotes) {
                    String next = reader.readLine();
                    if (next == null) throw new IOException("Unterminated quoted field at end of input");
                    current.append('\n');
                    line = next;
                    i = 0;
                    continue;
                }
                fields.add(new Field(current.toString(), quoted));
                return fields;
            }
            char c = line.charAt(i);
            if (format == Format.CSV && c == '"') {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i += 2;
                    continue;
                }
                inQuotes = !inQuotes;
                quoted = true;
            } else if (c == format.delimiter && !inQuotes) {
                fields.add(new Field(current.toString(), quoted));
                current.setLength(0);
                quoted = false;
            } else {
                current.append(c);
            }
            i++;
        }
    }

    record Field(String text, boolean quoted) {}
}
