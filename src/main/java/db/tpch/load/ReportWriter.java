package db.tpch.load;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

public class ReportWriter {
    private final Path outDir;

    public ReportWriter(Path outDir) {
        this.outDir = outDir;
    }

    // Write a JSON report with per-table row counts and timings (milliseconds)
    public Path writeJson(LoadReport report, LoaderConfig cfg) throws IOException {
        if (!Files.exists(outDir)) Files.createDirectories(outDir);
        String ts = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        Path json = outDir.resolve("load_" + ts + ".json");

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("config", cfg.asMap());

        Map<String, Object> tables = new LinkedHashMap<>();
        for (TableLoadStats s : report.tables()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("rows", s.rows());
            entry.put("read_ms", s.readMillis());
            entry.put("validate_ms", s.validateMillis());
            entry.put("index_ms", s.indexMillis());
            entry.put("indexes", s.indexes());
            tables.put(s.table(), entry);
        }
        root.put("tables", tables);
        root.put("total_rows", report.totalRows());
        root.put("total_ms", report.totalMillis());

        Gson gson = new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();
        Files.writeString(json, gson.toJson(root));
        return json;
    }
}
