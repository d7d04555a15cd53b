package db.tpch;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import db.tpch.catalog.CatalogManager;
import db.tpch.catalog.DdlRenderer;
import db.tpch.catalog.TpchSchema;
import db.tpch.cli.TablePrinter;
import db.tpch.integrity.IntegrityViolation;
import db.tpch.load.BenchmarkLoader;
import db.tpch.load.CsvRowSource;
import db.tpch.load.LoadReport;
import db.tpch.load.LoaderConfig;
import db.tpch.load.ReportWriter;
import db.tpch.load.TableLoadStats;

public class Main {
    public static void main(String[] args) throws IOException {
        Map<String, String> opts = parseOptions(args);
        if (opts.isEmpty() || opts.containsKey("help")) {
            printUsage();
            return;
        }

        CatalogManager catalog = CatalogManager.tpch();
        DdlRenderer ddl = new DdlRenderer(TpchSchema.SCHEMA_NAME);
        if (opts.containsKey("ddl")) {
            System.out.println(ddl.render(catalog));
        }
        if (opts.containsKey("catalog-out")) {
            Path dir = Paths.get(opts.get("catalog-out"));
            catalog.save(dir);
            System.out.println("Catalog written to: " + dir.toAbsolutePath());
        }
        if (!opts.containsKey("data")) return;

        LoaderConfig cfg = LoaderConfig.defaultConfig();
        if (opts.containsKey("config")) cfg = cfg.withJson(Paths.get(opts.get("config")));
        cfg = cfg.withArgs(args);

        CsvRowSource.Format format = CsvRowSource.Format.valueOf(opts.getOrDefault("format", "csv").toUpperCase(Locale.ROOT));
        Path dataDir = Paths.get(opts.get("data"));
        System.out.println("Loading TPC-H data from: " + dataDir.toAbsolutePath() + " (" + format + ")\n");

        try (BenchmarkLoader loader = new BenchmarkLoader(catalog, cfg)) {
            LoadReport report = loader.load(new CsvRowSource(dataDir, format));
            List<List<Object>> rows = new ArrayList<>();
            for (TableLoadStats s : report.tables()) {
                rows.add(List.of(s.table(), s.rows(), s.readMillis(), s.validateMillis(), s.indexes(), s.indexMillis()));
            }
            TablePrinter.print(List.of("table", "rows", "read_ms", "validate_ms", "indexes", "index_ms"), rows, System.out);
            System.out.println("\nTotal load time: " + report.totalMillis() + " ms");
            if (opts.containsKey("report")) {
                Path json = new ReportWriter(Paths.get(opts.get("report"))).writeJson(report, cfg);
                System.out.println("Wrote JSON to: " + json.toAbsolutePath());
            }
        } catch (IntegrityViolation v) {
            System.err.println("Load rejected: " + v.getMessage());
            for (Throwable more : v.getSuppressed()) System.err.println("  also: " + more.getMessage());
            System.exit(1);
        }
    }

    // --name=value pairs; a bare --flag maps to "true"
    static Map<String, String> parseOptions(String[] args) {
        Map<String, String> opts = new HashMap<>();
        for (String a : args) {
            if (a == null || !a.startsWith("--")) continue;
            int eq = a.indexOf('=');
            if (eq < 0) opts.put(a.substring(2), "true");
            else opts.put(a.substring(2, eq), a.substring(eq + 1));
        }
        return opts;
    }

    private static void printUsage() {
        System.out.println("Usage: Main [--ddl] [--catalog-out=<dir>] [--data=<dir> [--format=csv|tbl] [--config=<file>] [--report=<dir>]]");
        System.out.println("  --ddl                 print the schema DDL");
        System.out.println("  --catalog-out=<dir>   write tables.json and indexes.json");
        System.out.println("  --data=<dir>          load <table>.csv (or .tbl) files and validate them");
        System.out.println("  --config=<file>       JSON file with loader settings");
        System.out.println("  --<setting>=<value>   override one loader setting, e.g. --validationThreads=4 --checkDateOrder");
    }
}
