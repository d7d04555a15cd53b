package db.tpch.load;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import db.tpch.integrity.BusinessRules;

/**
 * Settings of a benchmark load. Built from code defaults, then overridden by a JSON file
 * and/or {@code --key=value} command-line arguments using the same key names.
 */
public class LoaderConfig {
    private static final Set<String> KEYS = Set.of("validationThreads", "chunkSize", "concurrentStages",
        "deferIndexBuild", "indexOrder", "checkDateOrder", "checkOrderTotals", "totalPriceTolerance");

    public final int validationThreads;
    public final int chunkSize;
    public final boolean concurrentStages;
    public final boolean deferIndexBuild;
    public final int indexOrder;
    public final boolean checkDateOrder;
    public final boolean checkOrderTotals;
    public final BigDecimal totalPriceTolerance;

    public LoaderConfig(int validationThreads,
                        int chunkSize,
                        boolean concurrentStages,
                        boolean deferIndexBuild,
                        int indexOrder,
                        boolean checkDateOrder,
                        boolean checkOrderTotals,
                        BigDecimal totalPriceTolerance) {
        if (validationThreads < 1) throw new IllegalArgumentException("validationThreads must be >= 1 (got " + validationThreads + ")");
        if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be >= 1 (got " + chunkSize + ")");
        if (indexOrder < 3) throw new IllegalArgumentException("indexOrder must be >= 3 (got " + indexOrder + ")");
        if (totalPriceTolerance == null || totalPriceTolerance.signum() < 0) {
            throw new IllegalArgumentException("totalPriceTolerance must be >= 0 (got " + totalPriceTolerance + ")");
        }
        this.validationThreads = validationThreads;
        this.chunkSize = chunkSize;
        this.concurrentStages = concurrentStages;
        this.deferIndexBuild = deferIndexBuild;
        this.indexOrder = indexOrder;
        this.checkDateOrder = checkDateOrder;
        this.checkOrderTotals = checkOrderTotals;
        this.totalPriceTolerance = totalPriceTolerance;
    }

    public static LoaderConfig defaultConfig() {
        return new LoaderConfig(
                Math.max(1, Runtime.getRuntime().availableProcessors()),
                10_000,                   // rows per validation chunk
                false,                    // one stage at a time
                true,                     // build indexes after the full load
                64,                       // B+ tree order
                false,                    // l_shipdate <= l_commitdate <= l_receiptdate
                false,                    // o_totalprice matches its line items
                new BigDecimal("1.00")
        );
    }

    public static LoaderConfig fromJson(Path file) throws IOException {
        return defaultConfig().withJson(file);
    }

    public static LoaderConfig fromArgs(String[] args) {
        return defaultConfig().withArgs(args);
    }

    public LoaderConfig withJson(Path file) throws IOException {
        Map<String, String> overrides = new LinkedHashMap<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            JsonElement root = JsonParser.parseReader(reader);
            if (!root.isJsonObject()) throw new IllegalArgumentException("Config file must hold a JSON object: " + file);
            JsonObject obj = root.getAsJsonObject();
            for (Map.Entry<String, JsonElement> e : obj.entrySet()) {
                overrides.put(e.getKey(), e.getValue().getAsString());
            }
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            throw new IllegalArgumentException("Invalid config file " + file + ": " + e.getMessage(), e);
        }
        return with(overrides);
    }

    // Unrelated arguments (e.g. --data=...) are left for the caller
    public LoaderConfig withArgs(String[] args) {
        Map<String, String> overrides = new LinkedHashMap<>();
        for (String a : args) {
            if (a == null) continue;
            String s = a.trim();
            if (!s.startsWith("--")) continue;
            int eq = s.indexOf('=');
            String key = eq < 0 ? s.substring(2) : s.substring(2, eq);
            String value = eq < 0 ? "true" : s.substring(eq + 1);
            if (KEYS.contains(key)) overrides.put(key, value);
        }
        return with(overrides);
    }

    public LoaderConfig with(Map<String, String> overrides) {
        int threads = validationThreads;
        int chunk = chunkSize;
        boolean concurrent = concurrentStages;
        boolean defer = deferIndexBuild;
        int order = indexOrder;
        boolean dates = checkDateOrder;
        boolean totals = checkOrderTotals;
        BigDecimal tolerance = totalPriceTolerance;

        for (Map.Entry<String, String> e : overrides.entrySet()) {
            String v = e.getValue().trim();
            try {
                switch (e.getKey()) {
                    case "validationThreads" -> threads = Integer.parseInt(v);
                    case "chunkSize" -> chunk = Integer.parseInt(v);
                    case "concurrentStages" -> concurrent = parseBoolean(v);
                    case "deferIndexBuild" -> defer = parseBoolean(v);
                    case "indexOrder" -> order = Integer.parseInt(v);
                    case "checkDateOrder" -> dates = parseBoolean(v);
                    case "checkOrderTotals" -> totals = parseBoolean(v);
                    case "totalPriceTolerance" -> tolerance = new BigDecimal(v);
                    default -> throw new IllegalArgumentException("Unknown config key: " + e.getKey());
                }
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid value for " + e.getKey() + ": " + v, ex);
            }
        }
        return new LoaderConfig(threads, chunk, concurrent, defer, order, dates, totals, tolerance);
    }

    public BusinessRules businessRules() {
        return new BusinessRules(checkDateOrder, checkOrderTotals, totalPriceTolerance);
    }

    public Map<String, Object> asMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("validationThreads", validationThreads);
        m.put("chunkSize", chunkSize);
        m.put("concurrentStages", concurrentStages);
        m.put("deferIndexBuild", deferIndexBuild);
        m.put("indexOrder", indexOrder);
        m.put("checkDateOrder", checkDateOrder);
        m.put("checkOrderTotals", checkOrderTotals);
        m.put("totalPriceTolerance", totalPriceTolerance.toPlainString());
        return m;
    }

    private static boolean parseBoolean(String v) {
        if (v.equalsIgnoreCase("true")) return true;
        if (v.equalsIgnoreCase("false")) return false;
        throw new IllegalArgumentException("Expected true or false, got: " + v);
    }
}
