package com.lob.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Central configuration loaded from book.yml (or classpath default).
 * All fields have sensible defaults for a single-host run.
 */
public final class BookConfig {

    private static final Logger log = LoggerFactory.getLogger(BookConfig.class);

    // Identifier indexes (bucket counts are rounded up to a power of two)
    public int orderIndexBuckets = 1 << 16;
    public int priceIndexBuckets = 1 << 12;
    public long maxOrderIndexEntries = 1L << 22;  // physical entries, never reclaimed

    // Capacity budgets
    public int maxRestingOrders = 1_000_000;
    public int maxPriceLevels = 100_000;          // per side

    // Load generator
    public int loadThreads = 4;
    public int loadOrdersPerThread = 100_000;
    public double loadCancelRatio = 0.5;
    public long loadBasePrice = 10_000;
    public int loadPriceBand = 200;               // ticks either side of base

    // Metrics
    public int metricsIntervalSecs = 5;

    public static BookConfig load(String path) {
        BookConfig cfg = new BookConfig();
        try (InputStream is = path != null && Files.exists(Paths.get(path))
                ? Files.newInputStream(Paths.get(path))
                : BookConfig.class.getResourceAsStream("/book.yml")) {
            if (is == null) return cfg;
            Map<String, Object> map = new Yaml().load(is);
            if (map == null) return cfg;
            applyMap(cfg, map);
        } catch (Exception e) {
            log.warn("Failed to load config from {}, using defaults: {}", path, e.getMessage());
        }
        return cfg;
    }

    private static void applyMap(BookConfig cfg, Map<String, Object> map) {
        if (map.containsKey("orderIndexBuckets")) cfg.orderIndexBuckets = intValue(map, "orderIndexBuckets");
        if (map.containsKey("priceIndexBuckets")) cfg.priceIndexBuckets = intValue(map, "priceIndexBuckets");
        if (map.containsKey("maxOrderIndexEntries")) cfg.maxOrderIndexEntries = longValue(map, "maxOrderIndexEntries");
        if (map.containsKey("maxRestingOrders")) cfg.maxRestingOrders = intValue(map, "maxRestingOrders");
        if (map.containsKey("maxPriceLevels")) cfg.maxPriceLevels = intValue(map, "maxPriceLevels");
        if (map.containsKey("loadThreads")) cfg.loadThreads = intValue(map, "loadThreads");
        if (map.containsKey("loadOrdersPerThread")) cfg.loadOrdersPerThread = intValue(map, "loadOrdersPerThread");
        if (map.containsKey("loadCancelRatio")) cfg.loadCancelRatio = ((Number) map.get("loadCancelRatio")).doubleValue();
        if (map.containsKey("loadBasePrice")) cfg.loadBasePrice = longValue(map, "loadBasePrice");
        if (map.containsKey("loadPriceBand")) cfg.loadPriceBand = intValue(map, "loadPriceBand");
        if (map.containsKey("metricsIntervalSecs")) cfg.metricsIntervalSecs = intValue(map, "metricsIntervalSecs");
    }

    // YAML yields Integer or Long depending on magnitude
    private static int intValue(Map<String, Object> map, String key) {
        return ((Number) map.get(key)).intValue();
    }

    private static long longValue(Map<String, Object> map, String key) {
        return ((Number) map.get(key)).longValue();
    }
}
