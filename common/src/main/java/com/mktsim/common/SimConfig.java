package com.mktsim.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Central configuration loaded from mktsim.yml (or classpath default).
 * All fields have sensible defaults for a single-symbol replay run.
 *
 * Times are virtual nanoseconds since the epoch. In YAML they may be given
 * either as a number or as an ISO-8601 timestamp.
 */
public final class SimConfig {

    private static final Logger log = LoggerFactory.getLogger(SimConfig.class);

    // Market
    public List<String> symbols = new ArrayList<>(List.of("ABM"));
    public long startTime = SimTime.parse("2021-03-22T09:30:00Z");
    public long endTime   = SimTime.parse("2021-03-22T16:00:00Z");

    // Kernel
    public long seed = 1L;
    public long notificationDelayNanos = 0L;
    public boolean logOrders = false;

    // Replay
    public String replayFile = null;
    public int replayAgentId = 1;

    public static SimConfig load(String path) {
        SimConfig cfg = new SimConfig();
        try {
            InputStream is = path != null && Files.exists(Paths.get(path))
                    ? Files.newInputStream(Paths.get(path))
                    : SimConfig.class.getResourceAsStream("/mktsim.yml");
            if (is == null) return cfg;
            try (is) {
                Map<String, Object> map = new Yaml().load(is);
                if (map == null) return cfg;
                applyMap(cfg, map);
            }
        } catch (Exception e) {
            log.warn("Failed to load config {}, using defaults: {}", path, e.getMessage());
        }
        return cfg;
    }

    @SuppressWarnings("unchecked")
    static void applyMap(SimConfig cfg, Map<String, Object> map) {
        if (map.containsKey("symbols")) cfg.symbols = new ArrayList<>((List<String>) map.get("symbols"));
        if (map.containsKey("startTime")) cfg.startTime = toNanos(map.get("startTime"));
        if (map.containsKey("endTime")) cfg.endTime = toNanos(map.get("endTime"));
        if (map.containsKey("seed")) cfg.seed = ((Number) map.get("seed")).longValue();
        if (map.containsKey("notificationDelayNanos")) cfg.notificationDelayNanos = ((Number) map.get("notificationDelayNanos")).longValue();
        if (map.containsKey("logOrders")) cfg.logOrders = (boolean) map.get("logOrders");
        if (map.containsKey("replayFile")) cfg.replayFile = (String) map.get("replayFile");
        if (map.containsKey("replayAgentId")) cfg.replayAgentId = (int) map.get("replayAgentId");
    }

    // SnakeYAML turns unquoted timestamps into java.util.Date
    private static long toNanos(Object value) {
        if (value instanceof Number n) return n.longValue();
        if (value instanceof Date d) return d.getTime() * 1_000_000L;
        return SimTime.parse(String.valueOf(value));
    }
}
