package org.iceforge.dataseap.engine.query;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Execution statistics reported in the {@code property} section of a query response.
 * Fields the engine did not report are zero or null.
 */
public record QueryStats(
        long scanRows,
        long scanBytes,
        Duration duration,
        long peakMemoryBytes,
        Duration cpuTime,
        long affectedRows,
        String message
) {

    public static QueryStats fromProperties(Map<String, Object> property) {
        if (property == null || property.isEmpty()) {
            return null;
        }
        long scanRows = 0;
        long scanBytes = 0;
        long peakMemory = 0;
        long affected = 0;
        Duration duration = null;
        Duration cpu = null;
        StringBuilder message = new StringBuilder();
        for (Map.Entry<String, Object> e : property.entrySet()) {
            String key = normalize(e.getKey());
            Object v = e.getValue();
            switch (key) {
                case "scanrows" -> scanRows = toLong(v);
                case "scanbytes" -> scanBytes = toLong(v);
                case "peakmemory", "peakmemorybytes" -> peakMemory = toLong(v);
                case "affectedrows" -> affected = toLong(v);
                case "time", "duration", "querytime" -> duration = toDuration(v);
                case "cputime" -> cpu = toDuration(v);
                default -> {
                }
            }
            if (message.length() > 0) {
                message.append(", ");
            }
            message.append(e.getKey()).append(": ").append(v);
        }
        return new QueryStats(scanRows, scanBytes, duration, peakMemory, cpu, affected, message.toString());
    }

    private static String normalize(String key) {
        return key.toLowerCase(Locale.ROOT).replace(" ", "").replace("_", "");
    }

    static long toLong(Object v) {
        if (v instanceof Number n) {
            return n.longValue();
        }
        if (v == null) {
            return 0;
        }
        try {
            return Long.parseLong(v.toString().trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /** Accepts plain milliseconds or a value suffixed with {@code ms}, {@code s} or {@code m}. */
    static Duration toDuration(Object v) {
        if (v instanceof Number n) {
            return Duration.ofMillis(n.longValue());
        }
        if (v == null) {
            return null;
        }
        String s = v.toString().trim().toLowerCase(Locale.ROOT);
        try {
            if (s.endsWith("ms")) {
                return Duration.ofNanos(Math.round(Double.parseDouble(s.substring(0, s.length() - 2)) * 1_000_000d));
            }
            if (s.endsWith("s")) {
                return Duration.ofMillis(Math.round(Double.parseDouble(s.substring(0, s.length() - 1)) * 1_000d));
            }
            if (s.endsWith("m")) {
                return Duration.ofMillis(Math.round(Double.parseDouble(s.substring(0, s.length() - 1)) * 60_000d));
            }
            return Duration.ofMillis(Math.round(Double.parseDouble(s)));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
