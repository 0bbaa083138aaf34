package uk.co.speedyvan.realtime.bootstrap.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Lenient conversions for values read by SnakeYAML, which may arrive as numbers, booleans or strings.
 */
final class YamlValues {

    private YamlValues() {
    }

    static Map<String, Object> section(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new HashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (e.getKey() == null) continue;
                out.put(String.valueOf(e.getKey()), e.getValue());
            }
            return out;
        }
        if (value == null) {
            return null;
        }
        throw new IllegalArgumentException("Invalid configuration section: " + value);
    }

    static String trimToEmpty(Object value) {
        return value == null ? "" : value.toString().trim();
    }

    static int toInt(Object value, int defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    static long toLong(Object value, long defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    static boolean toBoolean(Object value, boolean defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }
}
