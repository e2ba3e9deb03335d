package org.carball.dbbench.config;

import lombok.EqualsAndHashCode;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Settings slice of one advisor rule. Values come from YAML, environment variables or CLI
 * arguments, so numbers may arrive as strings. Malformed values fall back to the caller's default.
 */
@Slf4j
@EqualsAndHashCode
public final class RuleSettings {

    public static final String ENABLED = "enabled";

    private static final RuleSettings EMPTY = new RuleSettings(Map.of());

    private final Map<String, Object> values;

    private RuleSettings(Map<String, Object> values) {
        this.values = values;
    }

    public static RuleSettings empty() {
        return EMPTY;
    }

    public static RuleSettings of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new RuleSettings(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public RuleSettings with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new RuleSettings(Collections.unmodifiableMap(copy));
    }

    public boolean isEnabled() {
        return getBoolean(ENABLED, true);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public int getInt(String key, int defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", key, value);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", key, value);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        return toBoolean(key, values.get(key), defaultValue);
    }

    /**
     * Reads a flag written as a boolean or as true/false, yes/no, on/off or 1/0.
     */
    static boolean toBoolean(String key, Object value, boolean defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        switch (text) {
            case "true":
            case "yes":
            case "on":
            case "1":
                return true;
            case "false":
            case "no":
            case "off":
            case "0":
                return false;
            default:
                log.warn("Invalid boolean value for {}: {}", key, value);
                return defaultValue;
        }
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
