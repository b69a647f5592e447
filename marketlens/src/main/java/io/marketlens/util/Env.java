package io.marketlens.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Function;

/**
 * Configuration lookup: environment variable first, then JVM system property, then default.
 * Malformed numbers fall back to the default with a warning.
 */
public final class Env {
    private static final Logger log = LoggerFactory.getLogger(Env.class);

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        return parse(key, defaultValue, Integer::parseInt);
    }

    public static long getLong(String key, long defaultValue) {
        return parse(key, defaultValue, Long::parseLong);
    }

    /**
     * Duration configured as a number of milliseconds.
     */
    public static Duration getMillis(String key, long defaultMillis) {
        long millis = getLong(key, defaultMillis);
        if (millis <= 0) {
            log.warn("[CONFIG] {}={} is not positive, using {}ms", key, millis, defaultMillis);
            millis = defaultMillis;
        }
        return Duration.ofMillis(millis);
    }

    public static boolean getBool(String key, boolean defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    private static <T> T parse(String key, T defaultValue, Function<String, T> parser) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return parser.apply(value.trim());
        } catch (NumberFormatException e) {
            log.warn("[CONFIG] {}={} is not a number, using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private Env() {}
}
