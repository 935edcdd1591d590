package in.opsboard.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Typed lookups of process configuration. An environment variable wins; a JVM system property of
 * the same name is the fallback, which is how tests inject values.
 */
public final class Env {
    private static final Logger log = LoggerFactory.getLogger(Env.class);

    public static String get(String key, String defaultValue) {
        String value = raw(key);
        return value != null ? value : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        return parse(key, defaultValue, Integer::valueOf);
    }

    public static long getLong(String key, long defaultValue) {
        return parse(key, defaultValue, Long::valueOf);
    }

    public static boolean getBool(String key, boolean defaultValue) {
        return parse(key, defaultValue, Env::parseBool);
    }

    private static String raw(String key) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value == null || value.isEmpty() ? null : value;
    }

    private static <T> T parse(String key, T defaultValue, Function<String, T> parser) {
        String value = raw(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return parser.apply(value.trim());
        } catch (IllegalArgumentException e) {
            log.warn("[CONFIG] ignoring {}={} ({}), using {}", key, value, e.getMessage(), defaultValue);
            return defaultValue;
        }
    }

    private static Boolean parseBool(String value) {
        return switch (value.toLowerCase()) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> throw new IllegalArgumentException("not a boolean");
        };
    }

    private Env() {}
}
