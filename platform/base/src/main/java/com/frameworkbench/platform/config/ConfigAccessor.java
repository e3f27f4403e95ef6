package com.frameworkbench.platform.config;

import com.typesafe.config.Config;

import java.time.Duration;
import java.util.Optional;

/**
 * Simple utility for accessing HOCON config values with Optional support.
 *
 * Eliminates boilerplate like:
 * <pre>
 *   // Before:
 *   return config.hasPath(path) ? Optional.of(config.getInt(path)) : Optional.empty();
 *
 *   // After:
 *   return ConfigAccessor.intVal(config, path);
 * </pre>
 *
 * All methods follow the same pattern:
 * - Optional variant: returns Optional.empty() if path missing
 * - Default variant: returns default value if path missing
 */
public final class ConfigAccessor {

    private ConfigAccessor() {} // Utility class

    // =========================================================================
    // String
    // =========================================================================

    public static Optional<String> string(Config c, String path) {
        return c.hasPath(path) ? Optional.of(c.getString(path)) : Optional.empty();
    }

    public static String string(Config c, String path, String defaultValue) {
        return c.hasPath(path) ? c.getString(path) : defaultValue;
    }

    // =========================================================================
    // Integer
    // =========================================================================

    public static Optional<Integer> intVal(Config c, String path) {
        return c.hasPath(path) ? Optional.of(c.getInt(path)) : Optional.empty();
    }

    public static int intVal(Config c, String path, int defaultValue) {
        return c.hasPath(path) ? c.getInt(path) : defaultValue;
    }

    // =========================================================================
    // Long
    // =========================================================================

    public static long longVal(Config c, String path, long defaultValue) {
        return c.hasPath(path) ? c.getLong(path) : defaultValue;
    }

    // =========================================================================
    // Double
    // =========================================================================

    public static double doubleVal(Config c, String path, double defaultValue) {
        return c.hasPath(path) ? c.getDouble(path) : defaultValue;
    }

    // =========================================================================
    // Duration
    // =========================================================================

    public static Optional<Duration> duration(Config c, String path) {
        return c.hasPath(path) ? Optional.of(c.getDuration(path)) : Optional.empty();
    }

    public static Duration duration(Config c, String path, Duration defaultValue) {
        return c.hasPath(path) ? c.getDuration(path) : defaultValue;
    }
}
