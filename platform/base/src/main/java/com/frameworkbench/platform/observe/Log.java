package com.frameworkbench.platform.observe;

import java.util.function.Supplier;

/**
 * Unified logging API for the benchmark tool.
 *
 * NO third-party types in this interface.
 * SLF4J and OpenTelemetry details hidden in implementation.
 *
 * Usage:
 *   import static com.frameworkbench.platform.observe.Log.*;
 *
 *   info("Starting {} run against {}", scenario, url);
 *   warn("Worker {} aborted after {} connection failures", id, failures);
 *   error("Report write failed", exception);
 *
 *   // Debug enter/exit lines + span around a unit of work
 *   traced("compare.target-a", () -> runner.run(config));
 */
public final class Log {

    private static final LogImpl impl = new LogImpl();

    private Log() {}

    // ========================================================================
    // Always-On Logging
    // ========================================================================

    public static void info(String message) {
        impl.info(message);
    }

    public static void info(String format, Object arg) {
        impl.info(format, arg);
    }

    public static void info(String format, Object arg1, Object arg2) {
        impl.info(format, arg1, arg2);
    }

    public static void info(String format, Object... args) {
        impl.info(format, args);
    }

    public static void warn(String message) {
        impl.warn(message);
    }

    public static void warn(String format, Object arg) {
        impl.warn(format, arg);
    }

    public static void warn(String format, Object arg1, Object arg2) {
        impl.warn(format, arg1, arg2);
    }

    public static void warn(String format, Object... args) {
        impl.warn(format, args);
    }

    public static void error(String message) {
        impl.error(message);
    }

    public static void error(String message, Throwable t) {
        impl.error(message, t);
    }

    public static void error(String format, Object... args) {
        impl.error(format, args);
    }

    // ========================================================================
    // Debug (disabled unless BENCH_LOG_LEVEL=DEBUG)
    // ========================================================================

    public static void debug(String format, Object... args) {
        impl.debug(format, args);
    }

    // ========================================================================
    // Traced work
    // ========================================================================

    /**
     * Execute work inside a span, with debug enter/exit lines.
     *
     *   [DEBUG] → compare.target-a
     *   [DEBUG] ← compare.target-a (2013ms)
     *
     * The span is a no-op unless an OpenTelemetry SDK or agent is installed.
     */
    public static <T> T traced(String operation, Supplier<T> work) {
        return impl.traced(operation, work);
    }

    /**
     * Add attribute to the current span.
     */
    public static void attr(String key, String value) {
        impl.attr(key, value);
    }

    public static void attr(String key, long value) {
        impl.attr(key, value);
    }
}
