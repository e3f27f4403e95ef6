package com.frameworkbench.platform.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;

import static com.frameworkbench.platform.config.ConfigAccessor.*;

/**
 * Type-safe access to benchmark configuration.
 *
 * Uses record classes for immutable, concise config objects.
 * All nested configs are records with static from(Config) factories.
 *
 * Example:
 * <pre>
 *   var config = BenchConfig.load();
 *   String url = config.targets().a().url();
 *   Duration timeout = config.run().requestTimeout();
 * </pre>
 *
 * Values come from {@code reference.conf} under the {@code bench} root and can be
 * overridden by {@code application.conf}, {@code -Dconfig.file} or system properties
 * such as {@code -Dbench.run.users=50}.
 */
public final class BenchConfig {

    private static final String ROOT = "bench";
    private static volatile BenchConfig instance;

    private final TargetsConfig targets;
    private final RunConfig run;
    private final CompareConfig compare;
    private final ReportConfig report;
    private final WorkloadConfig workload;

    private BenchConfig(Config config) {
        Config c = config.getConfig(ROOT);
        this.targets = TargetsConfig.from(c.getConfig("targets"));
        this.run = RunConfig.from(c.getConfig("run"));
        this.compare = CompareConfig.from(c.getConfig("compare"));
        this.report = ReportConfig.from(c.getConfig("report"));
        this.workload = WorkloadConfig.from(c.getConfig("workload"));
    }

    public static BenchConfig load() {
        if (instance == null) {
            synchronized (BenchConfig.class) {
                if (instance == null) {
                    instance = new BenchConfig(ConfigFactory.load());
                }
            }
        }
        return instance;
    }

    /** Build from an explicit config, falling back to reference.conf for missing paths. */
    public static BenchConfig from(Config config) {
        return new BenchConfig(config.withFallback(ConfigFactory.defaultReference()).resolve());
    }

    public static void reload() {
        synchronized (BenchConfig.class) {
            ConfigFactory.invalidateCaches();
            instance = null;
        }
    }

    public TargetsConfig targets()   { return targets; }
    public RunConfig run()           { return run; }
    public CompareConfig compare()   { return compare; }
    public ReportConfig report()     { return report; }
    public WorkloadConfig workload() { return workload; }

    // =========================================================================
    // Record: TargetsConfig
    // =========================================================================

    public record TargetsConfig(TargetConfig a, TargetConfig b) {
        public static TargetsConfig from(Config c) {
            return new TargetsConfig(
                TargetConfig.from(c.getConfig("a")),
                TargetConfig.from(c.getConfig("b"))
            );
        }
    }

    public record TargetConfig(String label, String url) {
        public static TargetConfig from(Config c) {
            return new TargetConfig(c.getString("label"), c.getString("url"));
        }
    }

    // =========================================================================
    // Record: RunConfig
    // =========================================================================

    public record RunConfig(
        int users,
        Duration duration,
        Duration rampUp,
        Duration requestTimeout,
        Duration thinkTime,
        int connectRetryBudget,
        String cutoffPolicy,
        long seed
    ) {
        public static RunConfig from(Config c) {
            return new RunConfig(
                c.getInt("users"),
                c.getDuration("duration"),
                ConfigAccessor.duration(c, "ramp-up", Duration.ZERO),
                c.getDuration("request-timeout"),
                ConfigAccessor.duration(c, "think-time", Duration.ZERO),
                intVal(c, "connect-retry-budget", 3),
                string(c, "cutoff-policy", "finish-in-flight"),
                longVal(c, "seed", 42L)
            );
        }
    }

    // =========================================================================
    // Record: CompareConfig
    // =========================================================================

    public record CompareConfig(
        Duration pauseBetweenTargets,
        Duration pauseBetweenScenarios,
        double significanceThresholdPercent
    ) {
        public static CompareConfig from(Config c) {
            return new CompareConfig(
                c.getDuration("pause-between-targets"),
                c.getDuration("pause-between-scenarios"),
                doubleVal(c, "significance-threshold-percent", 1.0)
            );
        }
    }

    // =========================================================================
    // Record: ReportConfig
    // =========================================================================

    public record ReportConfig(String resultsDir, String defaultFormat) {
        public static ReportConfig from(Config c) {
            return new ReportConfig(
                string(c, "results-dir", "./reports"),
                string(c, "default-format", "markdown")
            );
        }
    }

    // =========================================================================
    // Record: WorkloadConfig
    // =========================================================================

    public record WorkloadConfig(
        String userEmailDomain,
        String userPassword,
        String webhookSecret
    ) {
        public static WorkloadConfig from(Config c) {
            return new WorkloadConfig(
                c.getString("user-email-domain"),
                c.getString("user-password"),
                string(c, "webhook-secret", "")
            );
        }
    }
}
