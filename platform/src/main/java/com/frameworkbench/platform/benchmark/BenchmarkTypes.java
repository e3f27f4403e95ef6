package com.frameworkbench.platform.benchmark;

import com.fasterxml.jackson.annotation.JsonValue;
import com.frameworkbench.platform.config.BenchConfig;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Benchmark types - records with static factories.
 *
 * Everything a run is configured with or produces, except the derived
 * {@link AggregateResult} and the comparison records.
 */
public final class BenchmarkTypes {

    private BenchmarkTypes() {}

    // ========================================================================
    // Scenario Kind
    // ========================================================================

    public enum ScenarioKind {
        HEALTH("health", "Health Check"),
        REST("rest", "REST API"),
        GRAPHQL("graphql", "GraphQL"),
        MIXED("mixed", "Mixed Load"),
        WEBHOOK("webhook", "Shopify Webhook");

        /** Scenarios run by "all", in the order the comparison runs them. */
        public static final List<ScenarioKind> STANDARD = List.of(HEALTH, REST, GRAPHQL, MIXED);

        private final String id;
        private final String displayName;

        ScenarioKind(String id, String displayName) {
            this.id = id;
            this.displayName = displayName;
        }

        @JsonValue
        public String id() { return id; }
        public String displayName() { return displayName; }

        public static ScenarioKind fromString(String id) {
            for (var k : values()) {
                if (k.id.equalsIgnoreCase(id)) return k;
            }
            throw new IllegalArgumentException("Unknown scenario: " + id
                    + " (expected one of health, rest, graphql, mixed, webhook, all)");
        }

        /** Parse a scenario selector, where "all" expands to {@link #STANDARD}. */
        public static List<ScenarioKind> parseSelection(String selector) {
            if ("all".equalsIgnoreCase(selector)) {
                return STANDARD;
            }
            return List.of(fromString(selector));
        }
    }

    // ========================================================================
    // Error Category
    // ========================================================================

    public enum ErrorCategory {
        SUCCESS("success"),
        TIMEOUT("timeout"),
        CONNECTION_ERROR("connection_error"),
        HTTP_STATUS("http_status"),
        MALFORMED_BODY("malformed_body"),
        APPLICATION_ERROR("application_error");

        private final String id;
        ErrorCategory(String id) { this.id = id; }

        @JsonValue
        public String id() { return id; }
    }

    /**
     * Classification of one exchange. The tag is what the error breakdown groups by:
     * the category id, or {@code http_<status>} for non-2xx responses.
     */
    public record Classification(ErrorCategory category, String tag, boolean connectFailure) {

        public static Classification success() {
            return new Classification(ErrorCategory.SUCCESS, ErrorCategory.SUCCESS.id(), false);
        }

        public static Classification httpStatus(int status) {
            return new Classification(ErrorCategory.HTTP_STATUS, "http_" + status, false);
        }

        public static Classification of(ErrorCategory category) {
            return new Classification(category, category.id(), false);
        }

        /** Connection could not be established; counts against the retry budget. */
        public static Classification connectFailed() {
            return new Classification(ErrorCategory.CONNECTION_ERROR, ErrorCategory.CONNECTION_ERROR.id(), true);
        }

        public boolean isSuccess() {
            return category == ErrorCategory.SUCCESS;
        }
    }

    // ========================================================================
    // Cutoff Policy
    // ========================================================================

    /**
     * What happens to the request that is in flight when the run duration elapses.
     * Both targets of a comparison always use the same policy.
     */
    public enum CutoffPolicy {
        /** Record it; wall clock runs until every worker has joined. */
        FINISH_IN_FLIGHT("finish-in-flight"),
        /** Let it finish but drop its outcome; wall clock is the nominal duration. */
        DISCARD_LATE("discard-late");

        private final String id;
        CutoffPolicy(String id) { this.id = id; }

        @JsonValue
        public String id() { return id; }

        public static CutoffPolicy fromString(String value) {
            String v = value.toLowerCase(Locale.ROOT);
            return switch (v) {
                case "finish", "finish-in-flight" -> FINISH_IN_FLIGHT;
                case "discard", "discard-late" -> DISCARD_LATE;
                default -> throw new IllegalArgumentException(
                        "Unknown cutoff policy: " + value + " (expected finish or discard)");
            };
        }
    }

    // ========================================================================
    // Target
    // ========================================================================

    public record Target(String label, String baseUrl) {
        public Target {
            if (label == null || label.isBlank()) {
                throw new IllegalArgumentException("Target label must not be blank");
            }
            baseUrl = normalize(baseUrl);
        }

        public URI resolve(String path) {
            return URI.create(baseUrl + path);
        }

        private static String normalize(String url) {
            if (url == null || url.isBlank()) {
                throw new IllegalArgumentException("Target URL must not be blank");
            }
            URI uri;
            try {
                uri = URI.create(url.trim());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid target URL: " + url, e);
            }
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    || uri.getHost() == null) {
                throw new IllegalArgumentException("Invalid target URL (expected http(s)://host[:port]): " + url);
            }
            String s = uri.toString();
            return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
        }
    }

    // ========================================================================
    // Workload settings
    // ========================================================================

    /** Credentials and secrets the scenarios send. Never written to result files. */
    public record Workload(String userEmailDomain, String userPassword, String webhookSecret) {
        public static Workload defaults() {
            return new Workload("bench.example.com", "BenchmarkPass123!", "");
        }

        public static Workload from(BenchConfig.WorkloadConfig c) {
            return new Workload(c.userEmailDomain(), c.userPassword(), c.webhookSecret());
        }

        public boolean signsWebhooks() {
            return webhookSecret != null && !webhookSecret.isEmpty();
        }

        @Override
        public String toString() {
            return "Workload[userEmailDomain=" + userEmailDomain + ", signsWebhooks=" + signsWebhooks() + "]";
        }
    }

    // ========================================================================
    // Scenario Configuration
    // ========================================================================

    public record ScenarioConfig(
            Target target,
            ScenarioKind kind,
            int concurrency,
            Duration duration,
            Duration rampUp,
            Duration requestTimeout,
            Duration thinkTime,
            int connectRetryBudget,
            CutoffPolicy cutoffPolicy,
            long seed,
            Workload workload
    ) {
        public ScenarioConfig {
            if (target == null) throw new IllegalArgumentException("target is required");
            if (kind == null) throw new IllegalArgumentException("scenario kind is required");
            if (concurrency < 1) {
                throw new IllegalArgumentException("concurrency must be at least 1, was " + concurrency);
            }
            requireNonNegative("duration", duration);
            requireNonNegative("ramp-up", rampUp);
            requireNonNegative("think time", thinkTime);
            if (rampUp.compareTo(duration) > 0) {
                throw new IllegalArgumentException("ramp-up (" + rampUp.toMillis()
                        + "ms) must not exceed duration (" + duration.toMillis() + "ms)");
            }
            if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
                throw new IllegalArgumentException("request timeout must be positive");
            }
            if (connectRetryBudget < 0) {
                throw new IllegalArgumentException("connect retry budget must not be negative");
            }
            cutoffPolicy = cutoffPolicy != null ? cutoffPolicy : CutoffPolicy.FINISH_IN_FLIGHT;
            workload = workload != null ? workload : Workload.defaults();
        }

        public ScenarioConfig withTarget(Target t) {
            return new ScenarioConfig(t, kind, concurrency, duration, rampUp, requestTimeout,
                    thinkTime, connectRetryBudget, cutoffPolicy, seed, workload);
        }

        public ScenarioConfig withKind(ScenarioKind k) {
            return new ScenarioConfig(target, k, concurrency, duration, rampUp, requestTimeout,
                    thinkTime, connectRetryBudget, cutoffPolicy, seed, workload);
        }

        /** Same run parameters, ignoring which target they point at. */
        public boolean sameParametersAs(ScenarioConfig other) {
            return withTarget(other.target).equals(other);
        }

        public static Builder builder() { return new Builder(); }

        private static void requireNonNegative(String name, Duration d) {
            if (d == null || d.isNegative()) {
                throw new IllegalArgumentException(name + " must not be negative");
            }
        }

        public static class Builder {
            private Target target;
            private ScenarioKind kind = ScenarioKind.HEALTH;
            private int concurrency = 100;
            private Duration duration = Duration.ofSeconds(60);
            private Duration rampUp = Duration.ZERO;
            private Duration requestTimeout = Duration.ofSeconds(5);
            private Duration thinkTime = Duration.ofMillis(10);
            private int connectRetryBudget = 3;
            private CutoffPolicy cutoffPolicy = CutoffPolicy.FINISH_IN_FLIGHT;
            private long seed = 42L;
            private Workload workload = Workload.defaults();

            /** Defaults from the run and workload sections of the configuration. */
            public static Builder fromConfig(BenchConfig config) {
                var run = config.run();
                return new Builder()
                        .concurrency(run.users())
                        .duration(run.duration())
                        .rampUp(run.rampUp())
                        .requestTimeout(run.requestTimeout())
                        .thinkTime(run.thinkTime())
                        .connectRetryBudget(run.connectRetryBudget())
                        .cutoffPolicy(CutoffPolicy.fromString(run.cutoffPolicy()))
                        .seed(run.seed())
                        .workload(Workload.from(config.workload()));
            }

            public Builder target(Target v) { this.target = v; return this; }
            public Builder target(String label, String url) { this.target = new Target(label, url); return this; }
            public Builder kind(ScenarioKind v) { this.kind = v; return this; }
            public Builder concurrency(int v) { this.concurrency = v; return this; }
            public Builder duration(Duration v) { this.duration = v; return this; }
            public Builder rampUp(Duration v) { this.rampUp = v; return this; }
            public Builder requestTimeout(Duration v) { this.requestTimeout = v; return this; }
            public Builder thinkTime(Duration v) { this.thinkTime = v; return this; }
            public Builder connectRetryBudget(int v) { this.connectRetryBudget = v; return this; }
            public Builder cutoffPolicy(CutoffPolicy v) { this.cutoffPolicy = v; return this; }
            public Builder seed(long v) { this.seed = v; return this; }
            public Builder workload(Workload v) { this.workload = v; return this; }

            public ScenarioConfig build() {
                return new ScenarioConfig(target, kind, concurrency, duration, rampUp, requestTimeout,
                        thinkTime, connectRetryBudget, cutoffPolicy, seed, workload);
            }
        }
    }

    /**
     * The parameters of a run that are safe to persist alongside results
     * (no target, no workload secrets).
     */
    public record RunParameters(
            int concurrency,
            Duration duration,
            Duration rampUp,
            Duration requestTimeout,
            Duration thinkTime,
            CutoffPolicy cutoffPolicy
    ) {
        public static RunParameters of(ScenarioConfig c) {
            return new RunParameters(c.concurrency(), c.duration(), c.rampUp(),
                    c.requestTimeout(), c.thinkTime(), c.cutoffPolicy());
        }
    }

    // ========================================================================
    // Request Outcome
    // ========================================================================

    public record RequestOutcome(
            Instant timestamp,
            ScenarioKind scenario,
            String endpoint,
            Duration latency,
            boolean success,
            ErrorCategory category,
            String tag,
            int statusCode,      // 0 when no response was received
            long bytesReceived,
            boolean terminal     // last outcome of a worker that gave up
    ) {
        public static RequestOutcome of(Instant timestamp, ScenarioKind scenario, String endpoint,
                                        Duration latency, Classification c, int statusCode, long bytes) {
            return new RequestOutcome(timestamp, scenario, endpoint, latency, c.isSuccess(),
                    c.category(), c.tag(), statusCode, bytes, false);
        }

        public RequestOutcome asTerminal() {
            return new RequestOutcome(timestamp, scenario, endpoint, latency, success,
                    category, tag, statusCode, bytesReceived, true);
        }
    }

    // ========================================================================
    // Latency Statistics
    // ========================================================================

    /** Latency summary in milliseconds. */
    public record LatencyStats(
            double min,
            double mean,
            double p50,
            double p95,
            double p99,
            double max
    ) {
        public static LatencyStats empty() {
            return new LatencyStats(0, 0, 0, 0, 0, 0);
        }

        /** @param sortedNanos latencies in nanoseconds, ascending */
        public static LatencyStats from(long[] sortedNanos) {
            if (sortedNanos == null || sortedNanos.length == 0) {
                return empty();
            }
            long sum = 0;
            for (long l : sortedNanos) sum += l;
            return new LatencyStats(
                    toMillis(sortedNanos[0]),
                    (double) sum / sortedNanos.length / 1_000_000.0,
                    toMillis(nearestRank(sortedNanos, 50)),
                    toMillis(nearestRank(sortedNanos, 95)),
                    toMillis(nearestRank(sortedNanos, 99)),
                    toMillis(sortedNanos[sortedNanos.length - 1])
            );
        }

        /** Nearest-rank percentile: the value at rank ceil(p/100 * n), 1-based. */
        static long nearestRank(long[] sorted, double p) {
            int rank = (int) Math.ceil(p / 100.0 * sorted.length);
            int index = Math.min(Math.max(rank, 1), sorted.length) - 1;
            return sorted[index];
        }

        private static double toMillis(long nanos) {
            return nanos / 1_000_000.0;
        }
    }

    // ========================================================================
    // Error Breakdown
    // ========================================================================

    public record ErrorBucket(String tag, ErrorCategory category, long count, double percentOfTotal) {}
}
