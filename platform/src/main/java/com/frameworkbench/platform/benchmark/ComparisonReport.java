package com.frameworkbench.platform.benchmark;

import com.frameworkbench.platform.benchmark.BenchmarkTypes.ScenarioKind;

import java.util.Locale;

/**
 * Side-by-side result of one scenario run against two frameworks.
 */
public record ComparisonReport(
        ScenarioKind scenario,
        AggregateResult a,
        AggregateResult b,
        Deltas deltas,
        Verdict verdict
) {
    public static final double DEFAULT_THRESHOLD_PERCENT = 1.0;

    public static ComparisonReport of(AggregateResult a, AggregateResult b) {
        return of(a, b, DEFAULT_THRESHOLD_PERCENT);
    }

    public static ComparisonReport of(AggregateResult a, AggregateResult b, double thresholdPercent) {
        return new ComparisonReport(a.scenario(), a, b, Deltas.between(a, b), Verdict.decide(a, b, thresholdPercent));
    }

    // ========================================================================
    // Deltas
    // ========================================================================

    /**
     * Relative differences in percent, null where A's baseline is 0 and B's is not.
     *
     * Throughput is (B - A) / A, positive when B served more. Latencies are (A - B) / A,
     * positive when B was faster.
     */
    public record Deltas(
            Double throughputPct,
            Double meanLatencyPct,
            Double p95LatencyPct,
            Double p99LatencyPct
    ) {
        public static Deltas between(AggregateResult a, AggregateResult b) {
            return new Deltas(
                    percent(b.requestsPerSecond() - a.requestsPerSecond(), a.requestsPerSecond(), b.requestsPerSecond()),
                    percent(a.latency().mean() - b.latency().mean(), a.latency().mean(), b.latency().mean()),
                    percent(a.latency().p95() - b.latency().p95(), a.latency().p95(), b.latency().p95()),
                    percent(a.latency().p99() - b.latency().p99(), a.latency().p99(), b.latency().p99())
            );
        }

        private static Double percent(double difference, double baseline, double other) {
            if (baseline == 0.0) {
                return other == 0.0 ? 0.0 : null;
            }
            return difference / baseline * 100.0;
        }
    }

    // ========================================================================
    // Verdict
    // ========================================================================

    /**
     * Winner per dimension. A winner is null when the difference is below the threshold;
     * a margin is null when one side had no successful requests and lost outright.
     */
    public record Verdict(
            String throughputWinner,
            Double throughputMarginPct,
            String throughput,
            String responseTimeWinner,
            Double responseTimeMarginPct,
            String responseTime
    ) {
        static final String NO_THROUGHPUT_DIFFERENCE = "No significant difference in throughput";
        static final String NO_RESPONSE_TIME_DIFFERENCE = "No significant difference in response time";

        public static Verdict decide(AggregateResult a, AggregateResult b, double thresholdPercent) {
            String la = a.framework();
            String lb = b.framework();

            if (!a.hasSuccesses() || !b.hasSuccesses()) {
                if (!a.hasSuccesses() && !b.hasSuccesses()) {
                    String none = "No successful requests from either framework";
                    return new Verdict(null, null, none, null, null, none);
                }
                String winner = a.hasSuccesses() ? la : lb;
                String loser = a.hasSuccesses() ? lb : la;
                return new Verdict(
                        winner, null, winner + " wins throughput (" + loser + " had no successful requests)",
                        winner, null, winner + " wins response time (" + loser + " had no successful requests)");
            }

            // Throughput: margin relative to the lower side.
            double ra = a.requestsPerSecond();
            double rb = b.requestsPerSecond();
            double lower = Math.min(ra, rb);
            String tWinner = null;
            Double tMargin = lower > 0 ? (Math.max(ra, rb) - lower) / lower * 100.0 : null;
            String throughput;
            if (tMargin == null) {
                tWinner = ra > rb ? la : lb;
                throughput = tWinner + " wins throughput";
            } else if (tMargin < thresholdPercent) {
                throughput = NO_THROUGHPUT_DIFFERENCE;
            } else {
                tWinner = ra > rb ? la : lb;
                throughput = tWinner + " wins throughput by " + format(tMargin) + "%";
            }

            // Response time: margin relative to the slower side's mean.
            double ma = a.latency().mean();
            double mb = b.latency().mean();
            double slower = Math.max(ma, mb);
            double rMargin = slower > 0 ? (slower - Math.min(ma, mb)) / slower * 100.0 : 0.0;
            String rWinner = null;
            String responseTime;
            if (rMargin < thresholdPercent) {
                responseTime = NO_RESPONSE_TIME_DIFFERENCE;
            } else {
                rWinner = ma < mb ? la : lb;
                responseTime = rWinner + " wins response time by " + format(rMargin) + "%";
            }

            return new Verdict(tWinner, tMargin, throughput, rWinner, rMargin, responseTime);
        }

        private static String format(double pct) {
            return String.format(Locale.ROOT, "%.1f", pct);
        }
    }
}
