package com.frameworkbench.platform.benchmark;

import com.frameworkbench.platform.benchmark.BenchmarkTypes.ErrorBucket;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.ErrorCategory;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.LatencyStats;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.RequestOutcome;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.ScenarioKind;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reduces request outcomes to an {@link AggregateResult}.
 *
 * Pure and order-independent: the same multiset of outcomes always yields the same result.
 */
public final class MetricsAggregator {

    private MetricsAggregator() {}

    public static AggregateResult aggregate(ScenarioRun run) {
        return aggregate(
                run.config().target().label(),
                run.config().kind(),
                run.startedAt(),
                run.outcomes(),
                run.wallClock(),
                run.abortedWorkers(),
                run.lateDiscarded());
    }

    public static AggregateResult aggregate(String framework, ScenarioKind scenario,
                                            Collection<RequestOutcome> outcomes, Duration wallClock) {
        return aggregate(framework, scenario, null, outcomes, wallClock, 0, 0);
    }

    public static AggregateResult aggregate(String framework, ScenarioKind scenario, Instant startedAt,
                                            Collection<RequestOutcome> outcomes, Duration wallClock,
                                            int abortedWorkers, long lateDiscarded) {
        long total = outcomes.size();
        long[] latencies = new long[outcomes.size()];
        int successes = 0;
        long bytes = 0;
        Map<String, Bucket> byTag = new TreeMap<>();

        for (RequestOutcome o : outcomes) {
            bytes += o.bytesReceived();
            if (o.success()) {
                latencies[successes++] = o.latency().toNanos();
            } else {
                byTag.computeIfAbsent(o.tag(), t -> new Bucket(o.category())).count++;
            }
        }

        long[] sorted = Arrays.copyOf(latencies, successes);
        Arrays.sort(sorted);

        List<ErrorBucket> errors = new ArrayList<>(byTag.size());
        byTag.forEach((tag, b) -> errors.add(new ErrorBucket(tag, b.category, b.count, b.count * 100.0 / total)));

        return new AggregateResult(
                framework,
                scenario,
                startedAt,
                wallClock,
                total,
                successes,
                total - successes,
                requestsPerSecond(successes, wallClock),
                LatencyStats.from(sorted),
                AggregateResult.LATENCY_BASIS,
                errors,
                bytes,
                abortedWorkers,
                lateDiscarded);
    }

    static double requestsPerSecond(long successes, Duration wallClock) {
        if (wallClock == null || wallClock.isZero() || wallClock.isNegative()) {
            return 0.0;
        }
        return successes / (wallClock.toNanos() / 1_000_000_000.0);
    }

    private static final class Bucket {
        final ErrorCategory category;
        long count;

        Bucket(ErrorCategory category) {
            this.category = category;
        }
    }
}
