package com.frameworkbench.platform.benchmark;

import com.frameworkbench.platform.benchmark.BenchmarkTypes.RequestOutcome;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.ScenarioConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Raw result of one scenario run against one target.
 *
 * @param wallClock      time from start to the point the run is measured to, per the cutoff policy
 * @param abortedWorkers workers that stopped early after exhausting their connect retry budget
 * @param lateDiscarded  outcomes dropped because they completed after the deadline
 */
public record ScenarioRun(
        ScenarioConfig config,
        Instant startedAt,
        Duration wallClock,
        List<RequestOutcome> outcomes,
        int abortedWorkers,
        long lateDiscarded
) {
    public ScenarioRun {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        wallClock = wallClock != null ? wallClock : Duration.ZERO;
    }

    /** Every worker gave up; the target was not reachable. */
    public boolean allWorkersAborted() {
        return abortedWorkers >= config.concurrency();
    }
}
