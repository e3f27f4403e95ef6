package com.frameworkbench.platform.benchmark.scenario;

import com.frameworkbench.platform.benchmark.BenchmarkTypes.ScenarioKind;

import java.util.SplittableRandom;

/** GET /health in a loop. */
public final class HealthScenario implements Scenario {

    static final RequestSpec HEALTH = RequestSpec.get("/health", RequestSpec.Expectation.ANY_2XX);

    @Override
    public ScenarioKind kind() {
        return ScenarioKind.HEALTH;
    }

    @Override
    public Session newSession(int workerIndex, SplittableRandom random) {
        return () -> HEALTH;
    }
}
