package com.frameworkbench.platform.benchmark.scenario;

import com.frameworkbench.platform.benchmark.BenchmarkTypes.ScenarioKind;

import java.util.SplittableRandom;

/**
 * Health, products over REST and GraphQL, and the metrics endpoint, interleaved.
 */
public final class MixedScenario implements Scenario {

    private static final WeightedChoice<RequestSpec> MIX = WeightedChoice.<RequestSpec>builder()
            .add(0.2, HealthScenario.HEALTH)
            .add(0.3, RequestSpec.get(RestScenario.PRODUCTS_PATH, RequestSpec.Expectation.API_ENVELOPE))
            .add(0.3, GraphQlScenario.PRODUCTS_QUERY)
            .add(0.2, RequestSpec.get("/metrics", RequestSpec.Expectation.ANY_2XX))
            .build();

    @Override
    public ScenarioKind kind() {
        return ScenarioKind.MIXED;
    }

    @Override
    public Session newSession(int workerIndex, SplittableRandom random) {
        return () -> MIX.pick(random);
    }
}
