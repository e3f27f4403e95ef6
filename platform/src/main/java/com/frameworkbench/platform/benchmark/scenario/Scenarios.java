package com.frameworkbench.platform.benchmark.scenario;

import com.frameworkbench.platform.benchmark.BenchmarkTypes.ScenarioKind;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.Workload;

/**
 * Scenario factory.
 */
public final class Scenarios {

    private Scenarios() {}

    public static Scenario forKind(ScenarioKind kind, Workload workload) {
        return switch (kind) {
            case HEALTH -> new HealthScenario();
            case REST -> new RestScenario(workload);
            case GRAPHQL -> new GraphQlScenario();
            case MIXED -> new MixedScenario();
            case WEBHOOK -> new WebhookScenario(workload);
        };
    }
}
