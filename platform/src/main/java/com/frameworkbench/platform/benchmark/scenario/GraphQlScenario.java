package com.frameworkbench.platform.benchmark.scenario;

import com.frameworkbench.platform.benchmark.BenchmarkTypes.ScenarioKind;

import java.util.Map;
import java.util.SplittableRandom;

/**
 * Weighted GraphQL queries against POST /graphql.
 */
public final class GraphQlScenario implements Scenario {

    static final RequestSpec HEALTH_QUERY = query("graphql health", "{ health }");
    static final RequestSpec PRODUCTS_QUERY = query("graphql products", "{ products { id name price } }");
    static final RequestSpec USERS_QUERY = query("graphql users", "{ users { id email name } }");

    private final WeightedChoice<RequestSpec> mix = WeightedChoice.<RequestSpec>builder()
            .add(0.3, HEALTH_QUERY)
            .add(0.4, PRODUCTS_QUERY)
            .add(0.3, USERS_QUERY)
            .build();

    @Override
    public ScenarioKind kind() {
        return ScenarioKind.GRAPHQL;
    }

    @Override
    public Session newSession(int workerIndex, SplittableRandom random) {
        return () -> mix.pick(random);
    }

    static RequestSpec query(String label, String query) {
        return RequestSpec.postPayload("/graphql", Map.of("query", query), RequestSpec.Expectation.GRAPHQL)
                .labeled(label);
    }
}
