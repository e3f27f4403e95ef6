package com.frameworkbench.platform.benchmark.scenario;

import com.fasterxml.jackson.databind.JsonNode;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.Classification;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.ErrorCategory;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.ScenarioKind;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.Workload;
import com.frameworkbench.platform.benchmark.transport.Transport.Exchange;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SplittableRandom;

/**
 * REST workload: each virtual user registers, logs in, then loops over a weighted
 * product/user mix, sending its bearer token where the endpoint needs one.
 */
public final class RestScenario implements Scenario {

    static final String REGISTER_PATH = "/api/auth/register";
    static final String LOGIN_PATH = "/api/auth/login";
    static final String PRODUCTS_PATH = "/api/products";
    static final String ME_PATH = "/api/users/me";

    private enum Step { LIST_PRODUCTS, CREATE_PRODUCT, CURRENT_USER }

    private static final WeightedChoice<Step> MIX = WeightedChoice.<Step>builder()
            .add(0.6, Step.LIST_PRODUCTS)
            .add(0.2, Step.CREATE_PRODUCT)
            .add(0.2, Step.CURRENT_USER)
            .build();

    private final Workload workload;

    public RestScenario(Workload workload) {
        this.workload = workload;
    }

    @Override
    public ScenarioKind kind() {
        return ScenarioKind.REST;
    }

    @Override
    public Session newSession(int workerIndex, SplittableRandom random) {
        String email = "bench-" + workerIndex + "-" + Long.toHexString(random.nextLong() & 0xffffffffL)
                + "@" + workload.userEmailDomain();
        return new RestSession(workerIndex, email, workload.userPassword(), random);
    }

    private enum Phase { REGISTER, LOGIN, LOOP }

    static final class RestSession implements Session {
        private final int workerIndex;
        private final String email;
        private final String password;
        private final SplittableRandom random;

        private Phase phase = Phase.REGISTER;
        private String token;
        private long created;

        RestSession(int workerIndex, String email, String password, SplittableRandom random) {
            this.workerIndex = workerIndex;
            this.email = email;
            this.password = password;
            this.random = random;
        }

        @Override
        public RequestSpec next() {
            return switch (phase) {
                case REGISTER -> RequestSpec.postPayload(REGISTER_PATH, orderedMap(
                        "email", email,
                        "name", "Bench User " + workerIndex,
                        "password", password), RequestSpec.Expectation.API_ENVELOPE);
                case LOGIN -> RequestSpec.postPayload(LOGIN_PATH, orderedMap(
                        "email", email,
                        "password", password), RequestSpec.Expectation.API_ENVELOPE);
                case LOOP -> switch (MIX.pick(random)) {
                    case LIST_PRODUCTS -> RequestSpec.get(PRODUCTS_PATH, RequestSpec.Expectation.API_ENVELOPE);
                    case CREATE_PRODUCT -> createProduct();
                    case CURRENT_USER -> RequestSpec.get(ME_PATH, RequestSpec.Expectation.API_ENVELOPE)
                            .withHeader("Authorization", "Bearer " + token);
                };
            };
        }

        @Override
        public Classification observe(RequestSpec request, Exchange exchange, Classification classification) {
            switch (phase) {
                case REGISTER -> phase = Phase.LOGIN;  // an existing account is fine, login decides
                case LOGIN -> {
                    if (!classification.isSuccess()) {
                        return classification;
                    }
                    String t = ResponseClassifier.parse(exchange.body())
                            .map(n -> n.path("data").path("token"))
                            .filter(JsonNode::isTextual)
                            .map(JsonNode::asText)
                            .orElse(null);
                    if (t == null || t.isEmpty()) {
                        return Classification.of(ErrorCategory.MALFORMED_BODY);
                    }
                    token = t;
                    phase = Phase.LOOP;
                }
                case LOOP -> { }
            }
            return classification;
        }

        String token() {
            return token;
        }

        private RequestSpec createProduct() {
            created++;
            var product = new LinkedHashMap<String, Object>();
            product.put("name", "Bench Product " + workerIndex + "-" + created);
            product.put("description", "Created by the benchmark");
            product.put("price", Math.round(random.nextDouble(1.0, 500.0) * 100) / 100.0);
            return RequestSpec.postPayload(PRODUCTS_PATH, product, RequestSpec.Expectation.API_ENVELOPE)
                    .withHeader("Authorization", "Bearer " + token);
        }

        private static Map<String, Object> orderedMap(String... kv) {
            var m = new LinkedHashMap<String, Object>();
            for (int i = 0; i < kv.length; i += 2) {
                m.put(kv[i], kv[i + 1]);
            }
            return m;
        }
    }
}
