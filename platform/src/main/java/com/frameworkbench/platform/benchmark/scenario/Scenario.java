package com.frameworkbench.platform.benchmark.scenario;

import com.frameworkbench.platform.benchmark.BenchmarkTypes.Classification;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.ScenarioKind;
import com.frameworkbench.platform.benchmark.transport.Transport.Exchange;

import java.util.SplittableRandom;

/**
 * A request mix. Each worker gets its own {@link Session}; sessions are used by a
 * single thread and may keep state such as an auth token.
 */
public interface Scenario {

    ScenarioKind kind();

    Session newSession(int workerIndex, SplittableRandom random);

    interface Session {

        /** The next request this virtual user sends. */
        RequestSpec next();

        /**
         * Called with every received response. May replace the classification,
         * e.g. when a login response carries no token.
         */
        default Classification observe(RequestSpec request, Exchange exchange, Classification classification) {
            return classification;
        }
    }
}
