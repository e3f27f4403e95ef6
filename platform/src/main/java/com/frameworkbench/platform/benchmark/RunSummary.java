package com.frameworkbench.platform.benchmark;

import com.frameworkbench.platform.benchmark.BenchmarkTypes.RunParameters;

import java.time.Instant;
import java.util.List;

/**
 * Results of a {@code single} invocation: one framework, one result per scenario.
 */
public record RunSummary(
        Instant generatedAt,
        String framework,
        RunParameters parameters,
        List<AggregateResult> results
) {
    public RunSummary {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
