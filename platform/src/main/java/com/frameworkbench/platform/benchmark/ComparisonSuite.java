package com.frameworkbench.platform.benchmark;

import com.frameworkbench.platform.benchmark.BenchmarkTypes.RunParameters;

import java.time.Instant;
import java.util.List;

/**
 * All scenario comparisons of one {@code compare} invocation, in the order they ran.
 */
public record ComparisonSuite(
        Instant generatedAt,
        String frameworkA,
        String frameworkB,
        RunParameters parameters,
        List<ComparisonReport> comparisons
) {
    public ComparisonSuite {
        comparisons = comparisons == null ? List.of() : List.copyOf(comparisons);
    }
}
