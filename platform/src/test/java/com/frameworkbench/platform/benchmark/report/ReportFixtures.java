package com.frameworkbench.platform.benchmark.report;

import com.frameworkbench.platform.benchmark.AggregateResult;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.CutoffPolicy;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.ErrorBucket;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.ErrorCategory;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.LatencyStats;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.RunParameters;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.ScenarioKind;
import com.frameworkbench.platform.benchmark.ComparisonReport;
import com.frameworkbench.platform.benchmark.ComparisonSuite;
import com.frameworkbench.platform.benchmark.RunSummary;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

final class ReportFixtures {

    static final Instant GENERATED = Instant.parse("2024-06-01T08:30:00Z");
    static final RunParameters PARAMETERS = new RunParameters(50, Duration.ofSeconds(30), Duration.ofSeconds(5),
            Duration.ofSeconds(5), Duration.ofMillis(10), CutoffPolicy.FINISH_IN_FLIGHT);

    private ReportFixtures() {}

    static AggregateResult result(String framework, ScenarioKind scenario, double rps, double mean,
                                  List<ErrorBucket> errors) {
        long failed = errors.stream().mapToLong(ErrorBucket::count).sum();
        long ok = Math.round(rps * 30);
        return new AggregateResult(framework, scenario, GENERATED, Duration.ofSeconds(30),
                ok + failed, ok, failed, rps,
                new LatencyStats(mean / 4, mean, mean * 0.9, mean * 2, mean * 3, mean * 5),
                AggregateResult.LATENCY_BASIS, errors, 1024, 0, 0);
    }

    static ComparisonSuite suite() {
        var health = ComparisonReport.of(
                result("AXUM", ScenarioKind.HEALTH, 5000, 2.0, List.of()),
                result("LOCO", ScenarioKind.HEALTH, 4000, 2.5, List.of()));
        var rest = ComparisonReport.of(
                result("AXUM", ScenarioKind.REST, 1000, 10.0,
                        List.of(new ErrorBucket("http_500", ErrorCategory.HTTP_STATUS, 3, 0.01))),
                result("LOCO", ScenarioKind.REST, 1005, 10.02, List.of()));
        return new ComparisonSuite(GENERATED, "AXUM", "LOCO", PARAMETERS, List.of(health, rest));
    }

    static RunSummary summary() {
        return new RunSummary(GENERATED, "AXUM", PARAMETERS, List.of(
                result("AXUM", ScenarioKind.HEALTH, 5000, 2.0, List.of()),
                result("AXUM", ScenarioKind.GRAPHQL, 800, 12.0,
                        List.of(new ErrorBucket("timeout", ErrorCategory.TIMEOUT, 2, 0.5)))));
    }
}
