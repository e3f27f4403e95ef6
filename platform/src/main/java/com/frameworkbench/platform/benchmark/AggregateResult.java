package com.frameworkbench.platform.benchmark;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.ErrorBucket;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.LatencyStats;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.ScenarioKind;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Aggregated metrics for one scenario run against one framework.
 *
 * Latency figures cover successful requests only; throughput is successful
 * requests per wall-clock second.
 */
@JsonIgnoreProperties(value = {"successRate", "errorRate"}, allowGetters = true)
public record AggregateResult(
        String framework,
        ScenarioKind scenario,
        Instant startedAt,
        Duration wallClock,
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        double requestsPerSecond,
        LatencyStats latency,
        String latencyBasis,
        List<ErrorBucket> errors,
        long bytesReceived,
        int abortedWorkers,
        long lateDiscarded
) {
    public AggregateResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        latency = latency != null ? latency : LatencyStats.empty();
        wallClock = wallClock != null ? wallClock : Duration.ZERO;
        latencyBasis = latencyBasis != null ? latencyBasis : LATENCY_BASIS;
    }

    /** Latency statistics are computed over successful requests only. */
    public static final String LATENCY_BASIS = "successful";

    /** Percentage of requests that succeeded, 0 when nothing was sent. */
    @JsonProperty("successRate")
    public double successRate() {
        return totalRequests > 0 ? successfulRequests * 100.0 / totalRequests : 0.0;
    }

    @JsonProperty("errorRate")
    public double errorRate() {
        return totalRequests > 0 ? failedRequests * 100.0 / totalRequests : 0.0;
    }

    @JsonIgnore
    public boolean hasSuccesses() {
        return successfulRequests > 0;
    }
}
