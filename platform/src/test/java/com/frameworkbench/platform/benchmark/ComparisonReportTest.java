package com.frameworkbench.platform.benchmark;

import com.frameworkbench.platform.benchmark.BenchmarkTypes.LatencyStats;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.ScenarioKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComparisonReportTest {

    static AggregateResult result(String framework, double rps, double meanMs) {
        long successes = Math.round(rps * 10);
        return new AggregateResult(framework, ScenarioKind.HEALTH, null, Duration.ofSeconds(10),
                successes, successes, 0, rps,
                new LatencyStats(meanMs / 2, meanMs, meanMs, meanMs * 2, meanMs * 3, meanMs * 4),
                AggregateResult.LATENCY_BASIS, List.of(), 0, 0, 0);
    }

    static AggregateResult noSuccesses(String framework) {
        return new AggregateResult(framework, ScenarioKind.HEALTH, null, Duration.ofSeconds(10),
                50, 0, 50, 0.0, LatencyStats.empty(), AggregateResult.LATENCY_BASIS, List.of(), 0, 0, 0);
    }

    @Test
    void higherThroughputOnBIsPositiveDeltaAndBWins() {
        ComparisonReport report = ComparisonReport.of(result("A", 100, 10), result("B", 110, 10));

        assertEquals(10.0, report.deltas().throughputPct(), 1e-9);
        assertEquals("B", report.verdict().throughputWinner());
        assertEquals("B wins throughput by 10.0%", report.verdict().throughput());
    }

    @Test
    void differenceUnderThresholdIsNotSignificant() {
        ComparisonReport report = ComparisonReport.of(result("A", 100, 10), result("B", 100.5, 10));

        assertEquals(0.5, report.deltas().throughputPct(), 1e-9);
        assertNull(report.verdict().throughputWinner());
        assertEquals(ComparisonReport.Verdict.NO_THROUGHPUT_DIFFERENCE, report.verdict().throughput());
        assertEquals(ComparisonReport.Verdict.NO_RESPONSE_TIME_DIFFERENCE, report.verdict().responseTime());
    }

    @Test
    void thresholdIsConfigurable() {
        ComparisonReport report = ComparisonReport.of(result("A", 100, 10), result("B", 104, 10), 5.0);

        assertNull(report.verdict().throughputWinner());
    }

    @Test
    void lowerLatencyOnBIsPositiveDeltaAndBWinsResponseTime() {
        ComparisonReport report = ComparisonReport.of(result("A", 100, 10), result("B", 200, 5));

        assertEquals(50.0, report.deltas().meanLatencyPct(), 1e-9);
        assertEquals(50.0, report.deltas().p95LatencyPct(), 1e-9);
        assertEquals(50.0, report.deltas().p99LatencyPct(), 1e-9);
        assertEquals("B", report.verdict().responseTimeWinner());
        assertEquals(50.0, report.verdict().responseTimeMarginPct(), 1e-9);
        assertEquals("B wins response time by 50.0%", report.verdict().responseTime());
    }

    @Test
    void throughputMarginIsRelativeToTheLowerSide() {
        ComparisonReport report = ComparisonReport.of(result("A", 200, 5), result("B", 100, 10));

        assertEquals(-50.0, report.deltas().throughputPct(), 1e-9);
        assertEquals("A", report.verdict().throughputWinner());
        assertEquals(100.0, report.verdict().throughputMarginPct(), 1e-9);
        assertEquals("A", report.verdict().responseTimeWinner());
        assertEquals(-100.0, report.deltas().meanLatencyPct(), 1e-9);
    }

    @Test
    void sideWithoutSuccessesLosesOutright() {
        ComparisonReport report = ComparisonReport.of(noSuccesses("A"), result("B", 50, 10));

        assertNull(report.deltas().throughputPct());
        assertEquals("B", report.verdict().throughputWinner());
        assertNull(report.verdict().throughputMarginPct());
        assertEquals("B", report.verdict().responseTimeWinner());
        assertTrue(report.verdict().throughput().contains("A had no successful requests"));
    }

    @Test
    void neitherSideSucceeding() {
        ComparisonReport report = ComparisonReport.of(noSuccesses("A"), noSuccesses("B"));

        assertEquals(0.0, report.deltas().throughputPct());
        assertNull(report.verdict().throughputWinner());
        assertNull(report.verdict().responseTimeWinner());
    }

    @Test
    void verdictDependsOnlyOnResults() {
        AggregateResult a = result("A", 123, 7);
        AggregateResult b = result("B", 131, 6);

        assertEquals(ComparisonReport.of(a, b), ComparisonReport.of(a, b));
    }
}
