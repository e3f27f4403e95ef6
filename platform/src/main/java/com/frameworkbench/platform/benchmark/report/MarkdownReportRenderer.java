package com.frameworkbench.platform.benchmark.report;

import com.frameworkbench.platform.benchmark.AggregateResult;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.ErrorBucket;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.RunParameters;
import com.frameworkbench.platform.benchmark.ComparisonReport;
import com.frameworkbench.platform.benchmark.ComparisonSuite;
import com.frameworkbench.platform.benchmark.RunSummary;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;

import static com.frameworkbench.platform.benchmark.report.ReportRenderer.*;

public final class MarkdownReportRenderer implements ReportRenderer {

    static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private static final String TABLE_HEADER =
            "| Scenario | Framework | RPS | Mean (ms) | P95 (ms) | P99 (ms) | Error rate |\n"
          + "|----------|-----------|-----|-----------|----------|----------|------------|\n";

    @Override
    public ReportFormat format() {
        return ReportFormat.MARKDOWN;
    }

    @Override
    public String render(ComparisonSuite suite) {
        StringBuilder md = new StringBuilder();
        md.append("# ").append(suite.frameworkA()).append(" vs ").append(suite.frameworkB())
                .append(" Performance Comparison Report\n\n");
        md.append("Generated at: ").append(timestamp(suite.generatedAt())).append("\n\n");
        parameters(md, suite.parameters());

        md.append("## Summary\n\n").append(TABLE_HEADER);
        for (ComparisonReport c : suite.comparisons()) {
            row(md, c.a());
            row(md, c.b());
        }

        md.append("\n## Detailed Results\n\n");
        for (ComparisonReport c : suite.comparisons()) {
            md.append("### ").append(c.scenario().displayName()).append("\n\n");
            detail(md, c.a());
            detail(md, c.b());

            var d = c.deltas();
            md.append("**Deltas** (").append(c.b().framework()).append(" relative to ").append(c.a().framework()).append(")\n");
            md.append("- Throughput: ").append(delta(d.throughputPct())).append('\n');
            md.append("- Mean latency: ").append(delta(d.meanLatencyPct())).append('\n');
            md.append("- P95 latency: ").append(delta(d.p95LatencyPct())).append('\n');
            md.append("- P99 latency: ").append(delta(d.p99LatencyPct())).append("\n\n");
        }

        md.append("## Analysis\n\n");
        for (ComparisonReport c : suite.comparisons()) {
            md.append("**").append(c.scenario().displayName()).append("**\n");
            md.append("- ").append(c.verdict().throughput()).append('\n');
            md.append("- ").append(c.verdict().responseTime()).append("\n\n");
        }
        return md.toString();
    }

    @Override
    public String render(RunSummary summary) {
        StringBuilder md = new StringBuilder();
        md.append("# ").append(summary.framework()).append(" Benchmark Results\n\n");
        md.append("Generated at: ").append(timestamp(summary.generatedAt())).append("\n\n");
        parameters(md, summary.parameters());

        md.append("## Summary\n\n").append(TABLE_HEADER);
        summary.results().forEach(r -> row(md, r));

        md.append("\n## Detailed Results\n\n");
        for (AggregateResult r : summary.results()) {
            md.append("### ").append(r.scenario().displayName()).append("\n\n");
            detail(md, r);
        }
        return md.toString();
    }

    // ========================================================================
    // Sections
    // ========================================================================

    private static void parameters(StringBuilder md, RunParameters p) {
        if (p == null) return;
        md.append("## Parameters\n\n");
        md.append("- Concurrent users: ").append(p.concurrency()).append('\n');
        md.append("- Duration: ").append(p.duration().toSeconds()).append("s\n");
        md.append("- Ramp-up: ").append(p.rampUp().toSeconds()).append("s\n");
        md.append("- Request timeout: ").append(p.requestTimeout().toMillis()).append("ms\n");
        md.append("- Think time: ").append(p.thinkTime().toMillis()).append("ms\n");
        md.append("- Cutoff policy: ").append(p.cutoffPolicy().id()).append("\n\n");
    }

    private static void row(StringBuilder md, AggregateResult r) {
        md.append("| ").append(cell(r.scenario().displayName()))
                .append(" | ").append(cell(r.framework()))
                .append(" | ").append(number(r.requestsPerSecond()))
                .append(" | ").append(number(r.latency().mean()))
                .append(" | ").append(number(r.latency().p95()))
                .append(" | ").append(number(r.latency().p99()))
                .append(" | ").append(errorRate(r))
                .append(" |\n");
    }

    /** Table cells must not contain a bare pipe. */
    static String cell(String text) {
        return text.replace("|", "\\|");
    }

    private static void detail(StringBuilder md, AggregateResult r) {
        md.append("**").append(r.framework()).append("**\n");
        md.append("- Requests: ").append(r.totalRequests())
                .append(" (").append(r.successfulRequests()).append(" ok, ")
                .append(r.failedRequests()).append(" failed)\n");
        md.append("- Requests/sec: ").append(number(r.requestsPerSecond())).append('\n');
        md.append("- Response time (ms): min ").append(number(r.latency().min()))
                .append(", mean ").append(number(r.latency().mean()))
                .append(", p50 ").append(number(r.latency().p50()))
                .append(", p95 ").append(number(r.latency().p95()))
                .append(", p99 ").append(number(r.latency().p99()))
                .append(", max ").append(number(r.latency().max())).append('\n');
        md.append("- Success rate: ").append(percent(r.successRate())).append('\n');
        if (r.abortedWorkers() > 0) {
            md.append("- Aborted workers: ").append(r.abortedWorkers()).append('\n');
        }
        if (r.lateDiscarded() > 0) {
            md.append("- Late outcomes discarded: ").append(r.lateDiscarded()).append('\n');
        }
        for (ErrorBucket e : r.errors()) {
            md.append("- Error `").append(e.tag()).append("`: ").append(e.count())
                    .append(" (").append(percent(e.percentOfTotal())).append(")\n");
        }
        md.append('\n');
    }

    static String timestamp(TemporalAccessor instant) {
        return instant == null ? "unknown" : TIMESTAMP.format(instant);
    }
}
