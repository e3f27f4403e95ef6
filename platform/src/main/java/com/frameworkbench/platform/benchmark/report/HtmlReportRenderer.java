package com.frameworkbench.platform.benchmark.report;

import com.frameworkbench.platform.benchmark.AggregateResult;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.ErrorBucket;
import com.frameworkbench.platform.benchmark.ComparisonReport;
import com.frameworkbench.platform.benchmark.ComparisonSuite;
import com.frameworkbench.platform.benchmark.RunSummary;

import java.util.List;

import static com.frameworkbench.platform.benchmark.report.ReportRenderer.*;

/**
 * Self-contained HTML page. All text taken from results is escaped.
 */
public final class HtmlReportRenderer implements ReportRenderer {

    private static final String STYLE = """
            body { font-family: -apple-system, Segoe UI, Helvetica, Arial, sans-serif; margin: 2em; color: #222; }
            table { border-collapse: collapse; margin-bottom: 1.5em; }
            th, td { border: 1px solid #ccc; padding: 4px 10px; text-align: right; }
            th:first-child, td:first-child, td:nth-child(2) { text-align: left; }
            th { background: #f3f3f3; }
            .verdict { font-weight: bold; }
            """;

    @Override
    public ReportFormat format() {
        return ReportFormat.HTML;
    }

    @Override
    public String render(ComparisonSuite suite) {
        String title = suite.frameworkA() + " vs " + suite.frameworkB() + " Performance Comparison Report";
        StringBuilder html = open(title);
        html.append("<p>Generated at: ").append(MarkdownReportRenderer.timestamp(suite.generatedAt())).append("</p>\n");

        html.append("<h2>Summary</h2>\n");
        table(html, suite.comparisons().stream().flatMap(c -> List.of(c.a(), c.b()).stream()).toList());

        html.append("<h2>Detailed Results</h2>\n");
        for (ComparisonReport c : suite.comparisons()) {
            html.append("<h3>").append(escape(c.scenario().displayName())).append("</h3>\n");
            detail(html, c.a());
            detail(html, c.b());
            html.append("<ul>\n")
                    .append("<li>Throughput delta: ").append(escape(delta(c.deltas().throughputPct()))).append("</li>\n")
                    .append("<li>Mean latency delta: ").append(escape(delta(c.deltas().meanLatencyPct()))).append("</li>\n")
                    .append("<li>P95 latency delta: ").append(escape(delta(c.deltas().p95LatencyPct()))).append("</li>\n")
                    .append("<li>P99 latency delta: ").append(escape(delta(c.deltas().p99LatencyPct()))).append("</li>\n")
                    .append("</ul>\n");
            html.append("<p class=\"verdict\">").append(escape(c.verdict().throughput())).append("</p>\n");
            html.append("<p class=\"verdict\">").append(escape(c.verdict().responseTime())).append("</p>\n");
        }
        return close(html);
    }

    @Override
    public String render(RunSummary summary) {
        StringBuilder html = open(summary.framework() + " Benchmark Results");
        html.append("<p>Generated at: ").append(MarkdownReportRenderer.timestamp(summary.generatedAt())).append("</p>\n");
        html.append("<h2>Summary</h2>\n");
        table(html, summary.results());
        html.append("<h2>Detailed Results</h2>\n");
        for (AggregateResult r : summary.results()) {
            html.append("<h3>").append(escape(r.scenario().displayName())).append("</h3>\n");
            detail(html, r);
        }
        return close(html);
    }

    // ========================================================================
    // Building blocks
    // ========================================================================

    private static StringBuilder open(String title) {
        return new StringBuilder()
                .append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n<meta charset=\"utf-8\">\n")
                .append("<title>").append(escape(title)).append("</title>\n")
                .append("<style>\n").append(STYLE).append("</style>\n</head>\n<body>\n")
                .append("<h1>").append(escape(title)).append("</h1>\n");
    }

    private static String close(StringBuilder html) {
        return html.append("</body>\n</html>\n").toString();
    }

    private static void table(StringBuilder html, List<AggregateResult> rows) {
        html.append("<table>\n<tr><th>Scenario</th><th>Framework</th><th>RPS</th><th>Mean (ms)</th>")
                .append("<th>P95 (ms)</th><th>P99 (ms)</th><th>Error rate</th></tr>\n");
        for (AggregateResult r : rows) {
            html.append("<tr><td>").append(escape(r.scenario().displayName()))
                    .append("</td><td>").append(escape(r.framework()))
                    .append("</td><td>").append(number(r.requestsPerSecond()))
                    .append("</td><td>").append(number(r.latency().mean()))
                    .append("</td><td>").append(number(r.latency().p95()))
                    .append("</td><td>").append(number(r.latency().p99()))
                    .append("</td><td>").append(errorRate(r))
                    .append("</td></tr>\n");
        }
        html.append("</table>\n");
    }

    private static void detail(StringBuilder html, AggregateResult r) {
        html.append("<h4>").append(escape(r.framework())).append("</h4>\n<ul>\n");
        html.append("<li>Requests: ").append(r.totalRequests()).append(" (").append(r.successfulRequests())
                .append(" ok, ").append(r.failedRequests()).append(" failed)</li>\n");
        html.append("<li>Response time (ms): min ").append(number(r.latency().min()))
                .append(", p50 ").append(number(r.latency().p50()))
                .append(", max ").append(number(r.latency().max())).append("</li>\n");
        html.append("<li>Success rate: ").append(percent(r.successRate())).append("</li>\n");
        for (ErrorBucket e : r.errors()) {
            html.append("<li>Error <code>").append(escape(e.tag())).append("</code>: ").append(e.count())
                    .append(" (").append(percent(e.percentOfTotal())).append(")</li>\n");
        }
        html.append("</ul>\n");
    }

    static String escape(String s) {
        if (s == null) return "";
        StringBuilder out = new StringBuilder(s.length());
        for (char ch : s.toCharArray()) {
            switch (ch) {
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '&' -> out.append("&amp;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#39;");
                default -> out.append(ch);
            }
        }
        return out.toString();
    }
}
