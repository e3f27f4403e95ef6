/**
 * Load generation and comparison of two web framework servers.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.frameworkbench.platform.benchmark.ScenarioRunner} - Drives virtual users against one target</li>
 *   <li>{@link com.frameworkbench.platform.benchmark.MetricsAggregator} - Outcomes to throughput, latency, errors</li>
 *   <li>{@link com.frameworkbench.platform.benchmark.FrameworkComparator} - Runs A then B, computes deltas and verdict</li>
 *   <li>{@link com.frameworkbench.platform.benchmark.BenchmarkTypes} - Types (ScenarioConfig, RequestOutcome, LatencyStats, etc.)</li>
 *   <li>{@link com.frameworkbench.platform.benchmark.report.ReportRenderer} - Markdown, JSON and HTML reports</li>
 *   <li>{@link com.frameworkbench.platform.benchmark.report.BenchmarkReportGenerator} - JSON result store</li>
 *   <li>{@link com.frameworkbench.platform.benchmark.BenchmarkCli} - CLI entry point</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * var runner = new ScenarioRunner(new HttpClientTransport(Duration.ofSeconds(5)));
 * var config = ScenarioConfig.builder()
 *         .target("AXUM", "http://localhost:3000")
 *         .kind(ScenarioKind.REST)
 *         .concurrency(50)
 *         .duration(Duration.ofSeconds(30))
 *         .build();
 * AggregateResult result = MetricsAggregator.aggregate(runner.run(config));
 *
 * // or from the command line
 * java -jar framework-bench.jar compare --users 50 --duration 30 --scenario rest
 * }</pre>
 *
 * @see com.frameworkbench.platform.benchmark.BenchmarkCli
 */
package com.frameworkbench.platform.benchmark;
