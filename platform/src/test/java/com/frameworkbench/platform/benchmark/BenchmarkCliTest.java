package com.frameworkbench.platform.benchmark;

import com.frameworkbench.platform.config.BenchConfig;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class BenchmarkCliTest {

    @TempDir
    Path dir;

    /** Minimal stored comparison, as the result store writes it. */
    private static final String STORED_SUITE = """
            {
              "generatedAt" : "2024-06-01T08:30:00Z",
              "frameworkA" : "AXUM",
              "frameworkB" : "LOCO",
              "parameters" : null,
              "comparisons" : [ ]
            }
            """;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

    private static final BenchConfig CONFIG = BenchConfig.from(ConfigFactory.parseString("""
            bench.run.users = 2
            bench.run.duration = 1s
            bench.run.ramp-up = 0s
            bench.run.think-time = 0ms
            bench.run.request-timeout = 2s
            bench.run.connect-retry-budget = 0
            bench.compare.pause-between-targets = 0s
            bench.compare.pause-between-scenarios = 0s
            """));

    private int run(String... args) {
        return BenchmarkCli.run(args, new PrintStream(stdout, true, StandardCharsets.UTF_8), CONFIG);
    }

    private String out() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    @Test
    void missingCommandIsAUsageError() {
        assertEquals(BenchmarkCli.EXIT_USAGE, run());
        assertEquals(BenchmarkCli.EXIT_USAGE, run("benchmark"));
    }

    @Test
    void helpPrintsUsage() {
        assertEquals(BenchmarkCli.EXIT_OK, run("--help"));
        assertTrue(out().contains("Usage: framework-bench <command> [options]"));
    }

    @Test
    void invalidArgumentsAreRejectedBeforeRunning() {
        assertEquals(BenchmarkCli.EXIT_USAGE, run("compare", "--duration", "0"));
        assertEquals(BenchmarkCli.EXIT_USAGE, run("compare", "--users", "-3"));
        assertEquals(BenchmarkCli.EXIT_USAGE, run("compare", "--users", "many"));
        assertEquals(BenchmarkCli.EXIT_USAGE, run("compare", "--users"));
        assertEquals(BenchmarkCli.EXIT_USAGE, run("compare", "--scenario", "soap"));
        assertEquals(BenchmarkCli.EXIT_USAGE, run("compare", "--colour", "blue"));
        assertEquals(BenchmarkCli.EXIT_USAGE, run("report", "--format", "pdf"));
        assertEquals(BenchmarkCli.EXIT_USAGE, run("single", "--framework", "X"));
        assertEquals(BenchmarkCli.EXIT_USAGE, run("single", "--url", "localhost:3000", "--framework", "X"));
        assertEquals(BenchmarkCli.EXIT_USAGE, run("compare", "--a-url", "nope", "--skip-preflight"));
        assertEquals("", out());
    }

    @Test
    void unreachableTargetExitsBeforeRunning() throws IOException {
        String url = "http://127.0.0.1:" + ScenarioRunnerTest.closedPort();

        int code = run("single", "--url", url, "--framework", "GONE", "--results-dir", dir.toString());

        assertEquals(BenchmarkCli.EXIT_UNREACHABLE, code);
        assertEquals("", out());
    }

    @Test
    void compareStoresResultsAndWritesTheRequestedReport() throws IOException {
        try (MockTarget a = MockTarget.start(); MockTarget b = MockTarget.start()) {
            Path html = dir.resolve("out/report.html");

            int code = run("compare",
                    "--a-url", a.url(), "--a-label", "AXUM",
                    "--b-url", b.url(), "--b-label", "LOCO",
                    "--scenario", "health", "--duration", "1", "--users", "2",
                    "--format", "html", "--output", html.toString(),
                    "--results-dir", dir.resolve("results").toString());

            assertEquals(BenchmarkCli.EXIT_OK, code);
            assertTrue(out().contains("# AXUM vs LOCO Performance Comparison Report"), out());
            assertTrue(Files.readString(html).contains("<h1>AXUM vs LOCO Performance Comparison Report</h1>"));
            assertTrue(Files.exists(dir.resolve("results/latest-comparison.json")));
            assertTrue(a.hits("/health") > 0);
            assertTrue(b.hits("/health") > 0);
        }
    }

    @Test
    void reportRendersTheLatestStoredComparison() throws IOException {
        try (MockTarget a = MockTarget.start(); MockTarget b = MockTarget.start()) {
            Path results = dir.resolve("results");
            assertEquals(BenchmarkCli.EXIT_OK, run("compare", "--a-url", a.url(), "--b-url", b.url(),
                    "--scenario", "health", "--results-dir", results.toString()));
        }
        stdout.reset();

        Path json = dir.resolve("report.json");
        assertEquals(BenchmarkCli.EXIT_OK,
                run("report", "--format", "json", "--output", json.toString(), "--results-dir", results(dir)));
        assertTrue(Files.readString(json).contains("\"frameworkA\" : \"AXUM\""));

        assertEquals(BenchmarkCli.EXIT_OK, run("report", "--results-dir", results(dir)));
        assertTrue(out().contains("## Summary"));
    }

    @Test
    void reportWithoutStoredResultsIsAnIoFailure() {
        assertEquals(BenchmarkCli.EXIT_IO, run("report", "--results-dir", dir.resolve("nothing").toString()));
    }

    @Test
    void reportToUnwritablePathIsAnIoFailure() throws IOException {
        Path input = dir.resolve("suite.json");
        Files.writeString(input, STORED_SUITE);
        Path blocker = Files.writeString(dir.resolve("blocker"), "x");

        int code = run("report", "--input", input.toString(), "--output", blocker.resolve("report.md").toString());

        assertEquals(BenchmarkCli.EXIT_IO, code);
    }

    @Test
    void singleRunsOneTarget() throws IOException {
        try (MockTarget target = MockTarget.start()) {
            int code = run("single", "--url", target.url(), "--framework", "Axum",
                    "--scenario", "graphql", "--format", "markdown", "--results-dir", dir.toString());

            assertEquals(BenchmarkCli.EXIT_OK, code);
            assertTrue(out().contains("# Axum Benchmark Results"), out());
            try (var files = Files.list(dir)) {
                assertTrue(files.anyMatch(p -> p.getFileName().toString().startsWith("single-axum-")));
            }
        }
    }

    private static String results(Path dir) {
        return dir.resolve("results").toString();
    }
}
