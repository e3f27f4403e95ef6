package com.frameworkbench.platform.benchmark;

import com.frameworkbench.platform.base.Result;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.*;
import com.frameworkbench.platform.benchmark.report.BenchmarkReportGenerator;
import com.frameworkbench.platform.benchmark.report.ReportFormat;
import com.frameworkbench.platform.benchmark.transport.HttpClientTransport;
import com.frameworkbench.platform.benchmark.transport.Transport;
import com.frameworkbench.platform.config.BenchConfig;
import com.typesafe.config.ConfigException;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static com.frameworkbench.platform.observe.Log.*;

/**
 * CLI for comparing two web frameworks under load.
 *
 * Usage:
 *   java -jar framework-bench.jar <command> [options]
 *
 * Commands: compare, single, report
 *
 * Defaults come from the {@code bench} configuration (reference.conf); options override them.
 * Rendered reports go to stdout, progress goes to the log.
 */
public class BenchmarkCli {

    static final int EXIT_OK = 0;
    static final int EXIT_UNEXPECTED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_UNREACHABLE = 3;
    static final int EXIT_IO = 4;

    private static final Duration MAX_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    public static void main(String[] args) {
        BenchConfig config;
        try {
            config = BenchConfig.load();
        } catch (ConfigException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(EXIT_USAGE);
            return;
        }
        System.exit(run(args, System.out, config));
    }

    /** Run a command and return its exit code. */
    static int run(String[] args, PrintStream out, BenchConfig config) {
        if (args.length == 0) {
            printUsage(System.err);
            return EXIT_USAGE;
        }
        String command = args[0];
        if (command.equals("--help") || command.equals("-h") || command.equals("help")) {
            printUsage(out);
            return EXIT_OK;
        }

        Options options;
        try {
            options = Options.parse(command, args, config);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            printUsage(System.err);
            return EXIT_USAGE;
        }
        if (options.help) {
            printUsage(out);
            return EXIT_OK;
        }

        try {
            return switch (command) {
                case "compare" -> compare(options, config, out);
                case "single" -> single(options, config, out);
                case "report" -> report(options, out);
                default -> {
                    System.err.println("Unknown command: " + command);
                    printUsage(System.err);
                    yield EXIT_USAGE;
                }
            };
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (RuntimeException e) {
            error("Benchmark failed", e);
            return EXIT_UNEXPECTED;
        }
    }

    // ========================================================================
    // Commands
    // ========================================================================

    private static int compare(Options o, BenchConfig config, PrintStream out) {
        Target a = new Target(o.aLabel, o.aUrl);
        Target b = new Target(o.bLabel, o.bUrl);
        ScenarioConfig template = o.scenarioTemplate(config, a);
        List<ScenarioKind> scenarios = ScenarioKind.parseSelection(o.scenario);

        try (Transport transport = transportFor(template)) {
            if (!o.skipPreflight && !(reachable(transport, template, a) && reachable(transport, template, b))) {
                return EXIT_UNREACHABLE;
            }
            var runner = new ScenarioRunner(transport);
            var comparator = new FrameworkComparator(runner, o.pauseBetweenTargets,
                    config.compare().pauseBetweenScenarios(),
                    config.compare().significanceThresholdPercent(), Clock.systemUTC());

            info("Comparing {} ({}) with {} ({}) on {}", a.label(), a.baseUrl(), b.label(), b.baseUrl(), scenarios);
            ComparisonSuite suite = comparator.compareAll(template, a, b, scenarios);

            out.print(ReportFormat.MARKDOWN.renderer().render(suite));
            out.flush();

            var store = BenchmarkReportGenerator.create(o.resultsDir);
            Result<Path> saved = store.saveSuite(suite);
            Result<Path> written = o.output == null
                    ? saved
                    : BenchmarkReportGenerator.writeReport(o.format.renderer().render(suite), o.output);
            return ioExit(saved, written);
        }
    }

    private static int single(Options o, BenchConfig config, PrintStream out) {
        if (o.url == null || o.framework == null) {
            throw new IllegalArgumentException("single requires --url and --framework");
        }
        Target target = new Target(o.framework, o.url);
        ScenarioConfig template = o.scenarioTemplate(config, target);
        List<ScenarioKind> scenarios = ScenarioKind.parseSelection(o.scenario);

        try (Transport transport = transportFor(template)) {
            if (!o.skipPreflight && !reachable(transport, template, target)) {
                return EXIT_UNREACHABLE;
            }
            var comparator = new FrameworkComparator(new ScenarioRunner(transport), o.pauseBetweenTargets,
                    config.compare().pauseBetweenScenarios(),
                    config.compare().significanceThresholdPercent(), Clock.systemUTC());
            RunSummary summary = comparator.runAll(template, scenarios);

            String rendered = o.format.renderer().render(summary);
            out.print(rendered);
            out.flush();

            Result<Path> saved = BenchmarkReportGenerator.create(o.resultsDir).saveSummary(summary);
            Result<Path> written = o.output == null ? saved : BenchmarkReportGenerator.writeReport(rendered, o.output);
            return ioExit(saved, written);
        }
    }

    private static int report(Options o, PrintStream out) {
        var store = BenchmarkReportGenerator.create(o.resultsDir);
        Result<ComparisonSuite> loaded = o.input != null ? store.loadSuite(o.input) : store.loadLatest();
        return loaded.fold(
                e -> {
                    error("Could not read stored results: {}", e.getMessage());
                    return EXIT_IO;
                },
                suite -> {
                    String rendered = o.format.renderer().render(suite);
                    if (o.output == null) {
                        out.print(rendered);
                        out.flush();
                        return EXIT_OK;
                    }
                    return ioExit(BenchmarkReportGenerator.writeReport(rendered, o.output));
                });
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static Transport transportFor(ScenarioConfig template) {
        Duration connect = template.requestTimeout().compareTo(MAX_CONNECT_TIMEOUT) < 0
                ? template.requestTimeout()
                : MAX_CONNECT_TIMEOUT;
        return new HttpClientTransport(connect);
    }

    private static boolean reachable(Transport transport, ScenarioConfig template, Target target) {
        return new TargetProbe(transport, template.requestTimeout(), template.connectRetryBudget())
                .check(target)
                .fold(e -> {
                    error("{} is unreachable: {}", target.label(), e.getMessage());
                    return false;
                }, status -> true);
    }

    @SafeVarargs
    private static int ioExit(Result<Path>... results) {
        for (Result<Path> r : results) {
            if (r.isFailure()) {
                error("Failed to write results: {}", r.error().map(Throwable::getMessage).orElse("unknown"));
                return EXIT_IO;
            }
        }
        return EXIT_OK;
    }

    // ========================================================================
    // Options
    // ========================================================================

    static final class Options {
        Integer users;
        Duration duration;
        Duration rampUp;
        Duration timeout;
        Duration thinkTime;
        CutoffPolicy cutoff;
        Long seed;
        String scenario = "all";
        String aUrl;
        String aLabel;
        String bUrl;
        String bLabel;
        String url;
        String framework;
        Duration pauseBetweenTargets;
        ReportFormat format;
        Path output;
        Path input;
        Path resultsDir;
        boolean skipPreflight;
        boolean help;

        static Options parse(String command, String[] args, BenchConfig config) {
            Options o = new Options();
            o.aUrl = config.targets().a().url();
            o.aLabel = config.targets().a().label();
            o.bUrl = config.targets().b().url();
            o.bLabel = config.targets().b().label();
            o.pauseBetweenTargets = config.compare().pauseBetweenTargets();
            o.format = ReportFormat.fromString(config.report().defaultFormat());
            o.resultsDir = Path.of(config.report().resultsDir());

            for (int i = 1; i < args.length; i++) {
                String opt = args[i];
                switch (opt) {
                    case "--users", "--concurrency" -> o.users = positiveInt(opt, value(args, ++i, opt));
                    case "--duration" -> o.duration = Duration.ofSeconds(positiveLong(opt, value(args, ++i, opt)));
                    case "--ramp-up" -> o.rampUp = Duration.ofSeconds(nonNegativeLong(opt, value(args, ++i, opt)));
                    case "--timeout" -> o.timeout = Duration.ofMillis(positiveLong(opt, value(args, ++i, opt)));
                    case "--think-time" -> o.thinkTime = Duration.ofMillis(nonNegativeLong(opt, value(args, ++i, opt)));
                    case "--pause" -> o.pauseBetweenTargets = Duration.ofSeconds(nonNegativeLong(opt, value(args, ++i, opt)));
                    case "--cutoff" -> o.cutoff = CutoffPolicy.fromString(value(args, ++i, opt));
                    case "--seed" -> o.seed = parseLong(opt, value(args, ++i, opt));
                    case "--scenario" -> {
                        o.scenario = value(args, ++i, opt);
                        ScenarioKind.parseSelection(o.scenario);
                    }
                    case "--a-url" -> o.aUrl = value(args, ++i, opt);
                    case "--a-label" -> o.aLabel = value(args, ++i, opt);
                    case "--b-url" -> o.bUrl = value(args, ++i, opt);
                    case "--b-label" -> o.bLabel = value(args, ++i, opt);
                    case "--url" -> o.url = value(args, ++i, opt);
                    case "--framework" -> o.framework = value(args, ++i, opt);
                    case "--format" -> o.format = ReportFormat.fromString(value(args, ++i, opt));
                    case "--output" -> o.output = Path.of(value(args, ++i, opt));
                    case "--input" -> o.input = Path.of(value(args, ++i, opt));
                    case "--results-dir" -> o.resultsDir = Path.of(value(args, ++i, opt));
                    case "--skip-preflight" -> o.skipPreflight = true;
                    case "--help", "-h" -> o.help = true;
                    default -> throw new IllegalArgumentException("Unknown option for " + command + ": " + opt);
                }
            }
            return o;
        }

        ScenarioConfig scenarioTemplate(BenchConfig config, Target target) {
            var builder = ScenarioConfig.Builder.fromConfig(config).target(target);
            if (users != null) builder.concurrency(users);
            if (duration != null) builder.duration(duration);
            if (rampUp != null) builder.rampUp(rampUp);
            if (timeout != null) builder.requestTimeout(timeout);
            if (thinkTime != null) builder.thinkTime(thinkTime);
            if (cutoff != null) builder.cutoffPolicy(cutoff);
            if (seed != null) builder.seed(seed);
            // configured ramp-up is clamped when only the duration was shortened on the command line
            if (rampUp == null && duration != null && config.run().rampUp().compareTo(duration) > 0) {
                builder.rampUp(duration);
            }
            return builder.build();
        }

        private static String value(String[] args, int i, String opt) {
            if (i >= args.length) {
                throw new IllegalArgumentException("Missing value for " + opt);
            }
            return args[i];
        }

        private static long parseLong(String opt, String v) {
            try {
                return Long.parseLong(v.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(opt + " expects a number, got '" + v + "'");
            }
        }

        private static long positiveLong(String opt, String v) {
            long n = parseLong(opt, v);
            if (n <= 0) throw new IllegalArgumentException(opt + " must be positive, got " + n);
            return n;
        }

        private static long nonNegativeLong(String opt, String v) {
            long n = parseLong(opt, v);
            if (n < 0) throw new IllegalArgumentException(opt + " must not be negative, got " + n);
            return n;
        }

        private static int positiveInt(String opt, String v) {
            long n = positiveLong(opt, v);
            if (n > Integer.MAX_VALUE) throw new IllegalArgumentException(opt + " is too large: " + n);
            return (int) n;
        }
    }

    private static void printUsage(PrintStream out) {
        out.println("""
            Usage: framework-bench <command> [options]

            Commands:
              compare   Run scenarios against targets A and B and compare them
              single    Run scenarios against one target
              report    Render the latest (or a given) stored comparison

            compare options:
              --users <n>            Concurrent virtual users
              --duration <s>         Run duration per target and scenario
              --ramp-up <s>          Spread worker start times over this window
              --scenario <kind>      health, rest, graphql, mixed, webhook or all (default: all)
              --a-url <url>          Target A base URL      --a-label <name>  Target A label
              --b-url <url>          Target B base URL      --b-label <name>  Target B label
              --timeout <ms>         Per-request timeout
              --think-time <ms>      Pause between requests of one user
              --pause <s>            Settle time between target A and target B
              --cutoff <policy>      finish (keep in-flight requests) or discard (drop late ones)
              --seed <n>             Seed for weighted request selection
              --format <fmt>         markdown, json or html, used for --output
              --output <path>        Also write the rendered report here
              --results-dir <dir>    Where results are stored (default: ./reports)
              --skip-preflight       Do not check /health before running

            single options:
              --url <url> --framework <name>, plus the run options above

            report options:
              --format <fmt> --output <path> --input <path> --results-dir <dir>

            Exit codes: 0 ok, 2 invalid arguments, 3 target unreachable, 4 result I/O failure, 1 unexpected error
            """);
    }
}
