package com.frameworkbench.platform.benchmark;

import com.frameworkbench.platform.base.Result;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.RunParameters;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.ScenarioConfig;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.ScenarioKind;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.Target;
import com.frameworkbench.platform.config.BenchConfig;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.frameworkbench.platform.observe.Log.*;

/**
 * Runs the same scenario against two targets, one after the other, and compares them.
 *
 * Target A runs to completion before target B starts; a settle pause separates the
 * two so one server's load never overlaps the other's measurement window.
 */
public final class FrameworkComparator {

    private final ScenarioRunner runner;
    private final Duration pauseBetweenTargets;
    private final Duration pauseBetweenScenarios;
    private final double thresholdPercent;
    private final Clock clock;

    public FrameworkComparator(ScenarioRunner runner, Duration pauseBetweenTargets,
                               Duration pauseBetweenScenarios, double thresholdPercent, Clock clock) {
        this.runner = runner;
        this.pauseBetweenTargets = pauseBetweenTargets;
        this.pauseBetweenScenarios = pauseBetweenScenarios;
        this.thresholdPercent = thresholdPercent;
        this.clock = clock;
    }

    public static FrameworkComparator fromConfig(ScenarioRunner runner, BenchConfig.CompareConfig config) {
        return new FrameworkComparator(runner, config.pauseBetweenTargets(), config.pauseBetweenScenarios(),
                config.significanceThresholdPercent(), Clock.systemUTC());
    }

    /**
     * Compare two configurations that differ only in their target.
     */
    public ComparisonReport compare(ScenarioConfig a, ScenarioConfig b) {
        if (!a.sameParametersAs(b)) {
            throw new IllegalArgumentException("Compared configurations must differ only in target");
        }
        return traced("compare." + a.kind().id(), () -> {
            attr("framework.a", a.target().label());
            attr("framework.b", b.target().label());

            AggregateResult ra = runTarget(a);
            settle(pauseBetweenTargets, "before running " + b.target().label());
            AggregateResult rb = runTarget(b);

            ComparisonReport report = ComparisonReport.of(ra, rb, thresholdPercent);
            info("{}: {} | {}", a.kind().displayName(), report.verdict().throughput(), report.verdict().responseTime());
            return report;
        });
    }

    /**
     * Compare every scenario in order, pausing between scenarios.
     */
    public ComparisonSuite compareAll(ScenarioConfig template, Target a, Target b, List<ScenarioKind> scenarios) {
        List<ComparisonReport> reports = new ArrayList<>(scenarios.size());
        for (int i = 0; i < scenarios.size(); i++) {
            if (i > 0) {
                settle(pauseBetweenScenarios, "before " + scenarios.get(i).displayName());
            }
            ScenarioConfig scenario = template.withKind(scenarios.get(i));
            reports.add(compare(scenario.withTarget(a), scenario.withTarget(b)));
        }
        return new ComparisonSuite(clock.instant(), a.label(), b.label(), RunParameters.of(template), reports);
    }

    /**
     * Run every scenario against one target.
     */
    public RunSummary runAll(ScenarioConfig template, List<ScenarioKind> scenarios) {
        List<AggregateResult> results = new ArrayList<>(scenarios.size());
        for (int i = 0; i < scenarios.size(); i++) {
            if (i > 0) {
                settle(pauseBetweenScenarios, "before " + scenarios.get(i).displayName());
            }
            results.add(runTarget(template.withKind(scenarios.get(i))));
        }
        return new RunSummary(clock.instant(), template.target().label(), RunParameters.of(template), results);
    }

    private AggregateResult runTarget(ScenarioConfig config) {
        return traced("run." + config.kind().id() + "." + config.target().label(), () -> {
            AggregateResult result = MetricsAggregator.aggregate(runner.run(config));
            attr("requests.total", result.totalRequests());
            attr("requests.successful", result.successfulRequests());
            return result;
        });
    }

    private static void settle(Duration pause, String reason) {
        if (pause.isZero() || pause.isNegative()) {
            return;
        }
        info("Pausing {}s {}", pause.toSeconds(), reason);
        Result.sleep(pause).onFailure(e -> {
            throw new IllegalStateException("Interrupted while pausing " + reason, e);
        });
    }
}
