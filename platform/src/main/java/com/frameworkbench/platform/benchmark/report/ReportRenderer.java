package com.frameworkbench.platform.benchmark.report;

import com.frameworkbench.platform.benchmark.AggregateResult;
import com.frameworkbench.platform.benchmark.ComparisonReport;
import com.frameworkbench.platform.benchmark.ComparisonSuite;
import com.frameworkbench.platform.benchmark.RunSummary;

import java.util.List;
import java.util.Locale;

/**
 * Renders results as text. Implementations are pure: same input, same output.
 */
public interface ReportRenderer {

    ReportFormat format();

    String render(ComparisonSuite suite);

    String render(RunSummary summary);

    /** A single comparison, rendered as a one-entry suite. */
    default String render(ComparisonReport report, ComparisonSuite context) {
        return render(new ComparisonSuite(context.generatedAt(), context.frameworkA(), context.frameworkB(),
                context.parameters(), List.of(report)));
    }

    // ========================================================================
    // Shared formatting
    // ========================================================================

    static String number(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }

    static String percent(double v) {
        return String.format(Locale.ROOT, "%.2f%%", v);
    }

    /** Signed delta, "n/a" when undefined. */
    static String delta(Double v) {
        return v == null ? "n/a" : String.format(Locale.ROOT, "%+.1f%%", v);
    }

    static String errorRate(AggregateResult r) {
        return percent(r.errorRate());
    }
}
