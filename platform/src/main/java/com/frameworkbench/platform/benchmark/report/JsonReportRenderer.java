package com.frameworkbench.platform.benchmark.report;

import com.frameworkbench.platform.benchmark.ComparisonSuite;
import com.frameworkbench.platform.benchmark.RunSummary;
import com.frameworkbench.platform.serialization.Codec;
import com.frameworkbench.platform.serialization.JsonCodec;

import java.nio.charset.StandardCharsets;

/**
 * JSON mirror of the suite, in the same shape the result store persists.
 */
public final class JsonReportRenderer implements ReportRenderer {

    private final Codec<ComparisonSuite> suiteCodec = JsonCodec.forClass(ComparisonSuite.class);
    private final Codec<RunSummary> summaryCodec = JsonCodec.forClass(RunSummary.class);

    @Override
    public ReportFormat format() {
        return ReportFormat.JSON;
    }

    @Override
    public String render(ComparisonSuite suite) {
        return text(suiteCodec.encode(suite).getOrThrow());
    }

    @Override
    public String render(RunSummary summary) {
        return text(summaryCodec.encode(summary).getOrThrow());
    }

    private static String text(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8) + "\n";
    }
}
