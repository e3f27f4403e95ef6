package com.frameworkbench.platform.benchmark.report;

import java.util.Locale;

public enum ReportFormat {
    MARKDOWN("markdown", "md"),
    JSON("json", "json"),
    HTML("html", "html");

    private final String id;
    private final String extension;

    ReportFormat(String id, String extension) {
        this.id = id;
        this.extension = extension;
    }

    public String id() { return id; }

    public static ReportFormat fromString(String value) {
        String v = value.toLowerCase(Locale.ROOT);
        for (var f : values()) {
            if (f.id.equals(v) || f.extension.equals(v)) return f;
        }
        throw new IllegalArgumentException("Unknown format: " + value + " (expected markdown, json or html)");
    }

    public ReportRenderer renderer() {
        return switch (this) {
            case MARKDOWN -> new MarkdownReportRenderer();
            case JSON -> new JsonReportRenderer();
            case HTML -> new HtmlReportRenderer();
        };
    }
}
