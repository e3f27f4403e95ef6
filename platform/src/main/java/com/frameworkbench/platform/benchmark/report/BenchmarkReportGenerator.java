package com.frameworkbench.platform.benchmark.report;

import com.frameworkbench.platform.base.Result;
import com.frameworkbench.platform.benchmark.ComparisonSuite;
import com.frameworkbench.platform.benchmark.RunSummary;
import com.frameworkbench.platform.serialization.Codec;
import com.frameworkbench.platform.serialization.JsonCodec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

import static com.frameworkbench.platform.observe.Log.*;

/**
 * Persists results as JSON and writes rendered reports.
 *
 * Output structure:
 *   {resultsDir}/comparison-{timestamp}.json
 *   {resultsDir}/latest-comparison.json
 *   {resultsDir}/single-{framework}-{timestamp}.json
 *
 * Timestamps carry milliseconds; a name that is still taken gets a {@code -1}, {@code -2}, ...
 * suffix, so stored results are never overwritten.
 */
public class BenchmarkReportGenerator {

    public static final String LATEST_COMPARISON = "latest-comparison.json";

    private static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS").withZone(ZoneOffset.UTC);

    private final Path resultsDir;
    private final Codec<ComparisonSuite> suiteCodec = JsonCodec.forClass(ComparisonSuite.class);
    private final Codec<RunSummary> summaryCodec = JsonCodec.forClass(RunSummary.class);

    // ========================================================================
    // Static Factories
    // ========================================================================

    public static BenchmarkReportGenerator create(Path resultsDir) {
        return new BenchmarkReportGenerator(resultsDir);
    }

    private BenchmarkReportGenerator(Path resultsDir) {
        this.resultsDir = resultsDir;
    }

    // ========================================================================
    // Result store
    // ========================================================================

    /**
     * Store a suite as a timestamped file and as the latest comparison.
     */
    public Result<Path> saveSuite(ComparisonSuite suite) {
        return suiteCodec.encode(suite).flatMap(bytes -> Result.of(() -> {
            Path path = writeNew("comparison-" + FILE_TIMESTAMP.format(suite.generatedAt()), bytes);
            Files.copy(path, resultsDir.resolve(LATEST_COMPARISON), StandardCopyOption.REPLACE_EXISTING);
            info("Saved comparison results: {}", path);
            return path;
        }));
    }

    public Result<Path> saveSummary(RunSummary summary) {
        return summaryCodec.encode(summary).flatMap(bytes -> Result.of(() -> {
            Path path = writeNew("single-" + fileSafe(summary.framework()) + "-"
                    + FILE_TIMESTAMP.format(summary.generatedAt()), bytes);
            info("Saved results: {}", path);
            return path;
        }));
    }

    /** Load the latest stored comparison. */
    public Result<ComparisonSuite> loadLatest() {
        return loadSuite(resultsDir.resolve(LATEST_COMPARISON));
    }

    public Result<ComparisonSuite> loadSuite(Path path) {
        return Result.of(() -> Files.readAllBytes(path))
                .mapFailure(e -> e instanceof NoSuchFileException
                        ? new NoSuchFileException(path.toString(), null,
                                "no stored results; run 'compare' first or pass --input")
                        : e)
                .flatMap(suiteCodec::decode);
    }

    // ========================================================================
    // Rendered reports
    // ========================================================================

    public static Result<Path> writeReport(String text, Path output) {
        return Result.of(() -> {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, text, StandardCharsets.UTF_8);
            info("Report written: {}", output);
            return output;
        });
    }

    private Path writeNew(String stem, byte[] bytes) throws IOException {
        Files.createDirectories(resultsDir);
        for (int attempt = 0; ; attempt++) {
            Path path = resultsDir.resolve(attempt == 0 ? stem + ".json" : stem + "-" + attempt + ".json");
            try {
                Files.write(path, bytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                return path;
            } catch (FileAlreadyExistsException e) {
                debug("Result file {} exists, trying next suffix", path);
            }
        }
    }

    private static String fileSafe(String label) {
        return label.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]+", "_");
    }
}
