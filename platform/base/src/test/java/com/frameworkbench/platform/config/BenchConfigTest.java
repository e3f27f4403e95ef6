package com.frameworkbench.platform.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BenchConfigTest {

    @Test
    void referenceDefaultsAreLoaded() {
        BenchConfig config = BenchConfig.from(ConfigFactory.empty());

        assertEquals("AXUM", config.targets().a().label());
        assertEquals("LOCO", config.targets().b().label());
        assertEquals(100, config.run().users());
        assertEquals(Duration.ofSeconds(60), config.run().duration());
        assertEquals(Duration.ofSeconds(5), config.run().requestTimeout());
        assertEquals(Duration.ofSeconds(10), config.run().rampUp());
        assertEquals(Duration.ofMillis(10), config.run().thinkTime());
        assertEquals("finish-in-flight", config.run().cutoffPolicy());
        assertEquals(1.0, config.compare().significanceThresholdPercent());
        assertEquals("markdown", config.report().defaultFormat());
        assertEquals("BenchmarkPass123!", config.workload().userPassword());
    }

    @Test
    void explicitValuesOverrideReference() {
        BenchConfig config = BenchConfig.from(ConfigFactory.parseString("""
                bench.run.users = 7
                bench.run.duration = 3s
                bench.run.cutoff-policy = discard-late
                bench.targets.b.url = "http://10.0.0.2:8080"
                bench.compare.pause-between-targets = 0s
                """));

        assertEquals(7, config.run().users());
        assertEquals(Duration.ofSeconds(3), config.run().duration());
        assertEquals("discard-late", config.run().cutoffPolicy());
        assertEquals("http://10.0.0.2:8080", config.targets().b().url());
        assertEquals(Duration.ZERO, config.compare().pauseBetweenTargets());
        // untouched sections keep their defaults
        assertEquals(Duration.ofSeconds(5), config.compare().pauseBetweenScenarios());
    }

    @Test
    void runSectionReadsOptionalDurations() {
        BenchConfig.RunConfig run = BenchConfig.RunConfig.from(ConfigFactory.parseString("""
                users = 2
                duration = 4s
                ramp-up = 1500ms
                request-timeout = 750ms
                think-time = 25ms
                """));

        assertEquals(Duration.ofSeconds(4), run.duration());
        assertEquals(Duration.ofMillis(1500), run.rampUp());
        assertEquals(Duration.ofMillis(750), run.requestTimeout());
        assertEquals(Duration.ofMillis(25), run.thinkTime());
    }

    @Test
    void runSectionDefaultsMissingRampUpAndThinkTimeToZero() {
        BenchConfig.RunConfig run = BenchConfig.RunConfig.from(ConfigFactory.parseString("""
                users = 1
                duration = 1s
                request-timeout = 1s
                """));

        assertEquals(Duration.ZERO, run.rampUp());
        assertEquals(Duration.ZERO, run.thinkTime());
        assertEquals(3, run.connectRetryBudget());
        assertEquals(42L, run.seed());
    }

    @Test
    void accessorFallsBackForMissingPaths() {
        Config c = ConfigFactory.parseString("present = 5\nwait = 250ms");

        assertEquals(Optional.of(5), ConfigAccessor.intVal(c, "present"));
        assertEquals(Optional.empty(), ConfigAccessor.intVal(c, "absent"));
        assertEquals(9, ConfigAccessor.intVal(c, "absent", 9));
        assertEquals(Duration.ofMillis(250), ConfigAccessor.duration(c, "wait", Duration.ZERO));
        assertEquals("x", ConfigAccessor.string(c, "absent", "x"));
        assertEquals(2.5, ConfigAccessor.doubleVal(c, "absent", 2.5));
        assertEquals(5L, ConfigAccessor.longVal(c, "present", 0L));
    }
}
