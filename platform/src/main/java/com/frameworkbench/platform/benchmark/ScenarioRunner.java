package com.frameworkbench.platform.benchmark;

import com.frameworkbench.platform.benchmark.BenchmarkTypes.Classification;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.CutoffPolicy;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.RequestOutcome;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.ScenarioConfig;
import com.frameworkbench.platform.benchmark.scenario.RequestSpec;
import com.frameworkbench.platform.benchmark.scenario.ResponseClassifier;
import com.frameworkbench.platform.benchmark.scenario.Scenario;
import com.frameworkbench.platform.benchmark.scenario.Scenarios;
import com.frameworkbench.platform.benchmark.transport.Transport;
import com.frameworkbench.platform.benchmark.transport.Transport.Exchange;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.SplittableRandom;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static com.frameworkbench.platform.observe.Log.*;

/**
 * Drives one scenario against one target with a fixed number of concurrent virtual users.
 *
 * Each worker records outcomes into its own buffer; buffers are merged after all
 * workers have joined, so the returned outcome list is complete and nothing is shared
 * while the run is hot. Workers check the deadline between requests: a request already
 * in flight when the duration elapses is handled by the {@link CutoffPolicy}.
 */
public final class ScenarioRunner {

    private final Transport transport;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile CountDownLatch stopSignal = new CountDownLatch(0);

    public ScenarioRunner(Transport transport) {
        this.transport = transport;
    }

    public ScenarioRun run(ScenarioConfig config) {
        return run(config, Scenarios.forKind(config.kind(), config.workload()));
    }

    public ScenarioRun run(ScenarioConfig config, Scenario scenario) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A run is already in progress");
        }
        CountDownLatch stop = new CountDownLatch(1);
        stopSignal = stop;
        try {
            return execute(config, scenario, stop);
        } finally {
            stop.countDown();
            running.set(false);
        }
    }

    /** Ask the current run to stop; workers finish their in-flight request and exit. */
    public void stop() {
        stopSignal.countDown();
    }

    public boolean isRunning() {
        return running.get();
    }

    // ========================================================================
    // Run
    // ========================================================================

    private ScenarioRun execute(ScenarioConfig config, Scenario scenario, CountDownLatch stop) {
        String label = config.target().label();
        info("Running {} against {} ({}): {} users for {}s, ramp-up {}s",
                config.kind().displayName(), label, config.target().baseUrl(),
                config.concurrency(), config.duration().toSeconds(), config.rampUp().toSeconds());

        ExecutorService pool = Executors.newFixedThreadPool(config.concurrency(), workerThreads(label));
        Instant startedAt = Instant.now();
        long start = System.nanoTime();
        long deadline = start + config.duration().toNanos();

        List<Future<WorkerReport>> futures = new ArrayList<>(config.concurrency());
        for (int i = 0; i < config.concurrency(); i++) {
            final int index = i;
            futures.add(pool.submit(() -> work(index, config, scenario, start, deadline, stop)));
        }

        List<RequestOutcome> outcomes = new ArrayList<>();
        int aborted = 0;
        long late = 0;
        try {
            for (Future<WorkerReport> f : futures) {
                WorkerReport report = await(f, stop);
                if (report == null) {
                    aborted++;
                    continue;
                }
                outcomes.addAll(report.outcomes());
                if (report.aborted()) aborted++;
                late += report.lateDiscarded();
            }
        } finally {
            pool.shutdownNow();
        }

        Duration wallClock = config.cutoffPolicy() == CutoffPolicy.DISCARD_LATE
                ? config.duration()
                : Duration.ofNanos(System.nanoTime() - start);

        info("{} on {} finished: {} requests in {}ms ({} aborted workers, {} late outcomes discarded)",
                config.kind().id(), label, outcomes.size(), wallClock.toMillis(), aborted, late);
        if (aborted > 0) {
            warn("{} of {} workers against {} gave up after {} consecutive connection failures",
                    aborted, config.concurrency(), label, config.connectRetryBudget() + 1);
        }
        return new ScenarioRun(config, startedAt, wallClock, outcomes, aborted, late);
    }

    private WorkerReport await(Future<WorkerReport> f, CountDownLatch stop) {
        try {
            return f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop.countDown();
            return doneOrNull(f);
        } catch (ExecutionException e) {
            stop.countDown();
            error("Worker failed unexpectedly", e.getCause());
            throw new IllegalStateException("Worker failed: " + e.getCause(), e.getCause());
        }
    }

    private static WorkerReport doneOrNull(Future<WorkerReport> f) {
        if (!f.isDone()) {
            f.cancel(true);
            return null;
        }
        try {
            return f.get();
        } catch (InterruptedException | ExecutionException e) {
            return null;
        }
    }

    // ========================================================================
    // Worker
    // ========================================================================

    private record WorkerReport(List<RequestOutcome> outcomes, boolean aborted, long lateDiscarded) {}

    private WorkerReport work(int index, ScenarioConfig config, Scenario scenario,
                              long start, long deadline, CountDownLatch stop) {
        List<RequestOutcome> buffer = new ArrayList<>();
        long late = 0;

        // Ramp-up: worker i starts at i/N of the ramp-up window; the deadline stays global.
        long startAt = start + config.rampUp().toNanos() * index / config.concurrency();
        if (pause(startAt - System.nanoTime(), deadline, stop)) {
            return new WorkerReport(buffer, false, 0);
        }

        Scenario.Session session = scenario.newSession(index, new SplittableRandom(config.seed() + index));
        int consecutiveConnectFailures = 0;
        long thinkNanos = config.thinkTime().toNanos();

        while (System.nanoTime() < deadline && stop.getCount() > 0 && !Thread.currentThread().isInterrupted()) {
            RequestSpec request = session.next();
            Attempt attempt = send(config, session, request);
            RequestOutcome outcome = attempt.outcome();

            consecutiveConnectFailures = attempt.connectFailure() ? consecutiveConnectFailures + 1 : 0;
            boolean giveUp = consecutiveConnectFailures > config.connectRetryBudget();
            if (giveUp) {
                outcome = outcome.asTerminal();
            }

            if (attempt.completedAt() > deadline && config.cutoffPolicy() == CutoffPolicy.DISCARD_LATE) {
                late++;
            } else {
                buffer.add(outcome);
            }

            if (giveUp) {
                debug("Worker {} against {} giving up: {}", index, config.target().label(), outcome.tag());
                return new WorkerReport(buffer, true, late);
            }
            if (thinkNanos > 0 && pause(thinkNanos, deadline, stop)) {
                break;
            }
        }
        return new WorkerReport(buffer, false, late);
    }

    private record Attempt(RequestOutcome outcome, boolean connectFailure, long completedAt) {}

    private Attempt send(ScenarioConfig config, Scenario.Session session, RequestSpec request) {
        Instant timestamp = Instant.now();
        long t0 = System.nanoTime();
        Classification classification;
        int status = 0;
        long bytes = 0;
        try {
            Exchange exchange = transport.send(config.target().resolve(request.path()), request, config.requestTimeout());
            status = exchange.status();
            bytes = exchange.bytesReceived();
            classification = session.observe(request, exchange, ResponseClassifier.classify(request, exchange));
        } catch (IOException e) {
            classification = ResponseClassifier.classifyFailure(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            classification = ResponseClassifier.classifyFailure(e);
        } catch (IllegalArgumentException e) {
            // unresolvable host or a path that does not form a valid URI
            classification = ResponseClassifier.classifyFailure(e);
        }
        long t1 = System.nanoTime();
        RequestOutcome outcome = RequestOutcome.of(timestamp, config.kind(), request.endpoint(),
                Duration.ofNanos(t1 - t0), classification, status, bytes);
        return new Attempt(outcome, classification.connectFailure(), t1);
    }

    /**
     * Wait up to {@code nanos}, never past the deadline.
     *
     * @return true if the run should end (stop requested, deadline reached or interrupted)
     */
    private static boolean pause(long nanos, long deadline, CountDownLatch stop) {
        long remaining = deadline - System.nanoTime();
        long wait = Math.min(nanos, remaining);
        if (wait <= 0) {
            return remaining <= 0 || stop.getCount() == 0;
        }
        try {
            return stop.await(wait, TimeUnit.NANOSECONDS) || System.nanoTime() >= deadline;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private static ThreadFactory workerThreads(String label) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "bench-" + label.toLowerCase(Locale.ROOT) + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
