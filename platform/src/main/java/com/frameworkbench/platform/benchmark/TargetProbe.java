package com.frameworkbench.platform.benchmark;

import com.frameworkbench.platform.base.Result;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.Classification;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.Target;
import com.frameworkbench.platform.benchmark.scenario.RequestSpec;
import com.frameworkbench.platform.benchmark.scenario.ResponseClassifier;
import com.frameworkbench.platform.benchmark.transport.Transport;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;

import static com.frameworkbench.platform.observe.Log.*;

/**
 * Preflight check: can a connection to the target be established at all?
 *
 * Any HTTP response, even an error status, counts as reachable; only connection
 * establishment failures count against the retry budget.
 */
public final class TargetProbe {

    private static final RequestSpec HEALTH = RequestSpec.get("/health", RequestSpec.Expectation.ANY_2XX);
    private static final Duration RETRY_DELAY = Duration.ofMillis(500);

    private final Transport transport;
    private final Duration timeout;
    private final int retryBudget;

    public TargetProbe(Transport transport, Duration timeout, int retryBudget) {
        this.transport = transport;
        this.timeout = timeout;
        this.retryBudget = retryBudget;
    }

    /** @return the health status code, or a failure with {@link ConnectException} when unreachable */
    public Result<Integer> check(Target target) {
        Throwable last = null;
        for (int attempt = 0; attempt <= retryBudget; attempt++) {
            if (attempt > 0 && Result.sleep(RETRY_DELAY).isFailure()) {
                break;
            }
            try {
                int status = transport.send(target.resolve(HEALTH.path()), HEALTH, timeout).status();
                if (status < 200 || status >= 300) {
                    warn("{} health check returned {}", target.label(), status);
                } else {
                    debug("{} is reachable at {}", target.label(), target.baseUrl());
                }
                return Result.success(status);
            } catch (IOException e) {
                last = e;
                Classification c = ResponseClassifier.classifyFailure(e);
                if (!c.connectFailure()) {
                    // a response timeout still means something accepted the connection
                    warn("{} health check failed ({}), continuing", target.label(), c.tag());
                    return Result.success(0);
                }
                debug("{} not reachable (attempt {}): {}", target.label(), attempt + 1, e.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Result.failure(e);
            }
        }
        ConnectException unreachable = new ConnectException(
                target.label() + " is not reachable at " + target.baseUrl());
        if (last != null) unreachable.initCause(last);
        return Result.failure(unreachable);
    }
}
