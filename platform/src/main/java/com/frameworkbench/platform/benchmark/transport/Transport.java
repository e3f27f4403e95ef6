package com.frameworkbench.platform.benchmark.transport;

import com.frameworkbench.platform.benchmark.scenario.RequestSpec;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * Sends one request and waits for the complete response.
 *
 * Implementations must be safe to call from many worker threads at once.
 * Failures surface as exceptions; the runner classifies them. {@code timeout} bounds the
 * whole exchange, body included, and expiry surfaces as {@link java.net.http.HttpTimeoutException}.
 */
public interface Transport extends AutoCloseable {

    Exchange send(URI uri, RequestSpec request, Duration timeout) throws IOException, InterruptedException;

    @Override
    default void close() {}

    /** Status and body of a completed exchange. */
    record Exchange(int status, String body, long bytesReceived) {
        public boolean isSuccessStatus() {
            return status >= 200 && status < 300;
        }
    }
}
