package com.frameworkbench.platform.benchmark.transport;

import com.frameworkbench.platform.benchmark.scenario.RequestSpec;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link Transport} over {@link HttpClient}, one client shared by all workers.
 *
 * <p>{@link HttpRequest.Builder#timeout} only bounds the wait for response headers, so the whole
 * exchange, body included, runs against its own deadline and is cancelled when it expires.
 */
public final class HttpClientTransport implements Transport {

    private final HttpClient client;

    public HttpClientTransport(Duration connectTimeout) {
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Override
    public Exchange send(URI uri, RequestSpec request, Duration timeout) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout);
        request.headers().forEach(builder::header);

        if (request.body() != null) {
            builder.method(request.method(), HttpRequest.BodyPublishers.ofString(request.body(), StandardCharsets.UTF_8));
        } else {
            builder.method(request.method(), HttpRequest.BodyPublishers.noBody());
        }

        CompletableFuture<HttpResponse<byte[]>> pending =
                client.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        HttpResponse<byte[]> response = await(pending, uri, timeout);
        byte[] bytes = response.body();
        return new Exchange(response.statusCode(), new String(bytes, StandardCharsets.UTF_8), bytes.length);
    }

    private static HttpResponse<byte[]> await(CompletableFuture<HttpResponse<byte[]>> pending, URI uri,
                                              Duration timeout) throws IOException, InterruptedException {
        try {
            return pending.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new HttpTimeoutException("exchange with " + uri + " exceeded " + timeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            pending.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IOException(cause);
        }
    }
}
