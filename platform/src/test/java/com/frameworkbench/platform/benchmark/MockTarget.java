package com.frameworkbench.platform.benchmark;

import com.frameworkbench.platform.benchmark.scenario.WebhookScenario;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Loopback server that answers the endpoints the scenarios call, with a fixed delay per request.
 */
final class MockTarget implements AutoCloseable {

    static final String TOKEN = "mock-token-123";
    static final String WEBHOOK_SECRET = "test-secret";

    private final HttpServer server;
    private final ExecutorService executor;
    private final Duration delay;
    private final Map<String, AtomicLong> hits = new ConcurrentHashMap<>();

    private MockTarget(Duration delay) throws IOException {
        this.delay = delay;
        this.server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 128);
        this.executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);

        route("/health", ex -> json(ex, 200, "{\"status\":\"healthy\",\"framework\":\"MOCK\"}"));
        route("/metrics", ex -> json(ex, 200, "{\"framework\":\"MOCK\",\"active_connections\":1}"));
        route("/api/auth/register", ex -> json(ex, 200, "{\"success\":true,\"data\":{\"id\":\"u1\"}}"));
        route("/api/auth/login", ex -> json(ex, 200,
                "{\"success\":true,\"data\":{\"token\":\"" + TOKEN + "\",\"user\":{\"id\":\"u1\"}}}"));
        route("/api/users/me", ex -> {
            String auth = ex.getRequestHeaders().getFirst("Authorization");
            if (("Bearer " + TOKEN).equals(auth)) {
                json(ex, 200, "{\"success\":true,\"data\":{\"id\":\"u1\"}}");
            } else {
                json(ex, 401, "{\"success\":false,\"error\":\"unauthorized\"}");
            }
        });
        route("/api/products", ex -> json(ex, 200, "{\"success\":true,\"data\":[{\"id\":\"p1\",\"name\":\"Widget\",\"price\":9.99}]}"));
        route("/graphql", ex -> json(ex, 200, "{\"data\":{\"products\":[{\"id\":\"p1\",\"name\":\"Widget\",\"price\":9.99}]}}"));
        route("/webhooks/shopify", ex -> {
            String body = new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            String signature = ex.getRequestHeaders().getFirst("X-Shopify-Hmac-Sha256");
            if (signature == null) {
                json(ex, 400, "{\"success\":false}");
            } else if (signature.equals(WebhookScenario.sign(WEBHOOK_SECRET, body))) {
                json(ex, 200, "{\"success\":true,\"data\":\"Webhook processed\"}");
            } else {
                json(ex, 401, "{\"success\":false}");
            }
        });
        server.start();
    }

    static MockTarget start() throws IOException {
        return new MockTarget(Duration.ZERO);
    }

    static MockTarget start(Duration delay) throws IOException {
        return new MockTarget(delay);
    }

    /** Replace or add a handler; the configured delay still applies. */
    MockTarget route(String path, HttpHandler handler) {
        try {
            server.removeContext(path);
        } catch (IllegalArgumentException notRegistered) {
            // first registration
        }
        server.createContext(path, ex -> {
            hits.computeIfAbsent(path, p -> new AtomicLong()).incrementAndGet();
            try {
                if (!delay.isZero()) {
                    Thread.sleep(delay.toMillis());
                }
                handler.handle(ex);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                ex.close();
            }
        });
        return this;
    }

    String url() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    long hits(String path) {
        AtomicLong n = hits.get(path);
        return n == null ? 0 : n.get();
    }

    static void json(HttpExchange ex, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().set("Content-Type", "application/json");
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }
}
