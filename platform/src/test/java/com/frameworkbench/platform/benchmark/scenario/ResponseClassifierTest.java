package com.frameworkbench.platform.benchmark.scenario;

import com.frameworkbench.platform.benchmark.BenchmarkTypes.Classification;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.ErrorCategory;
import com.frameworkbench.platform.benchmark.transport.Transport.Exchange;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ResponseClassifierTest {

    private static final RequestSpec PLAIN = RequestSpec.get("/health", RequestSpec.Expectation.ANY_2XX);
    private static final RequestSpec API = RequestSpec.get("/api/products", RequestSpec.Expectation.API_ENVELOPE);
    private static final RequestSpec GRAPHQL = GraphQlScenario.PRODUCTS_QUERY;

    private static Exchange response(int status, String body) {
        return new Exchange(status, body, body.length());
    }

    @Test
    void nonSuccessStatusIsTaggedWithTheCode() {
        Classification c = ResponseClassifier.classify(API, response(503, "{\"success\":false}"));

        assertEquals(ErrorCategory.HTTP_STATUS, c.category());
        assertEquals("http_503", c.tag());
        assertFalse(c.connectFailure());
    }

    @Test
    void plainEndpointAcceptsAnyBody() {
        assertTrue(ResponseClassifier.classify(PLAIN, response(200, "OK")).isSuccess());
        assertTrue(ResponseClassifier.classify(PLAIN, response(204, "")).isSuccess());
    }

    @Test
    void apiEnvelope() {
        assertTrue(ResponseClassifier.classify(API, response(200, "{\"success\":true,\"data\":[]}")).isSuccess());
        assertTrue(ResponseClassifier.classify(API, response(201, "{\"data\":{}}")).isSuccess());
        assertEquals(ErrorCategory.APPLICATION_ERROR,
                ResponseClassifier.classify(API, response(200, "{\"success\":false,\"error\":\"nope\"}")).category());
        assertEquals(ErrorCategory.MALFORMED_BODY,
                ResponseClassifier.classify(API, response(200, "<html>oops</html>")).category());
        assertEquals(ErrorCategory.MALFORMED_BODY,
                ResponseClassifier.classify(API, response(200, "[1,2]")).category());
    }

    @Test
    void graphQlPayload() {
        assertTrue(ResponseClassifier.classify(GRAPHQL, response(200, "{\"data\":{\"products\":[]}}")).isSuccess());
        assertEquals(ErrorCategory.APPLICATION_ERROR, ResponseClassifier.classify(GRAPHQL,
                response(200, "{\"data\":null,\"errors\":[{\"message\":\"bad\"}]}")).category());
        assertEquals(ErrorCategory.MALFORMED_BODY,
                ResponseClassifier.classify(GRAPHQL, response(200, "{\"data\":null}")).category());
        assertEquals(ErrorCategory.MALFORMED_BODY,
                ResponseClassifier.classify(GRAPHQL, response(200, "")).category());
    }

    @Test
    void connectionEstablishmentFailuresCountAgainstRetryBudget() {
        Classification refused = ResponseClassifier.classifyFailure(new ConnectException("refused"));
        assertEquals(Classification.connectFailed(), refused);
        assertEquals(ErrorCategory.CONNECTION_ERROR, refused.category());
        assertTrue(ResponseClassifier.classifyFailure(new ConnectException("refused")).connectFailure());
        assertTrue(ResponseClassifier.classifyFailure(new HttpConnectTimeoutException("connect timed out")).connectFailure());
        assertTrue(ResponseClassifier.classifyFailure(new IOException("wrapped", new ConnectException("refused")))
                .connectFailure());
    }

    @Test
    void requestTimeoutIsATimeout() {
        Classification c = ResponseClassifier.classifyFailure(new HttpTimeoutException("request timed out"));

        assertEquals(ErrorCategory.TIMEOUT, c.category());
        assertFalse(c.connectFailure());
    }

    @Test
    void otherIoFailuresAreConnectionErrorsWithoutAborting() {
        Classification c = ResponseClassifier.classifyFailure(new IOException("connection reset"));

        assertEquals(ErrorCategory.CONNECTION_ERROR, c.category());
        assertFalse(c.connectFailure());
    }
}
