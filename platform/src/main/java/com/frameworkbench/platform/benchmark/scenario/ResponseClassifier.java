package com.frameworkbench.platform.benchmark.scenario;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.Classification;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.ErrorCategory;
import com.frameworkbench.platform.benchmark.transport.Transport.Exchange;
import com.frameworkbench.platform.serialization.JsonCodec;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.util.Optional;

/**
 * Maps responses and transport failures to error categories.
 */
public final class ResponseClassifier {

    private static final ObjectMapper MAPPER = JsonCodec.mapper();

    private ResponseClassifier() {}

    public static Classification classify(RequestSpec request, Exchange exchange) {
        if (!exchange.isSuccessStatus()) {
            return Classification.httpStatus(exchange.status());
        }
        return switch (request.expectation()) {
            case ANY_2XX -> Classification.success();
            case API_ENVELOPE -> classifyEnvelope(exchange.body());
            case GRAPHQL -> classifyGraphQl(exchange.body());
        };
    }

    /**
     * Classify a failed send. Connection establishment failures are checked before
     * request timeouts since {@link HttpConnectTimeoutException} is a timeout subtype.
     */
    public static Classification classifyFailure(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof HttpConnectTimeoutException
                    || t instanceof ConnectException
                    || t instanceof UnknownHostException
                    || t instanceof UnresolvedAddressException) {
                return Classification.connectFailed();
            }
        }
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof HttpTimeoutException) {
                return Classification.of(ErrorCategory.TIMEOUT);
            }
        }
        return Classification.of(ErrorCategory.CONNECTION_ERROR);
    }

    /** Parse a JSON body, empty when it is not JSON. */
    public static Optional<JsonNode> parse(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.readTree(body));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private static Classification classifyEnvelope(String body) {
        Optional<JsonNode> parsed = parse(body);
        if (parsed.isEmpty() || !parsed.get().isObject()) {
            return Classification.of(ErrorCategory.MALFORMED_BODY);
        }
        JsonNode success = parsed.get().get("success");
        if (success != null && success.isBoolean() && !success.booleanValue()) {
            return Classification.of(ErrorCategory.APPLICATION_ERROR);
        }
        return Classification.success();
    }

    private static Classification classifyGraphQl(String body) {
        Optional<JsonNode> parsed = parse(body);
        if (parsed.isEmpty() || !parsed.get().isObject()) {
            return Classification.of(ErrorCategory.MALFORMED_BODY);
        }
        JsonNode root = parsed.get();
        JsonNode errors = root.get("errors");
        if (errors != null && errors.isArray() && errors.size() > 0) {
            return Classification.of(ErrorCategory.APPLICATION_ERROR);
        }
        JsonNode data = root.get("data");
        if (data == null || data.isNull()) {
            return Classification.of(ErrorCategory.MALFORMED_BODY);
        }
        return Classification.success();
    }
}
