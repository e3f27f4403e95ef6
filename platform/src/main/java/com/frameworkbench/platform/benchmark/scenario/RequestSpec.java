package com.frameworkbench.platform.benchmark.scenario;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.frameworkbench.platform.serialization.JsonCodec;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One request a session wants sent.
 *
 * @param endpoint    label the outcome is recorded under, e.g. {@code "GET /api/products"}
 * @param body        request body, or null for none
 * @param expectation how a 2xx response body is judged
 */
public record RequestSpec(
        String endpoint,
        String method,
        String path,
        Map<String, String> headers,
        String body,
        Expectation expectation
) {
    public RequestSpec {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        expectation = expectation != null ? expectation : Expectation.ANY_2XX;
    }

    /** How the body of a successful response is checked. */
    public enum Expectation {
        /** Any 2xx response counts as success. */
        ANY_2XX,
        /** JSON envelope with a {@code success} flag; {@code false} is an application error. */
        API_ENVELOPE,
        /** GraphQL response; a non-empty {@code errors} array is an application error. */
        GRAPHQL
    }

    public static RequestSpec get(String path, Expectation expectation) {
        return new RequestSpec("GET " + path, "GET", path, Map.of(), null, expectation);
    }

    public static RequestSpec postJson(String path, String json, Expectation expectation) {
        return new RequestSpec("POST " + path, "POST", path,
                Map.of("Content-Type", "application/json"), json, expectation);
    }

    /** POST with the payload serialized as compact JSON. */
    public static RequestSpec postPayload(String path, Object payload, Expectation expectation) {
        return postJson(path, json(payload), expectation);
    }

    static String json(Object payload) {
        try {
            return JsonCodec.mapper().writer()
                    .without(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public RequestSpec withHeader(String name, String value) {
        var h = new LinkedHashMap<>(headers);
        h.put(name, value);
        return new RequestSpec(endpoint, method, path, h, body, expectation);
    }

    /** Same request recorded under a different endpoint label. */
    public RequestSpec labeled(String label) {
        return new RequestSpec(label, method, path, headers, body, expectation);
    }
}
