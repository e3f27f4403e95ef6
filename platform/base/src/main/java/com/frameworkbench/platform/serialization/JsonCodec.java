package com.frameworkbench.platform.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.frameworkbench.platform.base.Result;

/**
 * JSON Codec factory - creates type-safe codecs for JSON serialization.
 *
 * Usage:
 *   Codec<ComparisonSuite> codec = JsonCodec.forClass(ComparisonSuite.class);
 *   Result<byte[]> bytes = codec.encode(suite);
 *   Result<ComparisonSuite> decoded = codec.decode(bytes.getOrThrow());
 *
 * Instants are written as ISO-8601 strings and durations as ISO-8601 periods,
 * output is indented so stored results stay readable.
 */
public final class JsonCodec {

    private static final ObjectMapper DEFAULT_MAPPER = createDefaultMapper();

    private JsonCodec() {} // Utility class

    /**
     * Create a codec for a specific class using the default ObjectMapper.
     */
    public static <A> Codec<A> forClass(Class<A> clazz) {
        return forClass(clazz, DEFAULT_MAPPER);
    }

    /**
     * Create a codec for a specific class with a custom ObjectMapper.
     */
    public static <A> Codec<A> forClass(Class<A> clazz, ObjectMapper mapper) {
        return Codec.of(
                value -> encode(value, mapper),
                bytes -> decode(bytes, clazz, mapper),
                "application/json",
                "json:" + clazz.getSimpleName()
        );
    }

    /**
     * Get the shared ObjectMapper instance.
     */
    public static ObjectMapper mapper() {
        return DEFAULT_MAPPER;
    }

    // ========================================================================
    // Internal encoding/decoding
    // ========================================================================

    private static <A> Result<byte[]> encode(A value, ObjectMapper mapper) {
        return Result.of(() -> mapper.writeValueAsBytes(value));
    }

    private static <A> Result<A> decode(byte[] bytes, Class<A> clazz, ObjectMapper mapper) {
        return Result.of(() -> mapper.readValue(bytes, clazz));
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
        return mapper;
    }
}
