package com.frameworkbench.platform.serialization;

import com.frameworkbench.platform.base.Result;

import java.util.function.Function;

/**
 * Functional Codec interface - Strategy pattern with type parameters.
 *
 * @param <A> The type to serialize/deserialize
 */
public interface Codec<A> {

    /**
     * Encode value to bytes.
     */
    Result<byte[]> encode(A value);

    /**
     * Decode bytes to value.
     */
    Result<A> decode(byte[] bytes);

    /**
     * Content type (e.g., "application/json")
     */
    String contentType();

    /**
     * Codec name for logging
     */
    String name();

    // ========================================================================
    // Factory
    // ========================================================================

    static <A> Codec<A> of(
            Function<A, Result<byte[]>> encoder,
            Function<byte[], Result<A>> decoder,
            String contentType,
            String name) {
        return new Codec<>() {
            @Override
            public Result<byte[]> encode(A value) {
                return encoder.apply(value);
            }

            @Override
            public Result<A> decode(byte[] bytes) {
                return decoder.apply(bytes);
            }

            @Override
            public String contentType() {
                return contentType;
            }

            @Override
            public String name() {
                return name;
            }
        };
    }
}
