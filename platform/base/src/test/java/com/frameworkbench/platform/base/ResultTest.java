package com.frameworkbench.platform.base;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ResultTest {

    @Test
    void ofCapturesCheckedExceptions() {
        Result<String> r = Result.of(() -> {
            throw new IOException("disk full");
        });

        assertTrue(r.isFailure());
        assertInstanceOf(IOException.class, r.error().orElseThrow());
        assertEquals("fallback", r.getOrElse("fallback"));
    }

    @Test
    void mapAndFlatMapChainOnSuccess() {
        Result<Integer> r = Result.success("21")
                .map(Integer::parseInt)
                .flatMap(n -> Result.success(n * 2));

        assertEquals(42, r.getOrThrow());
    }

    @Test
    void mapTurnsThrowingFunctionIntoFailure() {
        Result<Integer> r = Result.success("not a number").map(Integer::parseInt);

        assertTrue(r.isFailure());
        assertInstanceOf(NumberFormatException.class, r.error().orElseThrow());
    }

    @Test
    void failureSkipsCombinatorsAndFoldsToErrorBranch() {
        Result<Integer> r = Result.<String>failure("boom").map(String::length);

        String folded = r.fold(e -> "error: " + e.getMessage(), n -> "value: " + n);
        assertEquals("error: boom", folded);
    }

    @Test
    void getOrThrowWrapsCheckedCause() {
        Result<String> r = Result.failure(new IOException("io"));

        RuntimeException e = assertThrows(RuntimeException.class, r::getOrThrow);
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void mapFailureReplacesTheError() {
        Result<String> r = Result.<String>failure("raw")
                .mapFailure(e -> new IllegalStateException("wrapped", e));

        assertInstanceOf(IllegalStateException.class, r.error().orElseThrow());
    }

    @Test
    void callbacksRunOnlyOnTheirBranch() {
        AtomicReference<String> seen = new AtomicReference<>("none");

        Result.success("ok").onFailure(e -> seen.set("failure")).onSuccess(seen::set);
        assertEquals("ok", seen.get());

        Result.failure("bad").onSuccess(v -> seen.set("success")).onFailure(e -> seen.set(e.getMessage()));
        assertEquals("bad", seen.get());
    }

    @Test
    void sleepRestoresInterruptFlag() {
        Thread.currentThread().interrupt();
        try {
            Result<Boolean> r = Result.sleep(Duration.ofSeconds(5));

            assertTrue(r.isFailure());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void successRejectsNull() {
        assertThrows(NullPointerException.class, () -> Result.success(null));
    }
}
