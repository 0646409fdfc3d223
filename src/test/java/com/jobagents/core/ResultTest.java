package com.jobagents.core;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

public class ResultTest {

    @Test
    public void testOk() {
        Result<Integer> result = Result.ok(3);
        assertTrue(result.isOk());
        assertEquals(3, result.get());
        assertEquals(6, result.map(v -> v * 2).get());
    }

    @Test
    public void testFailureKeepsCause() {
        IOException cause = new IOException("connection reset");
        Result<String> result = Result.failure("GET /jobs/ failed", cause);

        assertTrue(result.isFailure());
        assertEquals("GET /jobs/ failed", result.getError());
        assertSame(cause, result.getCause());
        assertEquals("fallback", result.orElse("fallback"));
        assertThrows(NoSuchElementException.class, result::get);
        assertTrue(result.map(String::length).isFailure());
    }
}
