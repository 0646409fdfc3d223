package com.jobagents.core;

import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Outcome of a call into an external collaborator (backend API, search adapter, database).
 *
 * <p>Collaborators never throw across their boundary. They return either a value or a
 * failure carrying a short reason and, where one exists, the underlying exception.
 * Agents inspect the outcome and apply their own skip/retry policy.</p>
 *
 * <pre>{@code
 * Result<List<Candidate>> fetched = source.fetchCandidates();
 * if (fetched.isFailure()) {
 *     logger.warning("Fetch failed: " + fetched.getError());
 *     return StepOutcome.FAILED;
 * }
 * List<Candidate> candidates = fetched.get();
 * }</pre>
 *
 * @param <T> the success value type
 */
public final class Result<T> {
    private final T value;
    private final String error;
    private final Throwable cause;

    private Result(T value, String error, Throwable cause) {
        this.value = value;
        this.error = error;
        this.cause = cause;
    }

    /**
     * Create a successful result.
     *
     * @param value the value produced by the collaborator (may be null for void-like calls)
     * @return a successful result
     */
    public static <T> Result<T> ok(T value) {
        return new Result<>(value, null, null);
    }

    /**
     * Create a failed result.
     *
     * @param error human-readable reason, logged by the caller
     * @return a failed result
     */
    public static <T> Result<T> failure(String error) {
        return new Result<>(null, error == null ? "unknown error" : error, null);
    }

    /**
     * Create a failed result that keeps the exception which caused it.
     *
     * @param error human-readable reason
     * @param cause the exception caught inside the adapter
     * @return a failed result
     */
    public static <T> Result<T> failure(String error, Throwable cause) {
        return new Result<>(null, error == null ? "unknown error" : error, cause);
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * Get the success value.
     *
     * @return the value
     * @throws NoSuchElementException if this is a failure
     */
    public T get() {
        if (error != null) {
            throw new NoSuchElementException("No value present, call failed: " + error);
        }
        return value;
    }

    public T orElse(T other) {
        return error == null ? value : other;
    }

    public String getError() {
        return error;
    }

    public Throwable getCause() {
        return cause;
    }

    /**
     * Transform the success value, passing failures through unchanged.
     */
    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return new Result<>(null, error, cause);
        }
        return new Result<>(mapper.apply(value), null, null);
    }

    @Override
    public String toString() {
        return error == null ? "Result{ok=" + value + "}" : "Result{failure='" + error + "'}";
    }
}
