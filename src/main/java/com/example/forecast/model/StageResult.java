package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Outcome of exactly one stage invocation: either a {@link Success} or a {@link Failure}.
 * An absent result is never treated as success.
 *
 * @param <T> payload type produced by the stage
 */
public sealed interface StageResult<T> {

    String stageName();

    int attempts();

    long durationMs();

    @JsonIgnore
    default boolean isSuccess() {
        return this instanceof Success<T>;
    }

    /**
     * @param payload    validated stage output
     * @param stageName  stage that produced it
     * @param attempts   remote invocations made, 0 when served from cache
     * @param durationMs wall time including retries
     * @param cached     whether the payload came from the stage result cache
     */
    record Success<T>(T payload, String stageName, int attempts, long durationMs, boolean cached)
            implements StageResult<T> {
    }

    /**
     * @param kind       failure reason
     * @param message    detail for diagnostics
     * @param stageName  stage that failed
     * @param attempts   remote invocations made
     * @param durationMs wall time including retries
     */
    record Failure<T>(FailureKind kind, String message, String stageName, int attempts, long durationMs)
            implements StageResult<T> {
    }

    static <T> Success<T> success(T payload, String stageName, int attempts, long durationMs) {
        return new Success<>(payload, stageName, attempts, durationMs, false);
    }

    static <T> Failure<T> failure(FailureKind kind, String message, String stageName, int attempts, long durationMs) {
        return new Failure<>(kind, message, stageName, attempts, durationMs);
    }
}
