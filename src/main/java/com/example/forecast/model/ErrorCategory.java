package com.example.forecast.model;

/**
 * Error taxonomy shared by stages and the orchestrator.
 */
public enum ErrorCategory {
    /** Timeout or temporary unavailability; the only retried category. */
    TRANSIENT,
    /** Malformed series or configuration. */
    INVALID_INPUT,
    /** A stage returned data that breaks the stage contract. */
    CONTRACT_VIOLATION,
    /** Request-level or per-call budget exhausted. */
    DEADLINE_EXCEEDED,
    /** Stage unreachable after retries. */
    UNAVAILABLE,
    /** Unexpected fault inside a stage; never retried. */
    INTERNAL
}
