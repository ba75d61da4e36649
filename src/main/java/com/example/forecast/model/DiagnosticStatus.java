package com.example.forecast.model;

public enum DiagnosticStatus {
    SUCCESS,
    FAILED,
    /** Stage failed and the pipeline continued with a documented fallback. */
    DEGRADED,
    SKIPPED,
    /** Aggregation inserted a gap marker for a failed segment. */
    GAP
}
