package com.example.forecast.model;

/**
 * Concrete reason attached to a failed stage invocation.
 */
public enum FailureKind {
    TIMEOUT(ErrorCategory.TRANSIENT),
    UNAVAILABLE(ErrorCategory.TRANSIENT),
    UNREACHABLE(ErrorCategory.UNAVAILABLE),
    INVALID_INPUT(ErrorCategory.INVALID_INPUT),
    INTERNAL_VALIDATION(ErrorCategory.INVALID_INPUT),
    INTERNAL(ErrorCategory.INTERNAL),
    INVALID_RESPONSE(ErrorCategory.CONTRACT_VIOLATION),
    DEADLINE_EXCEEDED(ErrorCategory.DEADLINE_EXCEEDED);

    private final ErrorCategory category;

    FailureKind(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }

    public boolean isTransient() {
        return category == ErrorCategory.TRANSIENT;
    }
}
