package com.example.forecast.stage;

import com.example.forecast.model.FailureKind;

/**
 * Raised by a stage implementation to report a classified failure.
 */
public class StageException extends Exception {

    private final FailureKind kind;

    public StageException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StageException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }
}
