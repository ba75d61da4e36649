package com.example.forecast.stage;

import com.example.forecast.model.StageKind;

import java.time.Instant;

/**
 * Uniform invocation contract of a pipeline stage.
 * <p>
 * A stage makes no assumption about its caller, preserves the timestamp order of its
 * input and, when it cannot produce a complete output, throws instead of returning a
 * truncated one.
 *
 * @param <I> input shape
 * @param <C> stage configuration
 * @param <O> output shape
 */
public interface Stage<I, C, O> {

    StageKind kind();

    /**
     * @param input    series or segment to process
     * @param config   stage configuration, defaults already applied
     * @param deadline instant after which the caller no longer waits
     * @return the complete stage output
     * @throws StageException when the stage fails
     */
    O invoke(I input, C config, Instant deadline) throws StageException;

    /** Whether the stage is currently reachable. */
    default boolean isAvailable() {
        return true;
    }
}
