package com.example.forecast.stage;

import java.util.Optional;

/**
 * Local validation of a stage output against its input, run before a success is trusted.
 */
@FunctionalInterface
public interface ContractCheck<I, C, O> {

    /** @return a description of the first violation, or empty when the output honors the contract */
    Optional<String> violation(I input, C config, O output);

    static <I, C, O> ContractCheck<I, C, O> none() {
        return (input, config, output) -> Optional.empty();
    }
}
