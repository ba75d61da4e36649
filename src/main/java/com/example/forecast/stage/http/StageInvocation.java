package com.example.forecast.stage.http;

import java.time.Instant;

/**
 * Request body posted to a remote stage's {@code /v1/invoke} endpoint.
 *
 * @param input    series, segment or forecast task
 * @param config   stage configuration with defaults applied
 * @param deadline instant after which the gateway stops waiting
 */
public record StageInvocation<I, C>(I input, C config, Instant deadline) {
}
