package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Forecast parameters. Defaults: model {@code auto}, horizon 12, 95% confidence.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ForecastConfig(
        @JsonProperty("model") ForecastModel model,
        @JsonProperty("horizon") Integer horizon,
        @JsonProperty("confidence_interval") Double confidenceInterval
) {
    /** Largest horizon a request may ask for; every segment's window holds this many slots. */
    public static final int MAX_HORIZON = 10_000;

    public ForecastConfig {
        if (model == null) model = ForecastModel.AUTO;
        if (horizon == null) horizon = 12;
        if (confidenceInterval == null) confidenceInterval = 0.95;
        if (horizon <= 0 || horizon > MAX_HORIZON) {
            throw new IllegalArgumentException(
                    "forecast.horizon must be in [1, " + MAX_HORIZON + "], got " + horizon);
        }
        if (!(confidenceInterval > 0.0 && confidenceInterval < 1.0)) {
            throw new IllegalArgumentException(
                    "forecast.confidence_interval must be in (0, 1), got " + confidenceInterval);
        }
    }

    public static ForecastConfig defaults() {
        return new ForecastConfig(null, null, null);
    }
}
