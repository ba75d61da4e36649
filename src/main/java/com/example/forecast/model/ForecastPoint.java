package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Forecast value with its confidence bounds.
 */
public record ForecastPoint(
        Instant timestamp,
        double forecast,
        double lower,
        double upper
) {
    @JsonIgnore
    public boolean isFinite() {
        return Double.isFinite(forecast) && Double.isFinite(lower) && Double.isFinite(upper);
    }

    @JsonIgnore
    public boolean boundsOrdered() {
        return lower <= forecast && forecast <= upper;
    }

    public ForecastPoint denormalize(Normalization normalization) {
        return new ForecastPoint(timestamp,
                normalization.denormalize(forecast),
                normalization.denormalize(lower),
                normalization.denormalize(upper));
    }
}
