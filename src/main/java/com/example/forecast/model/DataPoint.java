package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Objects;

/**
 * One observation of a time series.
 *
 * @param timestamp observation time
 * @param value     observed value, {@code null} when missing
 * @param quality   quality marker; defaults to {@code MISSING} for null values and {@code OK} otherwise
 */
public record DataPoint(
        Instant timestamp,
        Double value,
        QualityFlag quality
) {
    public DataPoint {
        Objects.requireNonNull(timestamp, "timestamp");
        if (quality == null) {
            quality = value == null ? QualityFlag.MISSING : QualityFlag.OK;
        }
    }

    public DataPoint(Instant timestamp, Double value) {
        this(timestamp, value, null);
    }

    @JsonIgnore
    public boolean isMissing() {
        return value == null || value.isNaN();
    }

    public DataPoint withValue(Double newValue, QualityFlag newQuality) {
        return new DataPoint(timestamp, newValue, newQuality);
    }
}
