package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cut-offs used to classify segments. Defaults: volume A up to 85%, B up to 95%,
 * variability 0.5, intermittency 0.5, trend 0.05, seasonality 0.1.
 *
 * @param volumeA       cumulative volume share (percent) up to which a segment is class A
 * @param volumeB       cumulative volume share (percent) up to which a segment is class B
 * @param variability   coefficient of variation below which a segment is class X
 * @param intermittency zero share above which a segment is intermittent
 * @param trend         absolute normalized slope from which a trend is reported
 * @param seasonality   seasonal autocorrelation above which a series is seasonal
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClassificationThresholds(
        @JsonProperty("volume_a") Double volumeA,
        @JsonProperty("volume_b") Double volumeB,
        @JsonProperty("variability") Double variability,
        @JsonProperty("intermittency") Double intermittency,
        @JsonProperty("trend") Double trend,
        @JsonProperty("seasonality") Double seasonality
) {
    public ClassificationThresholds {
        if (volumeA == null) volumeA = 85.0;
        if (volumeB == null) volumeB = 95.0;
        if (variability == null) variability = 0.5;
        if (intermittency == null) intermittency = 0.5;
        if (trend == null) trend = 0.05;
        if (seasonality == null) seasonality = 0.1;
        if (volumeA <= 0.0 || volumeB < volumeA || volumeB > 100.0) {
            throw new IllegalArgumentException(
                    "segmentation.thresholds need 0 < volume_a <= volume_b <= 100, got %s / %s".formatted(volumeA, volumeB));
        }
        if (variability < 0.0 || intermittency < 0.0 || intermittency > 1.0 || trend < 0.0) {
            throw new IllegalArgumentException("segmentation.thresholds must not be negative");
        }
    }

    public static ClassificationThresholds defaults() {
        return new ClassificationThresholds(null, null, null, null, null, null);
    }
}
