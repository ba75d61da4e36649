package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Demand profile of one segment, assigned by segmentation and used to pick the outlier method.
 *
 * @param volumeClass            ABC class by share of the series' recent volume
 * @param volumeShare            cumulative volume share in percent, this segment included
 * @param variability            XY class by coefficient of variation
 * @param coefficientOfVariation {@code std / |mean|} over recent values, {@code null} when the mean is 0
 * @param intermittent           whether zeros dominate the segment
 * @param density                share of non-zero observed values
 * @param length                 observed values in the segment
 * @param lifecycle              position in the product life cycle
 * @param trend                  direction of the normalized linear slope
 * @param seasonal               whether the series repeats with its frequency's season
 * @param rule                   first matching rule, 1 (intermittent) to 8 (no rule)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SegmentClassification(
        VolumeClass volumeClass,
        double volumeShare,
        VariabilityClass variability,
        Double coefficientOfVariation,
        boolean intermittent,
        double density,
        int length,
        Lifecycle lifecycle,
        Trend trend,
        boolean seasonal,
        int rule
) {

    public enum VolumeClass { A, B, C }

    public enum VariabilityClass { X, Y }

    public enum Lifecycle {
        @JsonProperty("new-launch") NEW_LAUNCH,
        @JsonProperty("discontinued") DISCONTINUED,
        @JsonProperty("mature") MATURE
    }

    public enum Trend {
        @JsonProperty("none") NONE,
        @JsonProperty("upward") UPWARD,
        @JsonProperty("downward") DOWNWARD
    }

    public boolean trending() {
        return trend != Trend.NONE;
    }
}
