package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Segmentation parameters. Defaults: method {@code none}, one segment, {@code accept} count policy,
 * classification over the last 12 periods with {@link ClassificationThresholds#defaults()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SegmentationConfig(
        @JsonProperty("method") SegmentationMethod method,
        @JsonProperty("segments") Integer segments,
        @JsonProperty("count_policy") SegmentCountPolicy countPolicy,
        @JsonProperty("history_periods") Integer historyPeriods,
        @JsonProperty("thresholds") ClassificationThresholds thresholds
) {
    public SegmentationConfig {
        if (method == null) method = SegmentationMethod.NONE;
        if (segments == null) segments = 1;
        if (countPolicy == null) countPolicy = SegmentCountPolicy.ACCEPT;
        if (historyPeriods == null) historyPeriods = 12;
        if (thresholds == null) thresholds = ClassificationThresholds.defaults();
        if (segments < 1) {
            throw new IllegalArgumentException("segmentation.segments must be >= 1, got " + segments);
        }
        if (historyPeriods < 1) {
            throw new IllegalArgumentException("segmentation.history_periods must be >= 1, got " + historyPeriods);
        }
    }

    public SegmentationConfig(SegmentationMethod method, Integer segments, SegmentCountPolicy countPolicy) {
        this(method, segments, countPolicy, null, null);
    }

    public static SegmentationConfig defaults() {
        return new SegmentationConfig(null, null, null);
    }

    /** Segment count the configuration asks for; {@code none} always means one. */
    public int expectedSegments() {
        return method == SegmentationMethod.NONE ? 1 : segments;
    }
}
