package com.example.forecast.model;

/**
 * Per-phase wall time of one pipeline run (in milliseconds).
 *
 * @param preprocessingMillis phase 1: preprocessing call
 * @param segmentationMillis  phase 2: segmentation call or fallback
 * @param fanOutMillis        phase 3: per-segment outlier cleansing and forecasting
 * @param aggregationMillis   phase 4: merge of segment results
 */
public record PipelineTimings(
        long preprocessingMillis,
        long segmentationMillis,
        long fanOutMillis,
        long aggregationMillis
) {
    public static final PipelineTimings NONE = new PipelineTimings(0, 0, 0, 0);

    public long totalMillis() {
        return preprocessingMillis + segmentationMillis + fanOutMillis + aggregationMillis;
    }
}
