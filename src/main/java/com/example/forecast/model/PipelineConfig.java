package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-request configuration, one optional sub-object per stage plus the plan.
 * A missing sub-object means "stage defaults", never "skip the stage".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PipelineConfig(
        @JsonProperty("preprocessing") PreprocessingConfig preprocessing,
        @JsonProperty("segmentation") SegmentationConfig segmentation,
        @JsonProperty("outlier") OutlierConfig outlier,
        @JsonProperty("forecast") ForecastConfig forecast,
        @JsonProperty("plan") PlanConfig plan
) {
    public PipelineConfig {
        if (preprocessing == null) preprocessing = PreprocessingConfig.defaults();
        if (segmentation == null) segmentation = SegmentationConfig.defaults();
        if (outlier == null) outlier = OutlierConfig.defaults();
        if (forecast == null) forecast = ForecastConfig.defaults();
        if (plan == null) plan = PlanConfig.defaults();
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(null, null, null, null, null);
    }
}
