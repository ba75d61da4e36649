package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Preprocessing parameters. Absent fields take the documented defaults:
 * no outlier removal, linear interpolation of missing values, no normalization.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PreprocessingConfig(
        @JsonProperty("remove_outliers") Boolean removeOutliers,
        @JsonProperty("fill_missing") FillMethod fillMissing,
        @JsonProperty("normalize") Boolean normalize
) {
    public PreprocessingConfig {
        if (removeOutliers == null) removeOutliers = false;
        if (fillMissing == null) fillMissing = FillMethod.INTERPOLATE;
        if (normalize == null) normalize = false;
    }

    public static PreprocessingConfig defaults() {
        return new PreprocessingConfig(null, null, null);
    }
}
