package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum CorrectionType {
    /** Clip the value to the violated bound. */
    @JsonProperty("limit") LIMIT,
    /** Replace the value by linear interpolation between non-outlier neighbours. */
    @JsonProperty("interpolation") INTERPOLATION
}
