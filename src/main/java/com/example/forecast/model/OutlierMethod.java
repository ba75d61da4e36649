package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum OutlierMethod {
    @JsonProperty("auto") AUTO,
    @JsonProperty("fixed-sigma") FIXED_SIGMA,
    @JsonProperty("rolling-sigma") ROLLING_SIGMA,
    @JsonProperty("seasonal-iqr") SEASONAL_IQR
}
