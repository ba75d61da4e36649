package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum SegmentationMethod {
    @JsonProperty("none") NONE,
    @JsonProperty("fixed-count") FIXED_COUNT,
    @JsonProperty("seasonal") SEASONAL
}
