package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum FillMethod {
    @JsonProperty("none") NONE,
    @JsonProperty("interpolate") INTERPOLATE,
    @JsonProperty("forward-fill") FORWARD_FILL
}
