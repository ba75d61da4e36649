package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ForecastModel {
    @JsonProperty("auto") AUTO,
    @JsonProperty("arima") ARIMA,
    @JsonProperty("naive") NAIVE,
    @JsonProperty("drift") DRIFT,
    @JsonProperty("ses") SES
}
