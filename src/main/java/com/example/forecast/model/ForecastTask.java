package com.example.forecast.model;

/**
 * Input of the forecast generation stage: the segment history and the window to fill.
 */
public record ForecastTask(
        Segment segment,
        ForecastWindow window
) {}
