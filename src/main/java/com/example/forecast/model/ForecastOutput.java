package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Forecast produced for one segment.
 *
 * @param segmentIndex    segment the forecast belongs to
 * @param model           model that produced the values
 * @param confidenceLevel confidence level the bounds were computed for
 * @param points          one point per slot of the segment's window
 * @param rmse            in-sample one-step root mean squared error in input units, if reported
 * @param mape            in-sample one-step mean absolute percentage error, if reported
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ForecastOutput(
        int segmentIndex,
        String model,
        double confidenceLevel,
        List<ForecastPoint> points,
        Double rmse,
        Double mape
) {
    @JsonCreator
    public ForecastOutput {
        points = points == null ? List.of() : List.copyOf(points);
    }

    public ForecastOutput(int segmentIndex, String model, double confidenceLevel, List<ForecastPoint> points) {
        this(segmentIndex, model, confidenceLevel, points, null, null);
    }

    /** Maps the points back to input units; accuracy figures are already in input units. */
    public ForecastOutput denormalize(Normalization normalization) {
        if (normalization == null) {
            return this;
        }
        return new ForecastOutput(segmentIndex, model, confidenceLevel,
                points.stream().map(p -> p.denormalize(normalization)).toList(), rmse, mape);
    }
}
