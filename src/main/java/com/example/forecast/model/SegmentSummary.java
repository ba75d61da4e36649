package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Per-segment line of the response.
 *
 * @param index          segment index
 * @param label          segment label
 * @param start          first input timestamp of the segment
 * @param end            last input timestamp of the segment
 * @param length         number of input points
 * @param succeeded      whether the segment produced a forecast
 * @param failure        failure reason when it did not
 * @param outliersFound  number of points corrected by outlier cleansing
 * @param outliersCleansed whether the forecast used cleansed data
 * @param model          forecast model used
 * @param classification demand profile assigned by segmentation
 * @param rmse           in-sample one-step RMSE of the forecast, in input units
 * @param mape           in-sample one-step MAPE of the forecast, in percent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SegmentSummary(
        int index,
        String label,
        Instant start,
        Instant end,
        int length,
        boolean succeeded,
        FailureKind failure,
        int outliersFound,
        boolean outliersCleansed,
        String model,
        SegmentClassification classification,
        Double rmse,
        Double mape
) {}
