package com.example.forecast.orchestrator;

import com.example.forecast.model.CleansedSegment;
import com.example.forecast.model.ForecastConfig;
import com.example.forecast.model.ForecastOutput;
import com.example.forecast.model.ForecastTask;
import com.example.forecast.model.OutlierConfig;
import com.example.forecast.model.PreprocessingConfig;
import com.example.forecast.model.Segment;
import com.example.forecast.model.SegmentationConfig;
import com.example.forecast.model.TimeSeries;
import com.example.forecast.stage.StageClient;

import java.util.List;
import java.util.Objects;

/**
 * The four stage clients of the fixed pipeline topology.
 */
public record StageClients(
        StageClient<TimeSeries, PreprocessingConfig, TimeSeries> preprocessing,
        StageClient<TimeSeries, SegmentationConfig, List<Segment>> segmentation,
        StageClient<Segment, OutlierConfig, CleansedSegment> outlierCleansing,
        StageClient<ForecastTask, ForecastConfig, ForecastOutput> forecastGeneration
) {
    public StageClients {
        Objects.requireNonNull(preprocessing, "preprocessing");
        Objects.requireNonNull(segmentation, "segmentation");
        Objects.requireNonNull(outlierCleansing, "outlierCleansing");
        Objects.requireNonNull(forecastGeneration, "forecastGeneration");
    }

    /** All clients in execution order. */
    public List<StageClient<?, ?, ?>> inOrder() {
        return List.of(preprocessing, segmentation, outlierCleansing, forecastGeneration);
    }
}
