package com.example.forecast.stage;

import com.example.forecast.model.ForecastConfig;
import com.example.forecast.model.ForecastOutput;
import com.example.forecast.model.ForecastTask;
import com.example.forecast.model.StageKind;

public interface ForecastGenerationStage extends Stage<ForecastTask, ForecastConfig, ForecastOutput> {

    @Override
    default StageKind kind() {
        return StageKind.FORECAST_GENERATION;
    }
}
