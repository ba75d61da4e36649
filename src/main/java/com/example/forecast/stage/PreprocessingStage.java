package com.example.forecast.stage;

import com.example.forecast.model.PreprocessingConfig;
import com.example.forecast.model.StageKind;
import com.example.forecast.model.TimeSeries;

public interface PreprocessingStage extends Stage<TimeSeries, PreprocessingConfig, TimeSeries> {

    @Override
    default StageKind kind() {
        return StageKind.PREPROCESSING;
    }
}
