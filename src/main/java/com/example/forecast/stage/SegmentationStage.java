package com.example.forecast.stage;

import com.example.forecast.model.Segment;
import com.example.forecast.model.SegmentationConfig;
import com.example.forecast.model.StageKind;
import com.example.forecast.model.TimeSeries;

import java.util.List;

public interface SegmentationStage extends Stage<TimeSeries, SegmentationConfig, List<Segment>> {

    @Override
    default StageKind kind() {
        return StageKind.SEGMENTATION;
    }
}
