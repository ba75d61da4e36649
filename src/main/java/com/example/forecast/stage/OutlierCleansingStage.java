package com.example.forecast.stage;

import com.example.forecast.model.CleansedSegment;
import com.example.forecast.model.OutlierConfig;
import com.example.forecast.model.Segment;
import com.example.forecast.model.StageKind;

public interface OutlierCleansingStage extends Stage<Segment, OutlierConfig, CleansedSegment> {

    @Override
    default StageKind kind() {
        return StageKind.OUTLIER_CLEANSING;
    }
}
