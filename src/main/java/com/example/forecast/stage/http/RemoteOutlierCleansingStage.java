package com.example.forecast.stage.http;

import com.example.forecast.model.CleansedSegment;
import com.example.forecast.model.OutlierConfig;
import com.example.forecast.model.Segment;
import com.example.forecast.stage.OutlierCleansingStage;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.client.RestClient;

public class RemoteOutlierCleansingStage extends RemoteStage<Segment, OutlierConfig, CleansedSegment>
        implements OutlierCleansingStage {

    public RemoteOutlierCleansingStage(RestClient.Builder builder, String baseUrl) {
        super(builder, baseUrl, new ParameterizedTypeReference<>() {});
    }
}
