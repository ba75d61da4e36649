package com.example.forecast.stage.http;

import com.example.forecast.model.Segment;
import com.example.forecast.model.SegmentationConfig;
import com.example.forecast.model.TimeSeries;
import com.example.forecast.stage.SegmentationStage;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.client.RestClient;

import java.util.List;

public class RemoteSegmentationStage extends RemoteStage<TimeSeries, SegmentationConfig, List<Segment>>
        implements SegmentationStage {

    public RemoteSegmentationStage(RestClient.Builder builder, String baseUrl) {
        super(builder, baseUrl, new ParameterizedTypeReference<>() {});
    }
}
