package com.example.forecast.stage.http;

import com.example.forecast.model.PreprocessingConfig;
import com.example.forecast.model.TimeSeries;
import com.example.forecast.stage.PreprocessingStage;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.client.RestClient;

public class RemotePreprocessingStage extends RemoteStage<TimeSeries, PreprocessingConfig, TimeSeries>
        implements PreprocessingStage {

    public RemotePreprocessingStage(RestClient.Builder builder, String baseUrl) {
        super(builder, baseUrl, new ParameterizedTypeReference<>() {});
    }
}
