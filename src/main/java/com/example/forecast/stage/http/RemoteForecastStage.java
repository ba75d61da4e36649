package com.example.forecast.stage.http;

import com.example.forecast.model.ForecastConfig;
import com.example.forecast.model.ForecastOutput;
import com.example.forecast.model.ForecastTask;
import com.example.forecast.stage.ForecastGenerationStage;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.client.RestClient;

/**
 * Remote forecaster. Unlike the in-process one it may offer {@code arima}.
 */
public class RemoteForecastStage extends RemoteStage<ForecastTask, ForecastConfig, ForecastOutput>
        implements ForecastGenerationStage {

    public RemoteForecastStage(RestClient.Builder builder, String baseUrl) {
        super(builder, baseUrl, new ParameterizedTypeReference<>() {});
    }
}
