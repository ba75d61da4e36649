package com.example.forecast.config;

import com.example.forecast.stage.ForecastGenerationStage;
import com.example.forecast.stage.OutlierCleansingStage;
import com.example.forecast.stage.PreprocessingStage;
import com.example.forecast.stage.SegmentationStage;
import com.example.forecast.stage.http.RemoteForecastStage;
import com.example.forecast.stage.http.RemoteOutlierCleansingStage;
import com.example.forecast.stage.http.RemotePreprocessingStage;
import com.example.forecast.stage.http.RemoteSegmentationStage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Remote stage services, used when {@code forecast.stages.transport} is {@code http}.
 * <p>
 * The read timeout equals the stage timeout; the stage client enforces the same bound,
 * so a hung service shows up as {@code TIMEOUT} either way.
 */
@Configuration
@ConditionalOnProperty(prefix = "forecast.stages", name = "transport", havingValue = "http")
public class HttpStagesConfiguration {

    private final ForecastProperties properties;
    private final RestClient.Builder restClientBuilder;

    public HttpStagesConfiguration(ForecastProperties properties, RestClient.Builder restClientBuilder) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.stages().connectTimeout());
        factory.setReadTimeout(properties.pipeline().stageTimeout());
        this.properties = properties;
        this.restClientBuilder = restClientBuilder.requestFactory(factory);
    }

    @Bean
    public PreprocessingStage preprocessingStage() {
        return new RemotePreprocessingStage(restClientBuilder.clone(), endpoints().preprocessing());
    }

    @Bean
    public SegmentationStage segmentationStage() {
        return new RemoteSegmentationStage(restClientBuilder.clone(), endpoints().segmentation());
    }

    @Bean
    public OutlierCleansingStage outlierCleansingStage() {
        return new RemoteOutlierCleansingStage(restClientBuilder.clone(), endpoints().outlierCleansing());
    }

    @Bean
    public ForecastGenerationStage forecastGenerationStage() {
        return new RemoteForecastStage(restClientBuilder.clone(), endpoints().forecastGeneration());
    }

    private ForecastProperties.Endpoints endpoints() {
        return properties.stages().endpoints();
    }
}
