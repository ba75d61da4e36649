package com.example.forecast.config;

import com.example.forecast.stage.ForecastGenerationStage;
import com.example.forecast.stage.OutlierCleansingStage;
import com.example.forecast.stage.PreprocessingStage;
import com.example.forecast.stage.SegmentationStage;
import com.example.forecast.stage.local.LocalForecastStage;
import com.example.forecast.stage.local.LocalOutlierCleansingStage;
import com.example.forecast.stage.local.LocalPreprocessingStage;
import com.example.forecast.stage.local.LocalSegmentationStage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * In-process stages, used when {@code forecast.stages.transport} is {@code local} (the default).
 */
@Configuration
@ConditionalOnProperty(prefix = "forecast.stages", name = "transport", havingValue = "local", matchIfMissing = true)
public class LocalStagesConfiguration {

    @Bean
    public PreprocessingStage preprocessingStage() {
        return new LocalPreprocessingStage();
    }

    @Bean
    public SegmentationStage segmentationStage() {
        return new LocalSegmentationStage();
    }

    @Bean
    public OutlierCleansingStage outlierCleansingStage() {
        return new LocalOutlierCleansingStage();
    }

    @Bean
    public ForecastGenerationStage forecastGenerationStage() {
        return new LocalForecastStage();
    }
}
