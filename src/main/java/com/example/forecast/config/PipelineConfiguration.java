package com.example.forecast.config;

import com.example.forecast.model.CleansedSegment;
import com.example.forecast.model.ForecastConfig;
import com.example.forecast.model.ForecastOutput;
import com.example.forecast.model.ForecastTask;
import com.example.forecast.model.OutlierConfig;
import com.example.forecast.model.PreprocessingConfig;
import com.example.forecast.model.Segment;
import com.example.forecast.model.SegmentationConfig;
import com.example.forecast.model.TimeSeries;
import com.example.forecast.orchestrator.StageClients;
import com.example.forecast.stage.ForecastGenerationStage;
import com.example.forecast.stage.InMemoryStageResultCache;
import com.example.forecast.stage.OutlierCleansingStage;
import com.example.forecast.stage.PreprocessingStage;
import com.example.forecast.stage.RetryPolicy;
import com.example.forecast.stage.SegmentationStage;
import com.example.forecast.stage.StageClient;
import com.example.forecast.stage.StageContracts;
import com.example.forecast.stage.StageFingerprints;
import com.example.forecast.stage.StageResultCache;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Pipeline wiring: worker pools, retry policy, result cache and the four stage clients.
 * <p>
 * - segmentWorkers: fixed pool shared by all requests for per-segment tasks
 * - stageCalls: runs individual stage attempts so they can be abandoned on timeout
 */
@Configuration
public class PipelineConfiguration {

    /**
     * Fixed pool for segment tasks, sized by {@code forecast.pipeline.worker-pool-size}.
     */
    @Bean(name = "segmentWorkers", destroyMethod = "shutdownNow")
    public ExecutorService segmentWorkers(ForecastProperties properties) {
        return Executors.newFixedThreadPool(properties.pipeline().workerPoolSize(),
                new CustomizableThreadFactory("segment-worker-"));
    }

    /**
     * Executor for single stage attempts. Unbounded because every attempt is already
     * bounded by its timeout and by the segment pool.
     */
    @Bean(name = "stageCalls", destroyMethod = "shutdownNow")
    public ExecutorService stageCalls() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("stage-call-"));
    }

    /**
     * ObjectMapper shared by the REST edge, the HTTP stages and the cache fingerprints.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public RetryPolicy retryPolicy(ForecastProperties properties) {
        ForecastProperties.Retry retry = properties.retry();
        return new RetryPolicy(retry.maxRetries(), retry.initialBackoff(), retry.multiplier(), retry.maxBackoff());
    }

    @Bean
    public StageFingerprints stageFingerprints(ObjectMapper objectMapper) {
        return new StageFingerprints(objectMapper);
    }

    @Bean
    public StageClients stageClients(PreprocessingStage preprocessing,
                                     SegmentationStage segmentation,
                                     OutlierCleansingStage outlierCleansing,
                                     ForecastGenerationStage forecastGeneration,
                                     RetryPolicy retryPolicy,
                                     @Qualifier("stageCalls") ExecutorService stageCalls,
                                     ForecastProperties properties,
                                     StageFingerprints fingerprints) {
        ForecastProperties.Cache cache = properties.cache();
        StageClient<TimeSeries, PreprocessingConfig, TimeSeries> preprocessingClient = new StageClient<>(
                preprocessing, StageContracts.preprocessing(), retryPolicy, stageCalls, resultCache(cache), fingerprints);
        StageClient<TimeSeries, SegmentationConfig, List<Segment>> segmentationClient = new StageClient<>(
                segmentation, StageContracts.segmentation(), retryPolicy, stageCalls, resultCache(cache), fingerprints);
        StageClient<Segment, OutlierConfig, CleansedSegment> outlierClient = new StageClient<>(
                outlierCleansing, StageContracts.outlierCleansing(), retryPolicy, stageCalls, resultCache(cache), fingerprints);
        StageClient<ForecastTask, ForecastConfig, ForecastOutput> forecastClient = new StageClient<>(
                forecastGeneration, StageContracts.forecastGeneration(), retryPolicy, stageCalls, resultCache(cache), fingerprints);
        return new StageClients(preprocessingClient, segmentationClient, outlierClient, forecastClient);
    }

    /** Each stage client gets its own cache of {@code forecast.cache.max-entries} results. */
    private static <O> StageResultCache<O> resultCache(ForecastProperties.Cache cache) {
        return cache.enabled() ? new InMemoryStageResultCache<>(cache.maxEntries()) : StageResultCache.disabled();
    }
}
