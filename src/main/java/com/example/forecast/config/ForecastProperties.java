package com.example.forecast.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the forecast pipeline gateway.
 */
@ConfigurationProperties(prefix = "forecast")
public record ForecastProperties(
        Pipeline pipeline,
        Retry retry,
        Stages stages,
        Cache cache
) {

    public ForecastProperties {
        if (pipeline == null) pipeline = new Pipeline(0, null, null, 0);
        if (retry == null) retry = new Retry(null, null, null, null);
        if (stages == null) stages = new Stages(null, null, null);
        if (cache == null) cache = new Cache(false, 0);
    }

    /**
     * Orchestration limits.
     *
     * @param workerPoolSize  threads available for segment tasks
     * @param requestDeadline default end-to-end budget of one request
     * @param stageTimeout    budget of a single stage attempt
     * @param maxParallelism  segments processed at once per request, 0 for the pool size
     */
    public record Pipeline(int workerPoolSize, Duration requestDeadline, Duration stageTimeout, int maxParallelism) {
        public Pipeline {
            if (workerPoolSize <= 0) workerPoolSize = 8;
            if (requestDeadline == null) requestDeadline = Duration.ofSeconds(30);
            if (stageTimeout == null) stageTimeout = Duration.ofSeconds(5);
            if (maxParallelism < 0) maxParallelism = 0;
        }

        public int effectiveParallelism() {
            return maxParallelism == 0 ? workerPoolSize : Math.min(maxParallelism, workerPoolSize);
        }
    }

    /**
     * Backoff for transient stage failures.
     */
    public record Retry(Integer maxRetries, Duration initialBackoff, Double multiplier, Duration maxBackoff) {
        public Retry {
            if (maxRetries == null) maxRetries = 2;
            if (initialBackoff == null) initialBackoff = Duration.ofMillis(100);
            if (multiplier == null) multiplier = 2.0;
            if (maxBackoff == null) maxBackoff = Duration.ofSeconds(2);
        }
    }

    public enum Transport { LOCAL, HTTP }

    /**
     * Where the stages run.
     *
     * @param transport      {@code local} for the in-process stages, {@code http} for stage services
     * @param connectTimeout connect timeout of the stage services
     * @param endpoints      base URL of each stage service (e.g. http://localhost:5101)
     */
    public record Stages(Transport transport, Duration connectTimeout, Endpoints endpoints) {
        public Stages {
            if (transport == null) transport = Transport.LOCAL;
            if (connectTimeout == null) connectTimeout = Duration.ofSeconds(2);
            if (endpoints == null) endpoints = new Endpoints(null, null, null, null);
        }
    }

    public record Endpoints(String preprocessing, String segmentation, String outlierCleansing,
                            String forecastGeneration) {}

    /**
     * In-memory cache of successful stage results.
     */
    public record Cache(boolean enabled, int maxEntries) {
        public Cache {
            if (maxEntries <= 0) maxEntries = 1000;
        }
    }
}
