package com.example.forecast.orchestrator;

import com.example.forecast.config.ForecastProperties;
import com.example.forecast.model.DiagnosticEntry;
import com.example.forecast.model.ForecastTask;
import com.example.forecast.model.ForecastWindow;
import com.example.forecast.model.PipelineConfig;
import com.example.forecast.model.PipelineResponse;
import com.example.forecast.model.PipelineTimings;
import com.example.forecast.model.RunFailure;
import com.example.forecast.model.Segment;
import com.example.forecast.model.StageKind;
import com.example.forecast.model.StageResult;
import com.example.forecast.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Forecast pipeline orchestrator.
 * Pipeline:
 * 1. Preprocessing of the whole series (fatal on failure)
 * 2. Segmentation (falls back to one whole-series segment on failure)
 * 3. Per-segment outlier cleansing and forecast generation, segments in parallel
 * 4. Ordered merge of the segment forecasts
 * <p>
 * Expected failures are reported through the response status, never thrown.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final String REQUEST_ID = "requestId";

    private final StageClients clients;
    private final SegmentFanOutCoordinator coordinator;
    private final ResultAggregator aggregator;
    private final ForecastProperties.Pipeline limits;

    public PipelineOrchestrator(StageClients clients,
                                SegmentFanOutCoordinator coordinator,
                                ResultAggregator aggregator,
                                ForecastProperties properties) {
        this.clients = clients;
        this.coordinator = coordinator;
        this.aggregator = aggregator;
        this.limits = properties.pipeline();
    }

    public PipelineResponse run(TimeSeries rawSeries, PipelineConfig config) {
        return run(rawSeries, config, UUID.randomUUID().toString());
    }

    public PipelineResponse run(TimeSeries rawSeries, PipelineConfig config, String requestId) {
        String previousId = MDC.get(REQUEST_ID);
        MDC.put(REQUEST_ID, requestId);
        try {
            return execute(rawSeries, config != null ? config : PipelineConfig.defaults(), requestId);
        } finally {
            if (previousId != null) {
                MDC.put(REQUEST_ID, previousId);
            } else {
                MDC.remove(REQUEST_ID);
            }
        }
    }

    private PipelineResponse execute(TimeSeries rawSeries, PipelineConfig config, String requestId) {
        if (rawSeries == null || rawSeries.isEmpty()) {
            log.warn("Rejected run {}: empty series", requestId);
            return PipelineResponse.failed(requestId, RunFailure.INVALID_INPUT, "series has no points",
                    rawSeries != null ? rawSeries.frequency() : null, List.of(), PipelineTimings.NONE);
        }
        PipelinePlan plan = PipelinePlan.build(requestId, config, limits, Instant.now());
        List<DiagnosticEntry> diagnostics = new ArrayList<>();

        log.info("═══════════════════════════════════════════════");
        log.info("Starting forecast pipeline for '{}' ({} points, {}, steps {})",
                rawSeries.name(), rawSeries.size(), rawSeries.frequency(), plan.steps());
        log.info("═══════════════════════════════════════════════");

        // ── Step 1: Preprocessing ──
        log.info("[1/4] Preprocessing {} points...", rawSeries.size());
        long t0 = System.nanoTime();
        StageResult<TimeSeries> preprocessing = clients.preprocessing()
                .call(rawSeries, config.preprocessing(), plan.stageTimeout(), plan.deadline());
        diagnostics.add(DiagnosticEntry.of(preprocessing, null));
        long preprocessingMillis = millisSince(t0);
        if (!(preprocessing instanceof StageResult.Success<TimeSeries> preprocessed)) {
            StageResult.Failure<TimeSeries> failure = (StageResult.Failure<TimeSeries>) preprocessing;
            log.warn("[1/4] Preprocessing failed ({}): {}", failure.kind(), failure.message());
            return PipelineResponse.failed(requestId, RunFailure.PREPROCESSING_FAILED,
                    "preprocessing failed: " + failure.message(), rawSeries.frequency(), diagnostics,
                    new PipelineTimings(preprocessingMillis, 0, 0, 0));
        }
        TimeSeries series = preprocessed.payload();
        log.info("[1/4] Preprocessing completed: {} points, {} missing", series.size(), series.missingCount());

        // ── Step 2: Segmentation ──
        log.info("[2/4] Segmenting ({})...", config.segmentation().method());
        long t1 = System.nanoTime();
        List<Segment> segments = segment(series, plan, diagnostics);
        long segmentationMillis = millisSince(t1);
        log.info("[2/4] Segmentation completed: {} segments", segments.size());

        // ── Step 3: Fan-out ──
        int horizon = config.forecast().horizon();
        List<ForecastTask> tasks = new ArrayList<>(segments.size());
        for (Segment segment : segments) {
            ForecastWindow window = new ForecastWindow(segment.index(), series.lastTimestamp(),
                    (long) segment.index() * horizon, horizon, series.frequency());
            tasks.add(new ForecastTask(segment, window));
        }
        log.info("[3/4] Forecasting {} segments (parallelism {}, horizon {})...",
                tasks.size(), Math.min(plan.parallelism(), tasks.size()), horizon);
        long t2 = System.nanoTime();
        List<SegmentOutcome> outcomes = coordinator.process(tasks, series.normalization(), clients, plan);
        long fanOutMillis = millisSince(t2);
        long failedSegments = outcomes.stream().filter(o -> !o.succeeded()).count();
        log.info("[3/4] Forecasting completed: {} succeeded, {} failed", outcomes.size() - failedSegments, failedSegments);

        // ── Step 4: Aggregation ──
        log.info("[4/4] Merging segment forecasts...");
        long t3 = System.nanoTime();
        PipelineResponse response = aggregator.merge(requestId, series.frequency(), outcomes, diagnostics);
        long aggregationMillis = millisSince(t3);
        PipelineTimings timings = new PipelineTimings(preprocessingMillis, segmentationMillis, fanOutMillis, aggregationMillis);
        log.info("[4/4] Merge completed: {} forecast points", response.forecastPointCount());

        log.info("═══════════════════════════════════════════════");
        log.info("Pipeline completed: {} ({}) in {}ms", response.status(), response.message(), timings.totalMillis());
        log.info("═══════════════════════════════════════════════");
        return response.withTimings(timings);
    }

    /**
     * Runs segmentation, or substitutes the single implicit segment when the plan skips it
     * or the stage fails. Only the failure case is recorded as degraded.
     */
    private List<Segment> segment(TimeSeries series, PipelinePlan plan, List<DiagnosticEntry> diagnostics) {
        if (!plan.runs(StageKind.SEGMENTATION)) {
            diagnostics.add(DiagnosticEntry.skipped(StageKind.SEGMENTATION, null, "skipped by plan"));
            return List.of(Segment.whole(series));
        }
        StageResult<List<Segment>> result = clients.segmentation()
                .call(series, plan.config().segmentation(), plan.stageTimeout(), plan.deadline());
        DiagnosticEntry entry = DiagnosticEntry.of(result, null);
        if (result instanceof StageResult.Success<List<Segment>> success) {
            diagnostics.add(entry);
            return success.payload();
        }
        StageResult.Failure<List<Segment>> failure = (StageResult.Failure<List<Segment>>) result;
        log.warn("[2/4] Segmentation failed ({}), continuing with a single whole-series segment", failure.kind());
        diagnostics.add(entry.degraded("continued with a single whole-series segment"));
        return List.of(Segment.whole(series));
    }

    private static long millisSince(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
