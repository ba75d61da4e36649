package com.example.forecast.orchestrator;

import com.example.forecast.model.CleansedSegment;
import com.example.forecast.model.DiagnosticEntry;
import com.example.forecast.model.FailureKind;
import com.example.forecast.model.ForecastOutput;
import com.example.forecast.model.ForecastTask;
import com.example.forecast.model.Normalization;
import com.example.forecast.model.OutlierConfig;
import com.example.forecast.model.Segment;
import com.example.forecast.model.StageKind;
import com.example.forecast.model.StageResult;
import com.example.forecast.stage.MdcTasks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Runs outlier cleansing then forecast generation for every segment, segments in parallel.
 * <p>
 * At most {@code plan.parallelism()} runners are submitted to the shared worker pool; each
 * runner pulls the next segment index from a cursor and writes the outcome into that
 * segment's slot of a pre-sized array, so results are keyed by index and never by
 * completion order. When the request deadline passes, runners are cancelled and every
 * slot still empty is marked {@code DEADLINE_EXCEEDED} with the diagnostics its segment
 * had already produced; finished slots are kept.
 */
@Component
public class SegmentFanOutCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SegmentFanOutCoordinator.class);

    private final ExecutorService segmentWorkers;

    public SegmentFanOutCoordinator(@Qualifier("segmentWorkers") ExecutorService segmentWorkers) {
        this.segmentWorkers = segmentWorkers;
    }

    /**
     * @param tasks         one task per segment, in index order
     * @param normalization normalization to undo on forecasts, {@code null} for raw data
     * @param clients       stage clients
     * @param plan          plan of the run
     * @return one outcome per task, in index order
     */
    public List<SegmentOutcome> process(List<ForecastTask> tasks, Normalization normalization,
                                        StageClients clients, PipelinePlan plan) {
        int n = tasks.size();
        if (n == 0) {
            return List.of();
        }
        AtomicReferenceArray<SegmentOutcome> slots = new AtomicReferenceArray<>(n);
        SegmentTrail[] trails = new SegmentTrail[n];
        for (int i = 0; i < n; i++) {
            trails[i] = new SegmentTrail(tasks.get(i).segment().index());
            if (!plan.runs(StageKind.OUTLIER_CLEANSING)) {
                trails[i].record(DiagnosticEntry.skipped(StageKind.OUTLIER_CLEANSING,
                        tasks.get(i).segment().index(), "skipped by plan"));
            }
        }
        AtomicInteger cursor = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(n);

        int runners = Math.min(plan.parallelism(), n);
        List<Future<?>> futures = new ArrayList<>(runners);
        for (int r = 0; r < runners; r++) {
            Runnable runner = () -> {
                int index;
                while ((index = cursor.getAndIncrement()) < n && !Thread.currentThread().isInterrupted()) {
                    SegmentOutcome outcome = processSegment(tasks.get(index), normalization, clients, plan, trails[index]);
                    slots.compareAndSet(index, null, outcome);
                    done.countDown();
                }
            };
            try {
                futures.add(segmentWorkers.submit(MdcTasks.runnable(runner)));
            } catch (RejectedExecutionException e) {
                log.warn("Segment worker pool rejected runner {}/{}: {}", r + 1, runners, e.getMessage());
            }
        }

        boolean completed = false;
        try {
            completed = !futures.isEmpty() && done.await(plan.remaining().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (!completed) {
            futures.forEach(f -> f.cancel(true));
            // claimed but unfinished segments and never-started segments alike
            List<StageKind> planned = plan.runs(StageKind.OUTLIER_CLEANSING)
                    ? List.of(StageKind.OUTLIER_CLEANSING, StageKind.FORECAST_GENERATION)
                    : List.of(StageKind.FORECAST_GENERATION);
            int cancelled = 0;
            for (int i = 0; i < n; i++) {
                if (slots.get(i) == null && slots.compareAndSet(i, null, SegmentOutcome.failed(tasks.get(i),
                        FailureKind.DEADLINE_EXCEEDED, "request deadline exceeded", trails[i].cutOff(planned)))) {
                    cancelled++;
                }
            }
            if (cancelled > 0) {
                log.warn("Request deadline reached: {}/{} segments marked {}", cancelled, n, FailureKind.DEADLINE_EXCEEDED);
            }
        }

        List<SegmentOutcome> outcomes = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            outcomes.add(slots.get(i));
        }
        return outcomes;
    }

    SegmentOutcome processSegment(ForecastTask task, Normalization normalization,
                                  StageClients clients, PipelinePlan plan, SegmentTrail trail) {
        Segment segment = task.segment();
        int index = segment.index();
        Segment forecastInput = segment;
        int outliersFound = 0;
        boolean cleansed = false;

        if (plan.runs(StageKind.OUTLIER_CLEANSING)) {
            OutlierConfig outlierConfig = plan.config().outlier();
            trail.begin(StageKind.OUTLIER_CLEANSING);
            StageResult<CleansedSegment> result = clients.outlierCleansing()
                    .call(segment, outlierConfig, plan.stageTimeout(), plan.deadline());
            DiagnosticEntry entry = DiagnosticEntry.of(result, index);
            if (result instanceof StageResult.Success<CleansedSegment> success) {
                trail.record(entry);
                forecastInput = success.payload().segment();
                outliersFound = success.payload().outlierIndices().size();
                cleansed = true;
            } else {
                StageResult.Failure<CleansedSegment> failure = (StageResult.Failure<CleansedSegment>) result;
                if (outlierConfig.mandatory() || failure.kind() == FailureKind.DEADLINE_EXCEEDED) {
                    trail.record(entry);
                    log.warn("Segment {}: outlier cleansing failed ({}), segment not forecast", index, failure.kind());
                    return SegmentOutcome.failed(task, failure.kind(),
                            "outlier cleansing failed: " + failure.message(), trail.entries());
                }
                log.warn("Segment {}: outlier cleansing failed ({}), forecasting uncleansed data", index, failure.kind());
                trail.record(entry.degraded("forecast used uncleansed data"));
            }
        }

        trail.begin(StageKind.FORECAST_GENERATION);
        StageResult<ForecastOutput> result = clients.forecastGeneration().call(
                new ForecastTask(forecastInput, task.window()), plan.config().forecast(),
                plan.stageTimeout(), plan.deadline());
        trail.record(DiagnosticEntry.of(result, index));
        if (result instanceof StageResult.Success<ForecastOutput> success) {
            return SegmentOutcome.succeeded(task, success.payload().denormalize(normalization),
                    trail.entries(), outliersFound, cleansed);
        }
        StageResult.Failure<ForecastOutput> failure = (StageResult.Failure<ForecastOutput>) result;
        log.warn("Segment {}: forecast generation failed ({}): {}", index, failure.kind(), failure.message());
        return SegmentOutcome.failed(task, failure.kind(), "forecast generation failed: " + failure.message(),
                trail.entries());
    }
}
