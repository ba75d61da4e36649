package com.example.forecast.orchestrator;

import com.example.forecast.model.DiagnosticEntry;
import com.example.forecast.model.DiagnosticStatus;
import com.example.forecast.model.FailureKind;
import com.example.forecast.model.FillMethod;
import com.example.forecast.model.ForecastConfig;
import com.example.forecast.model.ForecastModel;
import com.example.forecast.model.Frequency;
import com.example.forecast.model.OutlierConfig;
import com.example.forecast.model.PipelineConfig;
import com.example.forecast.model.PipelineResponse;
import com.example.forecast.model.PipelineStatus;
import com.example.forecast.model.PlanConfig;
import com.example.forecast.model.PreprocessingConfig;
import com.example.forecast.model.RunFailure;
import com.example.forecast.model.SegmentSummary;
import com.example.forecast.model.SegmentationConfig;
import com.example.forecast.model.SegmentationMethod;
import com.example.forecast.model.StageKind;
import com.example.forecast.model.TimeSeries;
import com.example.forecast.model.TimelineEntry;
import com.example.forecast.stage.ForecastGenerationStage;
import com.example.forecast.stage.OutlierCleansingStage;
import com.example.forecast.stage.StageException;
import com.example.forecast.stage.local.LocalForecastStage;
import com.example.forecast.stage.local.LocalOutlierCleansingStage;
import com.example.forecast.stage.local.LocalPreprocessingStage;
import com.example.forecast.stage.local.LocalSegmentationStage;
import com.example.forecast.support.TestPipelines;
import com.example.forecast.support.TestSeries;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PipelineOrchestratorTest {

    private final ExecutorService stageCalls = Executors.newCachedThreadPool();
    private final ExecutorService segmentWorkers = Executors.newFixedThreadPool(4);
    private final TimeSeries series = TestSeries.daily(40);

    @AfterEach
    void shutdown() {
        stageCalls.shutdownNow();
        segmentWorkers.shutdownNow();
    }

    private PipelineOrchestrator orchestrator(StageClients clients) {
        return new PipelineOrchestrator(clients, new SegmentFanOutCoordinator(segmentWorkers), new ResultAggregator(),
                TestPipelines.properties(4, Duration.ofSeconds(10), Duration.ofSeconds(2)));
    }

    private PipelineOrchestrator localOrchestrator(ForecastGenerationStage forecaster) {
        return orchestrator(TestPipelines.localClients(forecaster, stageCalls));
    }

    private static PipelineConfig segmented(int segments, int horizon) {
        return new PipelineConfig(null,
                new SegmentationConfig(SegmentationMethod.FIXED_COUNT, segments, null),
                null, new ForecastConfig(ForecastModel.AUTO, horizon, 0.9), null);
    }

    @Test
    void completeRunMergesSegmentsInTimeOrder() {
        PipelineResponse response = localOrchestrator(new LocalForecastStage()).run(series, segmented(4, 5));

        assertThat(response.status()).isEqualTo(PipelineStatus.COMPLETE);
        assertThat(response.failure()).isNull();
        assertThat(response.forecastPointCount()).isEqualTo(20);
        assertThat(response.segments()).extracting(SegmentSummary::index).containsExactly(0, 1, 2, 3);
        assertThat(response.mergedForecast()).extracting(TimelineEntry::segmentIndex)
                .isSorted()
                .containsOnly(0, 1, 2, 3);
        Instant expected = series.lastTimestamp();
        for (TimelineEntry entry : response.mergedForecast()) {
            expected = Frequency.DAILY.plus(expected, 1);
            assertThat(entry.timestamp()).isEqualTo(expected);
            assertThat(entry.lower()).isLessThanOrEqualTo(entry.forecast());
            assertThat(entry.forecast()).isLessThanOrEqualTo(entry.upper());
        }
        // preprocessing + segmentation + (outlier cleansing + forecast) per segment
        assertThat(response.diagnostics()).hasSize(2 + 2 * 4);
        assertThat(response.diagnostics()).extracting(DiagnosticEntry::status).containsOnly(DiagnosticStatus.SUCCESS);
        assertThat(response.timings()).isNotNull();
    }

    @Test
    void segmentSummariesReportProfileAndAccuracy() {
        PipelineResponse response = localOrchestrator(new LocalForecastStage()).run(series, segmented(2, 3));

        assertThat(response.segments()).allSatisfy(summary -> {
            assertThat(summary.classification()).isNotNull();
            assertThat(summary.rmse()).isNotNull().isGreaterThanOrEqualTo(0.0);
            assertThat(summary.mape()).isNotNull();
        });
        assertThat(response.segments()).extracting(s -> s.classification().length()).containsExactly(20, 20);
    }

    @Test
    void preprocessingFailureIsFatalAndReturnsNoForecast() {
        StageClients clients = TestPipelines.clients(
                (in, cfg, deadline) -> {
                    throw new StageException(FailureKind.INVALID_INPUT, "unsupported units");
                },
                new LocalSegmentationStage(), new LocalOutlierCleansingStage(), new LocalForecastStage(), stageCalls);

        PipelineResponse response = orchestrator(clients).run(series, PipelineConfig.defaults());

        assertThat(response.status()).isEqualTo(PipelineStatus.FAILED);
        assertThat(response.failure()).isEqualTo(RunFailure.PREPROCESSING_FAILED);
        assertThat(response.mergedForecast()).isEmpty();
        assertThat(response.segments()).isEmpty();
        assertThat(response.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.stage()).isEqualTo("preprocessing");
            assertThat(d.status()).isEqualTo(DiagnosticStatus.FAILED);
            assertThat(d.failureKind()).isEqualTo(FailureKind.INVALID_INPUT);
        });
    }

    @Test
    void segmentationFailureFallsBackToWholeSeries() {
        StageClients clients = TestPipelines.clients(new LocalPreprocessingStage(),
                (in, cfg, deadline) -> {
                    throw new StageException(FailureKind.UNAVAILABLE, "segmentation service down");
                },
                new LocalOutlierCleansingStage(), new LocalForecastStage(), stageCalls);

        PipelineResponse response = orchestrator(clients).run(series, segmented(4, 6));

        assertThat(response.status()).isEqualTo(PipelineStatus.COMPLETE);
        assertThat(response.segments()).singleElement().satisfies(s -> {
            assertThat(s.label()).isEqualTo("whole-series");
            assertThat(s.length()).isEqualTo(40);
        });
        assertThat(response.forecastPointCount()).isEqualTo(6);
        assertThat(response.diagnostics()).filteredOn(d -> d.stage().equals("segmentation")).singleElement()
                .satisfies(d -> {
                    assertThat(d.status()).isEqualTo(DiagnosticStatus.DEGRADED);
                    assertThat(d.failureKind()).isEqualTo(FailureKind.UNREACHABLE);
                    assertThat(d.attempts()).isEqualTo(3);
                });
    }

    @Test
    void oneFailedSegmentYieldsPartialSuccessWithGap() {
        ForecastGenerationStage failSecond = (task, config, deadline) -> {
            if (task.segment().index() == 1) {
                throw new StageException(FailureKind.INTERNAL, "model diverged");
            }
            return TestPipelines.flatForecast(50.0).invoke(task, config, deadline);
        };

        PipelineResponse response = localOrchestrator(failSecond).run(series, segmented(3, 4));

        assertThat(response.status()).isEqualTo(PipelineStatus.PARTIAL_SUCCESS);
        assertThat(response.forecastPointCount()).isEqualTo(8);
        List<TimelineEntry> timeline = response.mergedForecast();
        assertThat(timeline).hasSize(4 + 1 + 4);
        TimelineEntry gap = timeline.get(4);
        assertThat(gap.isGap()).isTrue();
        assertThat(gap.segmentIndex()).isEqualTo(1);
        assertThat(gap.forecast()).isNull();
        assertThat(gap.gapReason()).isEqualTo(FailureKind.INTERNAL);
        assertThat(gap.gapStart()).isEqualTo(Frequency.DAILY.plus(series.lastTimestamp(), 5));
        assertThat(gap.gapEnd()).isEqualTo(Frequency.DAILY.plus(series.lastTimestamp(), 8));
        assertThat(timeline.get(5).timestamp()).isEqualTo(Frequency.DAILY.plus(series.lastTimestamp(), 9));
        assertThat(response.segments()).extracting(SegmentSummary::succeeded).containsExactly(true, false, true);
        assertThat(response.diagnostics()).anySatisfy(d -> {
            assertThat(d.stage()).isEqualTo("aggregation");
            assertThat(d.status()).isEqualTo(DiagnosticStatus.GAP);
            assertThat(d.segmentIndex()).isEqualTo(1);
        });
    }

    @Test
    void allSegmentsFailingIsForecastingFailed() {
        ForecastGenerationStage alwaysFails = (task, config, deadline) -> {
            throw new StageException(FailureKind.INVALID_INPUT, "horizon too long");
        };

        PipelineResponse response = localOrchestrator(alwaysFails).run(series, segmented(2, 3));

        assertThat(response.status()).isEqualTo(PipelineStatus.FAILED);
        assertThat(response.failure()).isEqualTo(RunFailure.FORECASTING_FAILED);
        assertThat(response.forecastPointCount()).isZero();
        assertThat(response.mergedForecast()).allMatch(TimelineEntry::isGap).hasSize(2);
    }

    @Test
    void slowSegmentHitsDeadlineWhileOthersKeepResults() {
        ForecastGenerationStage slowThird = (task, config, deadline) -> {
            if (task.segment().index() == 2) {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new StageException(FailureKind.DEADLINE_EXCEEDED, "interrupted");
                }
            }
            return TestPipelines.flatForecast(1.0).invoke(task, config, deadline);
        };
        PipelineConfig config = new PipelineConfig(null,
                new SegmentationConfig(SegmentationMethod.FIXED_COUNT, 3, null), null,
                new ForecastConfig(ForecastModel.AUTO, 2, 0.95), new PlanConfig(null, 400L, null));

        long started = System.nanoTime();
        PipelineResponse response = localOrchestrator(slowThird).run(series, config);
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertThat(elapsedMs).isLessThan(3_000);
        assertThat(response.status()).isEqualTo(PipelineStatus.PARTIAL_SUCCESS);
        assertThat(response.segments()).extracting(SegmentSummary::failure)
                .containsExactly(null, null, FailureKind.DEADLINE_EXCEEDED);
        assertThat(response.forecastPointCount()).isEqualTo(4);
    }

    @Test
    void segmentCutOffByDeadlineKeepsItsEarlierDiagnostics() {
        PipelineConfig config = new PipelineConfig(null,
                new SegmentationConfig(SegmentationMethod.FIXED_COUNT, 3, null), null,
                new ForecastConfig(ForecastModel.AUTO, 2, 0.95), new PlanConfig(null, 400L, null));

        PipelineResponse response = localOrchestrator(sleepingOn(2)).run(series, config);

        List<DiagnosticEntry> third = stageEntries(response, 2);
        assertThat(third).filteredOn(d -> d.stage().equals("outlier_cleansing")).singleElement()
                .satisfies(d -> assertThat(d.status()).isEqualTo(DiagnosticStatus.SUCCESS));
        assertThat(third).filteredOn(d -> d.stage().equals("forecast_generation")).singleElement()
                .satisfies(d -> {
                    assertThat(d.status()).isEqualTo(DiagnosticStatus.FAILED);
                    assertThat(d.failureKind()).isEqualTo(FailureKind.DEADLINE_EXCEEDED);
                });
        assertThat(stageEntries(response, 0)).extracting(DiagnosticEntry::status)
                .containsExactly(DiagnosticStatus.SUCCESS, DiagnosticStatus.SUCCESS);
    }

    @Test
    void segmentsNeverStartedBeforeDeadlineAreNotReportedAsForecastCalls() {
        PipelineConfig config = new PipelineConfig(null,
                new SegmentationConfig(SegmentationMethod.FIXED_COUNT, 3, null), null,
                new ForecastConfig(ForecastModel.AUTO, 2, 0.95), new PlanConfig(null, 300L, 1));

        PipelineResponse response = localOrchestrator(sleepingOn(0)).run(series, config);

        assertThat(response.segments()).extracting(SegmentSummary::failure)
                .containsOnly(FailureKind.DEADLINE_EXCEEDED);
        for (int index = 1; index <= 2; index++) {
            List<DiagnosticEntry> entries = stageEntries(response, index);
            assertThat(entries).filteredOn(d -> d.stage().equals("outlier_cleansing")).hasSize(1);
            assertThat(entries).allSatisfy(d -> {
                assertThat(d.status()).isNotEqualTo(DiagnosticStatus.SUCCESS);
                assertThat(d.failureKind()).isEqualTo(FailureKind.DEADLINE_EXCEEDED);
            });
            assertThat(entries).noneMatch(d -> d.stage().equals("forecast_generation")
                    && d.status() == DiagnosticStatus.FAILED);
        }
    }

    /** Forecaster that hangs on one segment and answers the others at once. */
    private static ForecastGenerationStage sleepingOn(int slowIndex) {
        return (task, config, deadline) -> {
            if (task.segment().index() == slowIndex) {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new StageException(FailureKind.DEADLINE_EXCEEDED, "interrupted");
                }
            }
            return TestPipelines.flatForecast(1.0).invoke(task, config, deadline);
        };
    }

    private static List<DiagnosticEntry> stageEntries(PipelineResponse response, int segmentIndex) {
        return response.diagnostics().stream()
                .filter(d -> d.segmentIndex() != null && d.segmentIndex() == segmentIndex)
                .filter(d -> !d.stage().equals("aggregation"))
                .toList();
    }

    @Test
    void outlierFailureDegradesToUncleansedData() {
        OutlierCleansingStage broken = (segment, config, deadline) -> {
            throw new StageException(FailureKind.INTERNAL, "detector crashed");
        };
        StageClients clients = TestPipelines.clients(new LocalPreprocessingStage(), new LocalSegmentationStage(),
                broken, new LocalForecastStage(), stageCalls);

        PipelineResponse response = orchestrator(clients).run(series, segmented(2, 3));

        assertThat(response.status()).isEqualTo(PipelineStatus.COMPLETE);
        assertThat(response.segments()).allSatisfy(s -> assertThat(s.outliersCleansed()).isFalse());
        assertThat(response.diagnostics()).filteredOn(d -> d.stage().equals("outlier_cleansing"))
                .hasSize(2)
                .allSatisfy(d -> assertThat(d.status()).isEqualTo(DiagnosticStatus.DEGRADED));
    }

    @Test
    void mandatoryOutlierFailureFailsTheSegmentWithoutForecasting() {
        AtomicInteger forecasts = new AtomicInteger();
        OutlierCleansingStage failFirst = (segment, config, deadline) -> {
            if (segment.index() == 0) {
                throw new StageException(FailureKind.INTERNAL_VALIDATION, "too few points");
            }
            return new LocalOutlierCleansingStage().invoke(segment, config, deadline);
        };
        ForecastGenerationStage counting = (task, config, deadline) -> {
            forecasts.incrementAndGet();
            return TestPipelines.flatForecast(3.0).invoke(task, config, deadline);
        };
        StageClients clients = TestPipelines.clients(new LocalPreprocessingStage(), new LocalSegmentationStage(),
                failFirst, counting, stageCalls);
        PipelineConfig config = new PipelineConfig(null,
                new SegmentationConfig(SegmentationMethod.FIXED_COUNT, 2, null),
                new OutlierConfig(null, null, null, null, null, true),
                new ForecastConfig(null, 3, null), null);

        PipelineResponse response = orchestrator(clients).run(series, config);

        assertThat(response.status()).isEqualTo(PipelineStatus.PARTIAL_SUCCESS);
        assertThat(response.segments().get(0).failure()).isEqualTo(FailureKind.INTERNAL_VALIDATION);
        assertThat(forecasts).hasValue(1);
    }

    @Test
    void planSkipsAreRecordedAsSkipped() {
        AtomicInteger outlierCalls = new AtomicInteger();
        OutlierCleansingStage counting = (segment, config, deadline) -> {
            outlierCalls.incrementAndGet();
            return new LocalOutlierCleansingStage().invoke(segment, config, deadline);
        };
        StageClients clients = TestPipelines.clients(new LocalPreprocessingStage(), new LocalSegmentationStage(),
                counting, new LocalForecastStage(), stageCalls);
        PipelineConfig config = new PipelineConfig(null,
                new SegmentationConfig(SegmentationMethod.FIXED_COUNT, 4, null), null, null,
                new PlanConfig(Set.of(StageKind.SEGMENTATION, StageKind.OUTLIER_CLEANSING), null, null));

        PipelineResponse response = orchestrator(clients).run(series, config);

        assertThat(response.status()).isEqualTo(PipelineStatus.COMPLETE);
        assertThat(response.segments()).hasSize(1);
        assertThat(response.forecastPointCount()).isEqualTo(12);
        assertThat(outlierCalls).hasValue(0);
        assertThat(response.diagnostics()).filteredOn(d -> d.status() == DiagnosticStatus.SKIPPED)
                .extracting(DiagnosticEntry::stage)
                .containsExactly("segmentation", "outlier_cleansing");
    }

    @Test
    void normalizedForecastsAreMappedBackToRawUnits() {
        PipelineConfig config = new PipelineConfig(new PreprocessingConfig(false, FillMethod.NONE, true),
                null, null, new ForecastConfig(ForecastModel.NAIVE, 3, 0.95),
                new PlanConfig(Set.of(StageKind.OUTLIER_CLEANSING), null, null));

        PipelineResponse response = localOrchestrator(new LocalForecastStage()).run(series, config);

        double lastRaw = series.values()[series.size() - 1];
        assertThat(response.mergedForecast()).allSatisfy(e -> assertThat(e.forecast()).isCloseTo(lastRaw, within(1e-9)));
    }

    @Test
    void transientForecastFailureIsRetriedTransparently() {
        AtomicInteger attempts = new AtomicInteger();
        ForecastGenerationStage flaky = (task, config, deadline) -> {
            if (attempts.incrementAndGet() == 1) {
                throw new StageException(FailureKind.TIMEOUT, "cold start");
            }
            return TestPipelines.flatForecast(2.0).invoke(task, config, deadline);
        };

        PipelineResponse response = localOrchestrator(flaky).run(series, PipelineConfig.defaults());

        assertThat(response.status()).isEqualTo(PipelineStatus.COMPLETE);
        assertThat(response.diagnostics()).filteredOn(d -> d.stage().equals("forecast_generation"))
                .singleElement()
                .satisfies(d -> assertThat(d.attempts()).isEqualTo(2));
    }

    @Test
    void emptySeriesIsRejectedAsInvalidInput() {
        TimeSeries empty = new TimeSeries("empty", Frequency.DAILY, List.of());

        PipelineResponse response = localOrchestrator(new LocalForecastStage()).run(empty, null);

        assertThat(response.status()).isEqualTo(PipelineStatus.FAILED);
        assertThat(response.failure()).isEqualTo(RunFailure.INVALID_INPUT);
    }

    @Test
    void requestIdReachesStagesOnWorkerThreads() {
        Set<String> seen = ConcurrentHashMap.newKeySet();
        ForecastGenerationStage recording = (task, config, deadline) -> {
            seen.add(String.valueOf(MDC.get("requestId")));
            return TestPipelines.flatForecast(1.0).invoke(task, config, deadline);
        };

        PipelineResponse response = localOrchestrator(recording).run(series, segmented(3, 2), "req-42");

        assertThat(response.requestId()).isEqualTo("req-42");
        assertThat(seen).containsExactly("req-42");
        assertThat(MDC.get("requestId")).isNull();
    }
}
