package com.example.forecast.orchestrator;

import com.example.forecast.model.DiagnosticEntry;
import com.example.forecast.model.FailureKind;
import com.example.forecast.model.ForecastOutput;
import com.example.forecast.model.ForecastTask;

import java.util.List;

/**
 * Result of one segment's outlier cleansing and forecast, stored in the segment's own slot.
 *
 * @param task             segment and forecast window
 * @param forecast         forecast in raw units, {@code null} when the segment failed
 * @param failure          failure reason, {@code null} when the segment succeeded
 * @param failureMessage   failure detail
 * @param diagnostics      entries for the segment's stage invocations
 * @param outliersFound    points corrected by outlier cleansing
 * @param outliersCleansed whether the forecast used cleansed data
 */
public record SegmentOutcome(
        ForecastTask task,
        ForecastOutput forecast,
        FailureKind failure,
        String failureMessage,
        List<DiagnosticEntry> diagnostics,
        int outliersFound,
        boolean outliersCleansed
) {
    public SegmentOutcome {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static SegmentOutcome succeeded(ForecastTask task, ForecastOutput forecast, List<DiagnosticEntry> diagnostics,
                                           int outliersFound, boolean outliersCleansed) {
        return new SegmentOutcome(task, forecast, null, null, diagnostics, outliersFound, outliersCleansed);
    }

    public static SegmentOutcome failed(ForecastTask task, FailureKind failure, String message,
                                        List<DiagnosticEntry> diagnostics) {
        return new SegmentOutcome(task, null, failure, message, diagnostics, 0, false);
    }

    public int index() {
        return task.segment().index();
    }

    public boolean succeeded() {
        return forecast != null;
    }
}
