package com.example.forecast.orchestrator;

import com.example.forecast.model.DiagnosticEntry;
import com.example.forecast.model.DiagnosticStatus;
import com.example.forecast.model.ForecastPoint;
import com.example.forecast.model.ForecastWindow;
import com.example.forecast.model.Frequency;
import com.example.forecast.model.PipelineResponse;
import com.example.forecast.model.PipelineStatus;
import com.example.forecast.model.PipelineTimings;
import com.example.forecast.model.RunFailure;
import com.example.forecast.model.Segment;
import com.example.forecast.model.SegmentSummary;
import com.example.forecast.model.TimelineEntry;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Merges per-segment outcomes into one response in ascending segment order.
 * <p>
 * Failed segments become a single gap marker spanning their window, with no values.
 * The merged timeline must be strictly increasing and contiguous in the declared
 * frequency; a break means the orchestrator itself is wrong and is raised as
 * {@link IllegalStateException}.
 */
@Component
public class ResultAggregator {

    static final String STAGE_NAME = "aggregation";

    public PipelineResponse merge(String requestId, Frequency frequency,
                                  List<SegmentOutcome> outcomes, List<DiagnosticEntry> upstreamDiagnostics) {
        List<TimelineEntry> timeline = new ArrayList<>();
        List<SegmentSummary> summaries = new ArrayList<>(outcomes.size());
        List<DiagnosticEntry> diagnostics = new ArrayList<>(upstreamDiagnostics);
        List<DiagnosticEntry> gapEntries = new ArrayList<>();
        int succeeded = 0;

        for (int i = 0; i < outcomes.size(); i++) {
            SegmentOutcome outcome = outcomes.get(i);
            if (outcome == null || outcome.index() != i) {
                throw new IllegalStateException("Segment slot " + i + " holds "
                        + (outcome == null ? "no outcome" : "segment " + outcome.index()));
            }
            diagnostics.addAll(outcome.diagnostics());
            Segment segment = outcome.task().segment();
            ForecastWindow window = outcome.task().window();

            if (outcome.succeeded()) {
                succeeded++;
                for (ForecastPoint point : outcome.forecast().points()) {
                    timeline.add(TimelineEntry.point(i, point));
                }
            } else {
                timeline.add(TimelineEntry.gap(i, window.start(), window.end(), outcome.failure()));
                gapEntries.add(new DiagnosticEntry(STAGE_NAME, i, DiagnosticStatus.GAP, outcome.failure(),
                        "gap marker for %s..%s: %s".formatted(window.start(), window.end(), outcome.failureMessage()),
                        0L, 0));
            }
            summaries.add(new SegmentSummary(i, segment.label(),
                    segment.series().firstTimestamp(), segment.series().lastTimestamp(), segment.length(),
                    outcome.succeeded(), outcome.failure(), outcome.outliersFound(), outcome.outliersCleansed(),
                    outcome.succeeded() ? outcome.forecast().model() : null, segment.classification(),
                    outcome.succeeded() ? outcome.forecast().rmse() : null,
                    outcome.succeeded() ? outcome.forecast().mape() : null));
        }
        diagnostics.addAll(gapEntries);
        if (!outcomes.isEmpty()) {
            verifyTimeline(timeline, outcomes.get(0).task().window().anchor(), frequency);
        }

        int total = outcomes.size();
        PipelineStatus status;
        RunFailure failure = null;
        if (succeeded == total && total > 0) {
            status = PipelineStatus.COMPLETE;
        } else if (succeeded > 0) {
            status = PipelineStatus.PARTIAL_SUCCESS;
        } else {
            status = PipelineStatus.FAILED;
            failure = RunFailure.FORECASTING_FAILED;
        }
        String message = "%d of %d segments forecast".formatted(succeeded, total);
        return new PipelineResponse(requestId, status, failure, message, frequency,
                timeline, summaries, diagnostics, PipelineTimings.NONE);
    }

    /**
     * Slot {@code s} of the merged timeline is {@code anchor + s} periods; every entry must
     * start on the next slot, and a gap must end on a slot.
     */
    static void verifyTimeline(List<TimelineEntry> timeline, Instant anchor, Frequency frequency) {
        long slot = 1;
        Instant previous = null;
        for (int i = 0; i < timeline.size(); i++) {
            TimelineEntry entry = timeline.get(i);
            Instant first = entry.isGap() ? entry.gapStart() : entry.timestamp();
            Instant last = entry.isGap() ? entry.gapEnd() : entry.timestamp();
            if (first == null || last == null || last.isBefore(first)) {
                throw new IllegalStateException("Timeline entry " + i + " has an invalid time range");
            }
            if (previous != null && !first.isAfter(previous)) {
                throw new IllegalStateException("Timeline not strictly increasing at entry %d: %s after %s"
                        .formatted(i, first, previous));
            }
            Instant expected = frequency.plus(anchor, slot);
            if (!first.equals(expected)) {
                throw new IllegalStateException("Timeline not contiguous at entry %d: %s, expected %s"
                        .formatted(i, first, expected));
            }
            while (frequency.plus(anchor, slot).isBefore(last)) {
                slot++;
            }
            if (!frequency.plus(anchor, slot).equals(last)) {
                throw new IllegalStateException("Gap at entry %d ends off the %s grid: %s"
                        .formatted(i, frequency, last));
            }
            slot++;
            previous = last;
        }
    }
}
