package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Result of one orchestration run. Always well-formed, whatever the outcome.
 *
 * @param requestId      identifier of the run, also used in logs
 * @param status         overall outcome
 * @param failure        reason of a {@code FAILED} run, {@code null} otherwise
 * @param message        summary of the outcome
 * @param frequency      declared frequency of the forecast timeline
 * @param mergedForecast forecast points and gap markers in timeline order
 * @param segments       one summary per segment, in index order
 * @param diagnostics    one entry per stage invocation (plus aggregation gap entries)
 * @param timings        per-phase timings
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineResponse(
        String requestId,
        PipelineStatus status,
        RunFailure failure,
        String message,
        Frequency frequency,
        List<TimelineEntry> mergedForecast,
        List<SegmentSummary> segments,
        List<DiagnosticEntry> diagnostics,
        PipelineTimings timings
) {
    public PipelineResponse {
        mergedForecast = mergedForecast == null ? List.of() : List.copyOf(mergedForecast);
        segments = segments == null ? List.of() : List.copyOf(segments);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /** A failed run carries diagnostics but no forecast content. */
    public static PipelineResponse failed(String requestId, RunFailure failure, String message,
                                          Frequency frequency, List<DiagnosticEntry> diagnostics,
                                          PipelineTimings timings) {
        return new PipelineResponse(requestId, PipelineStatus.FAILED, failure, message, frequency,
                List.of(), List.of(), diagnostics, timings);
    }

    public PipelineResponse withTimings(PipelineTimings newTimings) {
        return new PipelineResponse(requestId, status, failure, message, frequency,
                mergedForecast, segments, diagnostics, newTimings);
    }

    public long forecastPointCount() {
        return mergedForecast.stream().filter(e -> !e.isGap()).count();
    }
}
