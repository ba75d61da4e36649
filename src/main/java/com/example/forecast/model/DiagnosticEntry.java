package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One diagnostics line, emitted for every stage invocation whatever its outcome.
 *
 * @param stage        stage name (or {@code aggregation})
 * @param segmentIndex segment the entry refers to, {@code null} for whole-series stages
 * @param status       outcome of the invocation
 * @param failureKind  failure reason when the invocation failed
 * @param message      human-readable detail
 * @param durationMs   wall time of the invocation including retries
 * @param attempts     remote invocations made
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiagnosticEntry(
        String stage,
        @JsonInclude(JsonInclude.Include.ALWAYS) Integer segmentIndex,
        DiagnosticStatus status,
        FailureKind failureKind,
        String message,
        long durationMs,
        int attempts
) {

    public static DiagnosticEntry of(StageResult<?> result, Integer segmentIndex) {
        if (result instanceof StageResult.Failure<?> failure) {
            return new DiagnosticEntry(failure.stageName(), segmentIndex, DiagnosticStatus.FAILED,
                    failure.kind(), failure.message(), failure.durationMs(), failure.attempts());
        }
        StageResult.Success<?> success = (StageResult.Success<?>) result;
        String message = success.cached() ? "served from stage result cache" : "ok";
        return new DiagnosticEntry(success.stageName(), segmentIndex, DiagnosticStatus.SUCCESS,
                null, message, success.durationMs(), success.attempts());
    }

    public static DiagnosticEntry skipped(StageKind stage, Integer segmentIndex, String reason) {
        return new DiagnosticEntry(stage.stageName(), segmentIndex, DiagnosticStatus.SKIPPED, null, reason, 0L, 0);
    }

    /** Same entry re-labelled as a degraded-mode marker with the fallback that was taken. */
    public DiagnosticEntry degraded(String fallback) {
        return new DiagnosticEntry(stage, segmentIndex, DiagnosticStatus.DEGRADED, failureKind,
                message + "; " + fallback, durationMs, attempts);
    }
}
