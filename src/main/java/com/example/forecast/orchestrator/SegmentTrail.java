package com.example.forecast.orchestrator;

import com.example.forecast.model.DiagnosticEntry;
import com.example.forecast.model.DiagnosticStatus;
import com.example.forecast.model.FailureKind;
import com.example.forecast.model.StageKind;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Diagnostics of one segment as they are produced, plus the stage currently in flight.
 * <p>
 * Written by the segment's runner, read by the coordinator when the request deadline
 * passes. Each update swaps an immutable snapshot, so a reader never sees an entry
 * recorded while its stage still counts as running.
 */
final class SegmentTrail {

    private record Snapshot(List<DiagnosticEntry> entries, StageKind running, long runningSince) {
        static final Snapshot EMPTY = new Snapshot(List.of(), null, 0L);
    }

    private final int segmentIndex;
    private final AtomicReference<Snapshot> state = new AtomicReference<>(Snapshot.EMPTY);

    SegmentTrail(int segmentIndex) {
        this.segmentIndex = segmentIndex;
    }

    void begin(StageKind stage) {
        long now = System.nanoTime();
        state.updateAndGet(s -> new Snapshot(s.entries(), stage, now));
    }

    void record(DiagnosticEntry entry) {
        state.updateAndGet(s -> {
            List<DiagnosticEntry> entries = new ArrayList<>(s.entries());
            entries.add(entry);
            return new Snapshot(List.copyOf(entries), null, 0L);
        });
    }

    List<DiagnosticEntry> entries() {
        return state.get().entries();
    }

    /**
     * Entries recorded so far, completed for a segment cut off by the request deadline:
     * the stage in flight gets a {@code DEADLINE_EXCEEDED} failure, each planned stage
     * that never started gets a {@code SKIPPED} entry.
     */
    List<DiagnosticEntry> cutOff(List<StageKind> plannedStages) {
        Snapshot snapshot = state.get();
        List<DiagnosticEntry> entries = new ArrayList<>(snapshot.entries());
        for (StageKind stage : plannedStages) {
            boolean recorded = snapshot.entries().stream().anyMatch(e -> e.stage().equals(stage.stageName()));
            if (recorded) {
                continue;
            }
            if (stage == snapshot.running()) {
                long inFlightMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - snapshot.runningSince());
                entries.add(new DiagnosticEntry(stage.stageName(), segmentIndex, DiagnosticStatus.FAILED,
                        FailureKind.DEADLINE_EXCEEDED, "request deadline exceeded while the stage was running",
                        inFlightMs, 1));
            } else {
                entries.add(new DiagnosticEntry(stage.stageName(), segmentIndex, DiagnosticStatus.SKIPPED,
                        FailureKind.DEADLINE_EXCEEDED, "not started before the request deadline", 0L, 0));
            }
        }
        return entries;
    }
}
