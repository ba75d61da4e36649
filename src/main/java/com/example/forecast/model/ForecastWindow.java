package com.example.forecast.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Slots of the merged forecast timeline assigned to one segment.
 * Slot {@code k} of the window is {@code anchor + (offset + k + 1)} periods.
 *
 * @param segmentIndex owning segment
 * @param anchor       last timestamp of the preprocessed series
 * @param offset       number of slots assigned to earlier segments
 * @param horizon      number of slots in this window
 * @param frequency    declared frequency
 */
public record ForecastWindow(
        int segmentIndex,
        Instant anchor,
        long offset,
        int horizon,
        Frequency frequency
) {
    public ForecastWindow {
        if (horizon <= 0) {
            throw new IllegalArgumentException("horizon must be > 0");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
    }

    public Instant start() {
        return frequency.plus(anchor, offset + 1);
    }

    public Instant end() {
        return frequency.plus(anchor, offset + horizon);
    }

    public List<Instant> timestamps() {
        List<Instant> timestamps = new ArrayList<>(horizon);
        for (int k = 1; k <= horizon; k++) {
            timestamps.add(frequency.plus(anchor, offset + k));
        }
        return timestamps;
    }
}
