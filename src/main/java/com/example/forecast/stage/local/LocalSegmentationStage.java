package com.example.forecast.stage.local;

import com.example.forecast.model.FailureKind;
import com.example.forecast.model.Segment;
import com.example.forecast.model.SegmentClassification;
import com.example.forecast.model.SegmentationConfig;
import com.example.forecast.model.TimeSeries;
import com.example.forecast.stage.SegmentationStage;
import com.example.forecast.stage.StageException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * In-process segmentation into contiguous, non-overlapping ranges, each carrying its
 * {@link SegmentClassifier demand profile}.
 * Deterministic: the same input always yields the same segments.
 */
public class LocalSegmentationStage implements SegmentationStage {

    @Override
    public List<Segment> invoke(TimeSeries input, SegmentationConfig config, Instant deadline) throws StageException {
        if (input.isEmpty()) {
            throw new StageException(FailureKind.INVALID_INPUT, "cannot segment an empty series");
        }
        List<Segment> ranges = switch (config.method()) {
            case NONE -> List.of(Segment.whole(input));
            case FIXED_COUNT -> fixedCount(input, config.segments());
            case SEASONAL -> seasonal(input, config.segments());
        };
        List<SegmentClassification> profiles = SegmentClassifier.classify(
                ranges.stream().map(Segment::series).toList(), config.historyPeriods(), config.thresholds());
        List<Segment> segments = new ArrayList<>(ranges.size());
        for (int i = 0; i < ranges.size(); i++) {
            segments.add(ranges.get(i).withClassification(profiles.get(i)));
        }
        return segments;
    }

    /** {@code count} near-equal ranges; earlier ranges take the remainder. */
    static List<Segment> fixedCount(TimeSeries input, int count) {
        int n = Math.min(count, input.size());
        int base = input.size() / n;
        int remainder = input.size() % n;
        List<Segment> segments = new ArrayList<>(n);
        int start = 0;
        for (int i = 0; i < n; i++) {
            int end = start + base + (i < remainder ? 1 : 0);
            segments.add(new Segment(i, "segment-" + i, start, end, input.slice(start, end)));
            start = end;
        }
        return segments;
    }

    /**
     * One range per seasonal cycle; a trailing partial cycle is merged into the previous one.
     * Frequencies without a season fall back to {@link #fixedCount}.
     */
    static List<Segment> seasonal(TimeSeries input, int fallbackCount) {
        int season = input.frequency().seasonLength();
        if (season <= 0 || input.size() < season) {
            return fixedCount(input, fallbackCount);
        }
        int cycles = input.size() / season;
        List<Segment> segments = new ArrayList<>(cycles);
        for (int i = 0; i < cycles; i++) {
            int start = i * season;
            int end = i == cycles - 1 ? input.size() : start + season;
            segments.add(new Segment(i, "season-" + i, start, end, input.slice(start, end)));
        }
        return segments;
    }
}
