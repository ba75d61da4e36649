package com.example.forecast.stage;

import com.example.forecast.model.CleansedSegment;
import com.example.forecast.model.ForecastConfig;
import com.example.forecast.model.ForecastOutput;
import com.example.forecast.model.ForecastPoint;
import com.example.forecast.model.ForecastTask;
import com.example.forecast.model.OutlierConfig;
import com.example.forecast.model.PreprocessingConfig;
import com.example.forecast.model.Segment;
import com.example.forecast.model.SegmentCountPolicy;
import com.example.forecast.model.SegmentationConfig;
import com.example.forecast.model.TimeSeries;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Stage-to-stage data contracts checked by the stage client on every success.
 * <p>
 * Shared rules: the declared frequency is echoed back unchanged and the timestamp
 * domain of the input is preserved (no reordering, no dropped points).
 */
public final class StageContracts {

    private static final double CONFIDENCE_TOLERANCE = 1e-9;

    private StageContracts() {
    }

    public static ContractCheck<TimeSeries, PreprocessingConfig, TimeSeries> preprocessing() {
        return (input, config, output) -> {
            if (output == null) {
                return Optional.of("preprocessing returned no series");
            }
            return sameDomain(input, output, "preprocessed series");
        };
    }

    public static ContractCheck<TimeSeries, SegmentationConfig, List<Segment>> segmentation() {
        return (input, config, segments) -> {
            if (segments == null || segments.isEmpty()) {
                return Optional.of("segmentation returned no segments");
            }
            if (config.countPolicy() == SegmentCountPolicy.ENFORCE
                    && segments.size() != config.expectedSegments()) {
                return Optional.of("segmentation returned %d segments, %d requested"
                        .formatted(segments.size(), config.expectedSegments()));
            }
            int expectedStart = 0;
            for (int i = 0; i < segments.size(); i++) {
                Segment segment = segments.get(i);
                if (segment == null) {
                    return Optional.of("segment " + i + " is null");
                }
                if (segment.index() != i) {
                    return Optional.of("segment at position %d carries index %d".formatted(i, segment.index()));
                }
                if (segment.startOffset() != expectedStart) {
                    return Optional.of("segment %d starts at offset %d, expected %d (overlap or gap)"
                            .formatted(i, segment.startOffset(), expectedStart));
                }
                if (segment.endOffset() > input.size()) {
                    return Optional.of("segment %d ends at offset %d beyond series length %d"
                            .formatted(i, segment.endOffset(), input.size()));
                }
                Optional<String> domain = sameDomain(
                        input.slice(segment.startOffset(), segment.endOffset()), segment.series(),
                        "segment " + i);
                if (domain.isPresent()) {
                    return domain;
                }
                expectedStart = segment.endOffset();
            }
            if (expectedStart != input.size()) {
                return Optional.of("segments cover %d of %d points".formatted(expectedStart, input.size()));
            }
            return Optional.empty();
        };
    }

    public static ContractCheck<Segment, OutlierConfig, CleansedSegment> outlierCleansing() {
        return (input, config, output) -> {
            if (output == null || output.segment() == null) {
                return Optional.of("outlier cleansing returned no segment");
            }
            Segment cleansed = output.segment();
            if (cleansed.index() != input.index()
                    || cleansed.startOffset() != input.startOffset()
                    || cleansed.endOffset() != input.endOffset()) {
                return Optional.of("outlier cleansing changed the segment identity (index %d [%d, %d) -> index %d [%d, %d))"
                        .formatted(input.index(), input.startOffset(), input.endOffset(),
                                cleansed.index(), cleansed.startOffset(), cleansed.endOffset()));
            }
            for (Integer idx : output.outlierIndices()) {
                if (idx == null || idx < 0 || idx >= input.length()) {
                    return Optional.of("outlier index " + idx + " outside segment of length " + input.length());
                }
            }
            return sameDomain(input.series(), cleansed.series(), "cleansed segment " + input.index());
        };
    }

    public static ContractCheck<ForecastTask, ForecastConfig, ForecastOutput> forecastGeneration() {
        return (task, config, output) -> {
            if (output == null) {
                return Optional.of("forecast generation returned no output");
            }
            int segmentIndex = task.segment().index();
            if (output.segmentIndex() != segmentIndex) {
                return Optional.of("forecast for segment %d tagged with segment %d"
                        .formatted(segmentIndex, output.segmentIndex()));
            }
            if (Math.abs(output.confidenceLevel() - config.confidenceInterval()) > CONFIDENCE_TOLERANCE) {
                return Optional.of("forecast bounds computed at confidence %s, %s requested"
                        .formatted(output.confidenceLevel(), config.confidenceInterval()));
            }
            List<Instant> expected = task.window().timestamps();
            List<ForecastPoint> points = output.points();
            if (points.size() != expected.size()) {
                return Optional.of("forecast has %d points, horizon is %d".formatted(points.size(), expected.size()));
            }
            for (int k = 0; k < points.size(); k++) {
                ForecastPoint point = points.get(k);
                if (point == null || !expected.get(k).equals(point.timestamp())) {
                    return Optional.of("forecast point %d is at %s, expected %s"
                            .formatted(k, point == null ? null : point.timestamp(), expected.get(k)));
                }
                if (!point.isFinite()) {
                    return Optional.of("forecast point %d is not finite".formatted(k));
                }
                if (!point.boundsOrdered()) {
                    return Optional.of("forecast point %d violates lower <= forecast <= upper (%s, %s, %s)"
                            .formatted(k, point.lower(), point.forecast(), point.upper()));
                }
            }
            return Optional.empty();
        };
    }

    private static Optional<String> sameDomain(TimeSeries input, TimeSeries output, String what) {
        if (output == null) {
            return Optional.of(what + " is missing");
        }
        if (output.frequency() != input.frequency()) {
            return Optional.of("%s changed frequency %s -> %s".formatted(what, input.frequency(), output.frequency()));
        }
        if (output.size() != input.size()) {
            return Optional.of("%s has %d points, input had %d".formatted(what, output.size(), input.size()));
        }
        if (!output.timestamps().equals(input.timestamps())) {
            return Optional.of(what + " does not preserve the input timestamps");
        }
        return Optional.empty();
    }
}
