package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Contiguous sub-range of a parent series produced by segmentation.
 *
 * @param index       position among the parent's segments, starting at 0
 * @param label       human-readable label assigned by the segmentation stage
 * @param startOffset inclusive offset of the first point in the parent series
 * @param endOffset   exclusive offset after the last point in the parent series
 * @param series      the points of this range
 * @param classification demand profile, {@code null} until segmentation assigns one
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Segment(
        int index,
        String label,
        int startOffset,
        int endOffset,
        TimeSeries series,
        SegmentClassification classification
) {
    @JsonCreator
    public Segment {
        Objects.requireNonNull(series, "series");
        if (index < 0) {
            throw new IllegalArgumentException("Segment index must be >= 0, got " + index);
        }
        if (startOffset < 0 || endOffset <= startOffset) {
            throw new IllegalArgumentException("Invalid segment range [%d, %d)".formatted(startOffset, endOffset));
        }
        if (series.size() != endOffset - startOffset) {
            throw new IllegalArgumentException("Segment %d holds %d points for range [%d, %d)"
                    .formatted(index, series.size(), startOffset, endOffset));
        }
    }

    public Segment(int index, String label, int startOffset, int endOffset, TimeSeries series) {
        this(index, label, startOffset, endOffset, series, null);
    }

    /** The single implicit segment covering a whole series. */
    public static Segment whole(TimeSeries series) {
        return new Segment(0, "whole-series", 0, series.size(), series);
    }

    public int length() {
        return endOffset - startOffset;
    }

    public Segment withSeries(TimeSeries newSeries) {
        return new Segment(index, label, startOffset, endOffset, newSeries, classification);
    }

    public Segment withClassification(SegmentClassification newClassification) {
        return new Segment(index, label, startOffset, endOffset, series, newClassification);
    }
}
