package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Entry of the merged forecast timeline: a forecast point or a gap marker spanning
 * the window of a failed segment. Gaps carry no values.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TimelineEntry(
        EntryType type,
        int segmentIndex,
        Instant timestamp,
        Double forecast,
        Double lower,
        Double upper,
        Instant gapStart,
        Instant gapEnd,
        FailureKind gapReason
) {
    public enum EntryType {
        POINT,
        GAP
    }

    public static TimelineEntry point(int segmentIndex, ForecastPoint point) {
        return new TimelineEntry(EntryType.POINT, segmentIndex, point.timestamp(),
                point.forecast(), point.lower(), point.upper(), null, null, null);
    }

    public static TimelineEntry gap(int segmentIndex, Instant start, Instant end, FailureKind reason) {
        return new TimelineEntry(EntryType.GAP, segmentIndex, null, null, null, null, start, end, reason);
    }

    @JsonIgnore
    public boolean isGap() {
        return type == EntryType.GAP;
    }
}
