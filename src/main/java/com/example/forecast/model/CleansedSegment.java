package com.example.forecast.model;

import java.util.List;

/**
 * Output of the outlier cleansing stage for one segment.
 *
 * @param segment        the segment with corrected values
 * @param outlierIndices positions (relative to the segment) that were corrected
 * @param method         detection method that was applied
 * @param correctionType correction that was applied
 */
public record CleansedSegment(
        Segment segment,
        List<Integer> outlierIndices,
        String method,
        String correctionType
) {
    public CleansedSegment {
        outlierIndices = outlierIndices == null ? List.of() : List.copyOf(outlierIndices);
    }
}
