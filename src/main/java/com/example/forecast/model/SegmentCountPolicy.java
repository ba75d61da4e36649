package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What to do when segmentation returns a different number of segments than requested.
 */
public enum SegmentCountPolicy {
    /** Keep the segments the method produced. */
    @JsonProperty("accept") ACCEPT,
    /** Treat a count mismatch as a contract violation. */
    @JsonProperty("enforce") ENFORCE
}
