package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * The four stages of the fixed pipeline topology, in execution order.
 */
public enum StageKind {
    PREPROCESSING("preprocessing"),
    SEGMENTATION("segmentation"),
    OUTLIER_CLEANSING("outlier_cleansing"),
    FORECAST_GENERATION("forecast_generation");

    private final String stageName;

    StageKind(String stageName) {
        this.stageName = stageName;
    }

    @JsonValue
    public String stageName() {
        return stageName;
    }

    /** Stages a request may skip through {@code plan.skip}. */
    public boolean isSkippable() {
        return this == SEGMENTATION || this == OUTLIER_CLEANSING;
    }

    @JsonCreator
    public static StageKind fromName(String name) {
        return Arrays.stream(values())
                .filter(k -> k.stageName.equalsIgnoreCase(name) || k.name().equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown stage '" + name + "'"));
    }
}
