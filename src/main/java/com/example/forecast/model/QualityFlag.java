package com.example.forecast.model;

/**
 * Per-point quality marker carried through every stage.
 */
public enum QualityFlag {
    OK,
    MISSING,
    IMPUTED,
    OUTLIER,
    CORRECTED
}
