package com.example.forecast.model;

/**
 * Reason a whole run ended with status {@link PipelineStatus#FAILED}.
 */
public enum RunFailure {
    PREPROCESSING_FAILED,
    FORECASTING_FAILED,
    INVALID_INPUT
}
