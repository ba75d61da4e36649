package com.example.forecast.model;

public enum PipelineStatus {
    COMPLETE,
    PARTIAL_SUCCESS,
    FAILED
}
