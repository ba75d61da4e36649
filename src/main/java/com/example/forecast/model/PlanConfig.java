package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumSet;
import java.util.Set;

/**
 * Execution-plan controls. Skipping a stage is only possible here, never by omitting its config.
 *
 * @param skip           stages to skip; only segmentation and outlier cleansing are skippable
 * @param deadlineMs     per-request deadline, {@code null} for the server default
 * @param maxParallelism concurrent segment tasks, {@code null} for the server default
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlanConfig(
        @JsonProperty("skip") Set<StageKind> skip,
        @JsonProperty("deadline_ms") Long deadlineMs,
        @JsonProperty("max_parallelism") Integer maxParallelism
) {
    public PlanConfig {
        skip = skip == null || skip.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(skip));
        for (StageKind kind : skip) {
            if (!kind.isSkippable()) {
                throw new IllegalArgumentException("Stage '" + kind.stageName() + "' cannot be skipped");
            }
        }
        if (deadlineMs != null && deadlineMs <= 0) {
            throw new IllegalArgumentException("plan.deadline_ms must be > 0");
        }
        if (maxParallelism != null && maxParallelism < 1) {
            throw new IllegalArgumentException("plan.max_parallelism must be >= 1");
        }
    }

    public static PlanConfig defaults() {
        return new PlanConfig(null, null, null);
    }

    public boolean skips(StageKind kind) {
        return skip.contains(kind);
    }
}
