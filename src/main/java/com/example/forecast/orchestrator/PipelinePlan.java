package com.example.forecast.orchestrator;

import com.example.forecast.config.ForecastProperties;
import com.example.forecast.model.PipelineConfig;
import com.example.forecast.model.PlanConfig;
import com.example.forecast.model.StageKind;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Execution plan of one run: the stage steps in topology order (minus those the request
 * skips), the request deadline and the segment parallelism.
 *
 * @param requestId    identifier of the run
 * @param steps        stages to run, in order
 * @param config       request configuration with defaults applied
 * @param deadline     instant after which in-flight work is cancelled
 * @param stageTimeout budget of a single stage attempt
 * @param parallelism  segment tasks run at once
 */
public record PipelinePlan(
        String requestId,
        List<StageKind> steps,
        PipelineConfig config,
        Instant deadline,
        Duration stageTimeout,
        int parallelism
) {
    public PipelinePlan {
        steps = List.copyOf(steps);
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
    }

    /**
     * Derives the plan from the static topology, the request's plan controls and the
     * server limits. The request may lower parallelism but never above the worker pool.
     */
    public static PipelinePlan build(String requestId, PipelineConfig config,
                                     ForecastProperties.Pipeline limits, Instant now) {
        PlanConfig plan = config.plan();
        List<StageKind> steps = Arrays.stream(StageKind.values())
                .filter(kind -> !plan.skips(kind))
                .toList();
        Duration budget = plan.deadlineMs() != null
                ? Duration.ofMillis(plan.deadlineMs())
                : limits.requestDeadline();
        int parallelism = plan.maxParallelism() != null
                ? Math.min(plan.maxParallelism(), limits.workerPoolSize())
                : limits.effectiveParallelism();
        return new PipelinePlan(requestId, steps, config, now.plus(budget), limits.stageTimeout(), parallelism);
    }

    public boolean runs(StageKind kind) {
        return steps.contains(kind);
    }

    public Duration remaining() {
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
