package com.example.forecast.stage;

import com.example.forecast.model.StageResult;

import java.util.Optional;

/**
 * Optional side collaborator consulted by the stage client before invoking a stage.
 * One cache per stage client, so entries keep the stage's output type.
 *
 * @param <O> stage output type
 */
public interface StageResultCache<O> {

    Optional<StageResult.Success<O>> get(String fingerprint);

    void put(String fingerprint, StageResult.Success<O> result);

    default boolean isEnabled() {
        return true;
    }

    static <O> StageResultCache<O> disabled() {
        return new NoOpStageResultCache<>();
    }
}
