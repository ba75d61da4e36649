package com.example.forecast.stage;

import com.example.forecast.model.StageResult;

import java.util.Optional;

final class NoOpStageResultCache<O> implements StageResultCache<O> {

    @Override
    public Optional<StageResult.Success<O>> get(String fingerprint) {
        return Optional.empty();
    }

    @Override
    public void put(String fingerprint, StageResult.Success<O> result) {
        // nothing stored
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
