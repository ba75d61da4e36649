package com.example.forecast.stage;

import com.example.forecast.model.StageResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded LRU cache of successful stage results, keyed by input fingerprint.
 */
public class InMemoryStageResultCache<O> implements StageResultCache<O> {

    private final Map<String, StageResult.Success<O>> entries;

    public InMemoryStageResultCache(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0");
        }
        this.entries = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, StageResult.Success<O>> eldest) {
                return size() > maxEntries;
            }
        });
    }

    @Override
    public Optional<StageResult.Success<O>> get(String fingerprint) {
        return Optional.ofNullable(entries.get(fingerprint));
    }

    @Override
    public void put(String fingerprint, StageResult.Success<O> result) {
        entries.put(fingerprint, result);
    }

    public int size() {
        return entries.size();
    }
}
