package com.di.schemanova.agent.inference;

import com.di.schemanova.config.InferenceProperties;
import com.di.schemanova.model.AnalysisResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Bounded, expiring in-memory store of analysis runs. Nothing is written to disk.
 */
@Component
public class InMemoryAnalysisStore implements AnalysisStore {

    private final Cache<String, AnalysisResult> byRunId;

    public InMemoryAnalysisStore(InferenceProperties properties) {
        InferenceProperties.Store store = properties.getStore();
        this.byRunId = Caffeine.newBuilder()
                .maximumSize(store.getMaxRuns())
                .expireAfterWrite(store.getExpireAfterWriteMinutes(), TimeUnit.MINUTES)
                .build();
    }

    @Override
    public String save(AnalysisResult result) {
        if (result == null || result.getRunId() == null) return null;
        byRunId.put(result.getRunId(), result);
        return result.getRunId();
    }

    @Override
    public Optional<AnalysisResult> findByRunId(String runId) {
        if (runId == null || runId.isBlank()) return Optional.empty();
        return Optional.ofNullable(byRunId.getIfPresent(runId));
    }

    @Override
    public List<AnalysisResult> findRecent(int limit) {
        return byRunId.asMap().values().stream()
                .sorted(Comparator.comparing(AnalysisResult::getCompletedAt).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }
}
