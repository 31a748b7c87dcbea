package com.di.schemanova.agent.keys;

import com.di.schemanova.agent.cleaning.Dataset;
import com.di.schemanova.agent.profiler.ColumnProfile;
import com.di.schemanova.agent.profiler.SemanticType;
import com.di.schemanova.config.InferenceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Stage 3: ranks columns, and if needed column pairs, by how well they identify rows.
 *
 * <p>Single column score = distinct ratio - penalty weight * missing ratio; columns above the
 * missing-ratio ceiling are never candidates. Pairs are only tried when no single column is
 * a confident key: columns are ordered by distinct ratio (descending, ties by position) and
 * the first pair whose tuple uniqueness reaches the high-confidence threshold is accepted.
 * The output is deterministic for a given input and may be empty.
 */
@Slf4j
@Component
public class KeyCandidateDetector {

    private final InferenceProperties.Keys config;

    public KeyCandidateDetector(InferenceProperties properties) {
        this.config = properties.getKeys();
    }

    /**
     * @return candidates sorted by confidence descending; empty when nothing qualifies or
     *         the dataset has too few rows
     */
    public List<KeyCandidate> detect(Dataset dataset, List<ColumnProfile> profiles) {
        if (dataset.rowCount() < config.getMinRowsForKeys()) {
            log.info("[KEYS] dataset={} has {} row(s); below minimum {} for key detection",
                    dataset.getName(), dataset.rowCount(), config.getMinRowsForKeys());
            return List.of();
        }

        List<KeyCandidate> candidates = new ArrayList<>();
        for (ColumnProfile p : profiles) {
            if (p.getSemanticType() == SemanticType.BOOLEAN || p.getNonMissingCount() == 0) continue;
            if (p.getMissingRatio() > config.getMaxMissingRatio()) continue;
            double score = clamp(p.getDistinctRatio() - config.getMissingPenaltyWeight() * p.getMissingRatio());
            if (score >= config.getMinCandidateScore()) {
                candidates.add(KeyCandidate.builder()
                        .datasetName(dataset.getName())
                        .columns(List.of(p.getColumnName()))
                        .uniquenessRatio(p.getDistinctRatio())
                        .nullRatio(p.getMissingRatio())
                        .confidence(score)
                        .build());
            }
        }

        boolean confidentSingle = candidates.stream()
                .anyMatch(k -> k.isConfident(config.getHighConfidenceUniqueness()));
        if (!confidentSingle && dataset.columnCount() > 1) {
            KeyCandidate pair = findCompositeKey(dataset, profiles);
            if (pair != null) {
                candidates.add(pair);
            }
        }

        candidates.sort(ranking(dataset));
        log.info("[KEYS] dataset={} candidates={}", dataset.getName(),
                candidates.stream().map(k -> String.join("+", k.getColumns())).toList());
        return Collections.unmodifiableList(candidates);
    }

    private KeyCandidate findCompositeKey(Dataset dataset, List<ColumnProfile> profiles) {
        List<ColumnProfile> ordered = new ArrayList<>();
        for (ColumnProfile p : profiles) {
            if (p.getMissingRatio() <= config.getMaxMissingRatio() && p.getNonMissingCount() > 0) {
                ordered.add(p);
            }
        }
        ordered.sort(Comparator.comparingDouble(ColumnProfile::getDistinctRatio).reversed()
                .thenComparingInt(ColumnProfile::getPosition));

        int tested = 0;
        long rowCount = dataset.rowCount();
        for (int i = 0; i < ordered.size(); i++) {
            for (int j = i + 1; j < ordered.size(); j++) {
                if (tested++ >= config.getMaxPairCombinations()) {
                    log.debug("[KEYS] dataset={} pair budget of {} exhausted", dataset.getName(), config.getMaxPairCombinations());
                    return null;
                }
                ColumnProfile a = ordered.get(i);
                ColumnProfile b = ordered.get(j);
                Set<List<Object>> tuples = new HashSet<>();
                long rowsWithMissing = 0;
                for (List<Object> row : dataset.getRows()) {
                    Object va = row.get(a.getPosition());
                    Object vb = row.get(b.getPosition());
                    if (va == null || vb == null) rowsWithMissing++;
                    tuples.add(Arrays.asList(va, vb));
                }
                double nullRatio = (double) rowsWithMissing / rowCount;
                if (nullRatio > config.getMaxMissingRatio()) continue;
                double uniqueness = (double) tuples.size() / rowCount;
                if (uniqueness >= config.getHighConfidenceUniqueness()) {
                    return KeyCandidate.builder()
                            .datasetName(dataset.getName())
                            .columns(List.of(a.getColumnName(), b.getColumnName()))
                            .uniquenessRatio(uniqueness)
                            .nullRatio(nullRatio)
                            .confidence(clamp(uniqueness - config.getMissingPenaltyWeight() * nullRatio))
                            .build();
                }
            }
        }
        return null;
    }

    private static Comparator<KeyCandidate> ranking(Dataset dataset) {
        return Comparator.comparingDouble(KeyCandidate::getConfidence).reversed()
                .thenComparingInt(k -> k.getColumns().size())
                .thenComparingInt(k -> dataset.indexOf(k.getColumns().get(0)));
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
