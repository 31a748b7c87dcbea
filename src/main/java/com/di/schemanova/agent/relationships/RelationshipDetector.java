package com.di.schemanova.agent.relationships;

import com.di.schemanova.agent.profiler.ColumnProfile;
import com.di.schemanova.agent.profiler.SemanticType;
import com.di.schemanova.config.InferenceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stage 5: builds the relationship graph across all datasets of a session.
 *
 * <p>For every ordered pair of distinct datasets and every pair of type-compatible columns,
 * the match strength is {@code nameWeight * nameSimilarity + overlapWeight * overlap}, where
 * overlap is the harmonic mean of the two directional distinct-value overlaps. Type
 * compatibility is checked before any value set is touched; value sets are materialized once
 * per column through {@link DistinctValueCache}. Only candidates strictly above the minimum
 * strength are kept, one per unordered column pair.
 *
 * <p>Pure function of the snapshot: no state survives between calls.
 */
@Slf4j
@Component
public class RelationshipDetector {

    private final InferenceProperties.Relationships config;
    private final ColumnNameMatcher nameMatcher;

    public RelationshipDetector(InferenceProperties properties) {
        this.config = properties.getRelationships();
        this.nameMatcher = new ColumnNameMatcher(config.getSubstringNameScore());
    }

    public RelationshipGraph detect(SessionSnapshot snapshot) {
        DistinctValueCache cache = new DistinctValueCache();
        Map<PairKey, RelationshipCandidate> best = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();
        long compared = 0;
        long incompatible = 0;

        for (DatasetSnapshot a : snapshot.datasets()) {
            for (DatasetSnapshot b : snapshot.datasets()) {
                if (a.name().equals(b.name())) continue;
                for (ColumnProfile pa : a.profiles()) {
                    for (ColumnProfile pb : b.profiles()) {
                        if (!compatible(pa, pb)) {
                            incompatible++;
                            continue;
                        }
                        compared++;
                        try {
                            RelationshipCandidate candidate = score(a, pa, b, pb, cache);
                            if (candidate != null) {
                                best.merge(PairKey.of(a.name(), pa.getColumnName(), b.name(), pb.getColumnName()),
                                        candidate, RelationshipDetector::preferred);
                            }
                        } catch (RuntimeException e) {
                            String warning = String.format("Skipped %s.%s -> %s.%s: %s",
                                    a.name(), pa.getColumnName(), b.name(), pb.getColumnName(), e.getMessage());
                            log.warn("[RELATIONSHIPS] {}", warning, e);
                            warnings.add(warning);
                        }
                    }
                }
            }
        }

        List<RelationshipCandidate> edges = new ArrayList<>(best.values());
        edges.sort(Comparator.comparingDouble(RelationshipCandidate::getMatchStrength).reversed()
                .thenComparing(RelationshipCandidate::getSourceDataset)
                .thenComparing(RelationshipCandidate::getTargetDataset)
                .thenComparing(e -> e.getSourceColumns().get(0)));

        List<GraphNode> nodes = new ArrayList<>();
        for (DatasetSnapshot d : snapshot.datasets()) {
            nodes.add(new GraphNode(d.name(), d.role(), d.dataset().rowCount(), d.dataset().getColumns()));
        }

        log.info("[RELATIONSHIPS] datasets={} comparedColumnPairs={} skippedIncompatible={} candidates={} cachedColumns={}",
                snapshot.size(), compared, incompatible, edges.size(), cache.size());
        return new RelationshipGraph(List.copyOf(nodes), List.copyOf(edges), List.copyOf(warnings));
    }

    /**
     * Cheap pre-filter on semantic types and cardinality; runs before any value overlap.
     */
    boolean compatible(ColumnProfile a, ColumnProfile b) {
        if (a.getNonMissingCount() == 0 || b.getNonMissingCount() == 0) {
            return false;
        }
        SemanticType ta = a.getSemanticType();
        SemanticType tb = b.getSemanticType();
        if (ta == SemanticType.NUMERIC && tb == SemanticType.NUMERIC) {
            return true;
        }
        if (ta == SemanticType.IDENTIFIER && tb == SemanticType.IDENTIFIER) {
            return true;
        }
        if (isTextLike(ta) && isTextLike(tb)) {
            long min = Math.min(a.getDistinctCount(), b.getDistinctCount());
            long max = Math.max(a.getDistinctCount(), b.getDistinctCount());
            return max > 0 && (double) min / max >= config.getTextCardinalitySimilarity();
        }
        return false;
    }

    private RelationshipCandidate score(DatasetSnapshot a, ColumnProfile pa,
                                        DatasetSnapshot b, ColumnProfile pb,
                                        DistinctValueCache cache) {
        Set<Object> va = cache.distinctValues(a.dataset(), pa.getColumnName());
        Set<Object> vb = cache.distinctValues(b.dataset(), pb.getColumnName());
        if (va.isEmpty() || vb.isEmpty()) {
            return null;
        }
        Set<Object> smaller = va.size() <= vb.size() ? va : vb;
        Set<Object> larger = smaller == va ? vb : va;
        long intersection = 0;
        for (Object v : smaller) {
            if (larger.contains(v)) intersection++;
        }
        double sourceOverlap = (double) intersection / va.size();
        double targetOverlap = (double) intersection / vb.size();
        double overlap = harmonicMean(sourceOverlap, targetOverlap);

        double name = nameMatcher.similarity(pa.getColumnName(), pb.getColumnName());
        double strength = Math.min(1.0, config.getNameWeight() * name + config.getOverlapWeight() * overlap);
        if (strength <= config.getMinMatchStrength()) {
            return null;
        }

        boolean sourceKeyed = a.isKeyColumn(pa.getColumnName());
        boolean targetKeyed = b.isKeyColumn(pb.getColumnName());
        Directionality direction = sourceKeyed == targetKeyed
                ? Directionality.UNDETERMINED
                : (sourceKeyed ? Directionality.SOURCE_IS_ONE_SIDE : Directionality.TARGET_IS_ONE_SIDE);

        return RelationshipCandidate.builder()
                .sourceDataset(a.name())
                .sourceColumns(List.of(pa.getColumnName()))
                .targetDataset(b.name())
                .targetColumns(List.of(pb.getColumnName()))
                .matchStrength(strength)
                .nameSimilarity(name)
                .sourceOverlap(sourceOverlap)
                .targetOverlap(targetOverlap)
                .directionality(direction)
                .cardinality(RelationshipCardinality.of(sourceKeyed, targetKeyed))
                .build();
    }

    /**
     * Keeps the higher-scoring orientation; on a tie prefers the one pointing at the keyed side.
     */
    private static RelationshipCandidate preferred(RelationshipCandidate existing, RelationshipCandidate candidate) {
        if (candidate.getMatchStrength() > existing.getMatchStrength()) {
            return candidate;
        }
        if (candidate.getMatchStrength() == existing.getMatchStrength()
                && candidate.getDirectionality() == Directionality.TARGET_IS_ONE_SIDE
                && existing.getDirectionality() != Directionality.TARGET_IS_ONE_SIDE) {
            return candidate;
        }
        return existing;
    }

    private static boolean isTextLike(SemanticType type) {
        return type == SemanticType.TEXT || type == SemanticType.IDENTIFIER;
    }

    static double harmonicMean(double x, double y) {
        return x + y == 0.0 ? 0.0 : 2 * x * y / (x + y);
    }

    /** Unordered {dataset, column} pair. */
    record PairKey(String first, String second) {

        static PairKey of(String datasetA, String columnA, String datasetB, String columnB) {
            String left = datasetA + '\u0000' + columnA;
            String right = datasetB + '\u0000' + columnB;
            return left.compareTo(right) <= 0 ? new PairKey(left, right) : new PairKey(right, left);
        }
    }
}
