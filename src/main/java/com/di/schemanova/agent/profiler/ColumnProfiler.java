package com.di.schemanova.agent.profiler;

import com.di.schemanova.agent.cleaning.CleaningResult;
import com.di.schemanova.agent.cleaning.ColumnCoercion;
import com.di.schemanova.agent.cleaning.ColumnType;
import com.di.schemanova.agent.cleaning.Dataset;
import com.di.schemanova.config.InferenceProperties;
import com.di.schemanova.util.TypeConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Stage 2: computes one {@link ColumnProfile} per column of a canonical dataset.
 * Side-effect free; ratios are 0 whenever their denominator is 0.
 */
@Slf4j
@Component
public class ColumnProfiler {

    private final InferenceProperties.Profiler config;
    private final List<SemanticTypeRule> rules;

    public ColumnProfiler(InferenceProperties properties) {
        this.config = properties.getProfiler();
        this.rules = List.of(
                new SemanticTypeRule("boolean-storage",
                        s -> s.storageType() == ColumnType.BOOLEAN, SemanticType.BOOLEAN),
                new SemanticTypeRule("numeric-storage",
                        s -> s.storageType() == ColumnType.NUMERIC, SemanticType.NUMERIC),
                new SemanticTypeRule("date-tagged",
                        s -> s.storageType() == ColumnType.DATE, SemanticType.DATE),
                new SemanticTypeRule("short-unique-text",
                        s -> s.nonMissingCount() > 0
                                && s.distinctRatio() >= config.getIdentifierDistinctRatio()
                                && s.avgTextLength() <= config.getIdentifierMaxAvgLength(),
                        SemanticType.IDENTIFIER),
                new SemanticTypeRule("fallback", s -> true, SemanticType.TEXT));
    }

    /**
     * Profiles every column of a cleaned dataset, carrying the cleaning notes into the profiles.
     */
    public List<ColumnProfile> profile(CleaningResult cleaned) {
        Dataset dataset = cleaned.getDataset();
        List<ColumnProfile> profiles = new ArrayList<>(dataset.columnCount());
        for (int c = 0; c < dataset.columnCount(); c++) {
            String column = dataset.getColumns().get(c);
            String note = cleaned.coercionFor(column).map(ColumnCoercion::describe).orElse(null);
            profiles.add(profileColumn(dataset, c, note));
        }
        log.info("[PROFILER] dataset={} profiled {} column(s)", dataset.getName(), profiles.size());
        return Collections.unmodifiableList(profiles);
    }

    /**
     * Profiles every column of a canonical dataset without cleaning notes.
     */
    public List<ColumnProfile> profile(Dataset dataset) {
        List<ColumnProfile> profiles = new ArrayList<>(dataset.columnCount());
        for (int c = 0; c < dataset.columnCount(); c++) {
            profiles.add(profileColumn(dataset, c, null));
        }
        return Collections.unmodifiableList(profiles);
    }

    /** Applies the ordered rule list; the first matching rule wins. */
    SemanticType decideSemanticType(ColumnStats stats) {
        for (SemanticTypeRule rule : rules) {
            if (rule.matches(stats)) {
                return rule.outcome();
            }
        }
        return SemanticType.TEXT;
    }

    private ColumnProfile profileColumn(Dataset dataset, int c, String coercionNote) {
        String column = dataset.getColumns().get(c);
        ColumnType storageType = dataset.getColumnTypes().get(c);
        long rowCount = dataset.rowCount();

        long missing = 0;
        long textLength = 0;
        Set<Object> distinct = new LinkedHashSet<>();
        BigDecimal min = null;
        BigDecimal max = null;
        BigDecimal sum = BigDecimal.ZERO;
        for (List<Object> row : dataset.getRows()) {
            Object v = row.get(c);
            if (v == null) {
                missing++;
                continue;
            }
            distinct.add(v);
            textLength += TypeConverter.toText(v).length();
            if (v instanceof BigDecimal) {
                BigDecimal n = (BigDecimal) v;
                min = min == null || n.compareTo(min) < 0 ? n : min;
                max = max == null || n.compareTo(max) > 0 ? n : max;
                sum = sum.add(n);
            }
        }
        long nonMissing = rowCount - missing;
        double missingRatio = ratio(missing, rowCount);
        double distinctRatio = ratio(distinct.size(), nonMissing);
        double avgTextLength = nonMissing == 0 ? 0.0 : (double) textLength / nonMissing;

        ColumnStats stats = new ColumnStats(storageType, rowCount, nonMissing, distinct.size(), distinctRatio, avgTextLength);
        SemanticType semanticType = decideSemanticType(stats);

        List<Object> samples = new ArrayList<>();
        for (Object v : distinct) {
            if (samples.size() >= config.getSampleSize()) break;
            samples.add(v);
        }

        boolean numeric = storageType == ColumnType.NUMERIC && nonMissing > 0;
        return ColumnProfile.builder()
                .datasetName(dataset.getName())
                .columnName(column)
                .position(c)
                .storageType(storageType)
                .semanticType(semanticType)
                .rowCount(rowCount)
                .missingCount(missing)
                .nonMissingCount(nonMissing)
                .missingRatio(missingRatio)
                .distinctCount(distinct.size())
                .distinctRatio(distinctRatio)
                .avgTextLength(avgTextLength)
                .sampleValues(Collections.unmodifiableList(samples))
                .numericMin(numeric ? min : null)
                .numericMax(numeric ? max : null)
                .numericMean(numeric ? sum.divide(BigDecimal.valueOf(nonMissing), MathContext.DECIMAL64).doubleValue() : null)
                .coercionNote(coercionNote)
                .build();
    }

    static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }
}
