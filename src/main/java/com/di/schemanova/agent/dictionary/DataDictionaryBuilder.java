package com.di.schemanova.agent.dictionary;

import com.di.schemanova.agent.keys.KeyCandidate;
import com.di.schemanova.agent.profiler.ColumnProfile;
import com.di.schemanova.agent.profiler.SemanticType;
import com.di.schemanova.config.InferenceProperties;
import com.di.schemanova.util.TypeConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Stage 6: one dictionary entry per column, from the column's profile and the dataset's
 * key candidates. Stateless; always produces an entry.
 */
@Slf4j
@Component
public class DataDictionaryBuilder {

    private static final Set<String> IDENTIFIER_TOKENS = Set.of("id", "code", "key", "uuid", "guid");
    private static final String FALLBACK = "attribute with no strong signal";

    private final List<DescriptionRule> rules;

    public DataDictionaryBuilder(InferenceProperties properties) {
        double categorical = properties.getDictionary().getCategoricalDistinctRatio();
        this.rules = List.of(
                new DescriptionRule(c -> c.profile().getNonMissingCount() == 0, "empty column; no signal"),
                new DescriptionRule(Column::keyed, "likely identifier (primary key candidate)"),
                new DescriptionRule(c -> c.type() == SemanticType.IDENTIFIER || looksLikeIdentifierName(c.profile().getColumnName()),
                        "likely identifier"),
                new DescriptionRule(c -> c.type() == SemanticType.DATE, "likely date/time attribute"),
                new DescriptionRule(c -> c.type() == SemanticType.BOOLEAN, "likely flag"),
                new DescriptionRule(c -> c.type() == SemanticType.NUMERIC, "likely measure"),
                new DescriptionRule(c -> c.type() == SemanticType.TEXT && c.profile().getDistinctRatio() < categorical,
                        "likely categorical attribute"),
                new DescriptionRule(c -> c.type() == SemanticType.TEXT, "likely descriptive attribute"));
    }

    public List<DataDictionaryEntry> build(List<ColumnProfile> profiles, List<KeyCandidate> keyCandidates) {
        List<KeyCandidate> keys = keyCandidates == null ? List.of() : keyCandidates;
        List<DataDictionaryEntry> entries = new ArrayList<>(profiles.size());
        for (ColumnProfile p : profiles) {
            boolean keyed = keys.stream().anyMatch(k -> k.isSingleColumn(p.getColumnName()));
            Column column = new Column(p, keyed);
            entries.add(DataDictionaryEntry.builder()
                    .datasetName(p.getDatasetName())
                    .columnName(p.getColumnName())
                    .semanticType(p.getSemanticType())
                    .roleDescription(describe(column))
                    .uniquenessNote(uniquenessNote(p))
                    .sampleNote(sampleNote(p))
                    .keyCandidate(keyed)
                    .missingCount(p.getMissingCount())
                    .missingRatio(p.getMissingRatio())
                    .distinctCount(p.getDistinctCount())
                    .distinctRatio(p.getDistinctRatio())
                    .build());
        }
        if (!entries.isEmpty()) {
            log.debug("[DICTIONARY] dataset={} entries={}", entries.get(0).getDatasetName(), entries.size());
        }
        return Collections.unmodifiableList(entries);
    }

    private String describe(Column column) {
        for (DescriptionRule rule : rules) {
            if (rule.predicate().test(column)) {
                return rule.description();
            }
        }
        return FALLBACK;
    }

    static boolean looksLikeIdentifierName(String name) {
        if (name == null) return false;
        String spaced = name.replaceAll("([a-z0-9])([A-Z])", "$1 $2");
        for (String token : spaced.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (IDENTIFIER_TOKENS.contains(token)) return true;
        }
        return false;
    }

    private static String uniquenessNote(ColumnProfile p) {
        if (p.getNonMissingCount() == 0) {
            return "no values";
        }
        String note = p.isFullyUnique()
                ? "unique across all " + p.getRowCount() + " rows"
                : String.format(Locale.ROOT, "%d distinct of %d non-missing (%.1f%%)",
                        p.getDistinctCount(), p.getNonMissingCount(), p.getDistinctRatio() * 100);
        if (p.getMissingCount() > 0) {
            note += String.format(Locale.ROOT, ", %d missing (%.1f%%)", p.getMissingCount(), p.getMissingRatio() * 100);
        }
        return note;
    }

    private static String sampleNote(ColumnProfile p) {
        if (p.getSampleValues() == null || p.getSampleValues().isEmpty()) {
            return "no sample values";
        }
        return "e.g. " + p.getSampleValues().stream()
                .map(TypeConverter::toText)
                .collect(Collectors.joining(", "));
    }

    private record Column(ColumnProfile profile, boolean keyed) {
        SemanticType type() {
            return profile.getSemanticType();
        }
    }

    private record DescriptionRule(Predicate<Column> predicate, String description) {
    }
}
