package com.di.schemanova.agent.roles;

import com.di.schemanova.agent.keys.KeyCandidate;
import com.di.schemanova.agent.profiler.ColumnProfile;
import com.di.schemanova.agent.profiler.SemanticType;
import com.di.schemanova.config.InferenceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Stage 4: labels a dataset fact, dimension, reference or unclassified.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>few rows and no confident key: reference</li>
 *   <li>mostly numeric, enough rows, and no confident key spanning the whole row: fact</li>
 *   <li>confident key and few numeric columns: dimension</li>
 *   <li>otherwise unclassified, naming the inconclusive signals</li>
 * </ol>
 * Advisory only. Never throws for a well-formed profile list; the worst case is
 * {@link TableRole#UNCLASSIFIED}.
 */
@Slf4j
@Component
public class TableRoleClassifier {

    private final InferenceProperties.Roles config;
    private final double confidentUniqueness;
    private final List<RoleRule> rules;

    public TableRoleClassifier(InferenceProperties properties) {
        this.config = properties.getRoles();
        this.confidentUniqueness = properties.getKeys().getHighConfidenceUniqueness();
        this.rules = List.of(
                new RoleRule("small-unkeyed",
                        s -> s.rowCount() < config.getReferenceRowFloor() && !s.hasConfidentKey(),
                        TableRole.REFERENCE,
                        s -> "Only " + s.rowCount() + " row(s) and no confident key; looks like a lookup list"),
                new RoleRule("numeric-heavy",
                        s -> s.numericRatio() > config.getFactNumericRatio()
                                && s.rowCount() >= config.getFactRowFloor()
                                && !s.confidentKeyCoversWholeRow(),
                        TableRole.FACT,
                        s -> String.format("%.0f%% numeric columns over %d rows; measurements table",
                                s.numericRatio() * 100, s.rowCount())),
                new RoleRule("keyed-descriptive",
                        s -> s.hasConfidentKey() && s.numericRatio() <= config.getDimensionMaxNumericRatio(),
                        TableRole.DIMENSION,
                        s -> String.format("Confident unique key with %.0f%% numeric columns; descriptive attributes",
                                s.numericRatio() * 100)));
    }

    public TableRoleAssignment classify(String datasetName, List<ColumnProfile> profiles, List<KeyCandidate> keys) {
        RoleSignals signals = signals(profiles, keys);
        for (RoleRule rule : rules) {
            if (rule.predicate().test(signals)) {
                log.info("[ROLES] dataset={} role={} rule={} ({})", datasetName, rule.role(), rule.name(), signals.describe());
                return new TableRoleAssignment(datasetName, rule.role(), rule.rationale().apply(signals));
            }
        }
        String rationale = "Inconclusive: " + String.join("; ", inconclusive(signals));
        log.info("[ROLES] dataset={} role=UNCLASSIFIED ({})", datasetName, signals.describe());
        return new TableRoleAssignment(datasetName, TableRole.UNCLASSIFIED, rationale);
    }

    RoleSignals signals(List<ColumnProfile> profiles, List<KeyCandidate> keys) {
        List<ColumnProfile> cols = profiles == null ? List.of() : profiles;
        List<KeyCandidate> candidates = keys == null ? List.of() : keys;

        long rowCount = cols.isEmpty() ? 0 : cols.get(0).getRowCount();
        int numeric = 0;
        int nonNumeric = 0;
        double nonNumericDistinct = 0.0;
        Set<String> allColumns = new HashSet<>();
        for (ColumnProfile p : cols) {
            allColumns.add(p.getColumnName());
            if (p.getSemanticType() == SemanticType.NUMERIC) {
                numeric++;
            } else {
                nonNumeric++;
                nonNumericDistinct += p.getDistinctRatio();
            }
        }

        boolean confident = false;
        boolean coversRow = false;
        for (KeyCandidate k : candidates) {
            if (k.isConfident(confidentUniqueness)) {
                confident = true;
                if (!allColumns.isEmpty() && new HashSet<>(k.getColumns()).containsAll(allColumns)) {
                    coversRow = true;
                }
            }
        }
        double numericRatio = cols.isEmpty() ? 0.0 : (double) numeric / cols.size();
        double avgDistinct = nonNumeric == 0 ? 0.0 : nonNumericDistinct / nonNumeric;
        return new RoleSignals(rowCount, cols.size(), numericRatio, confident, coversRow, avgDistinct);
    }

    private List<String> inconclusive(RoleSignals s) {
        List<String> reasons = new ArrayList<>();
        if (!s.hasConfidentKey()) {
            reasons.add("no confident key");
        }
        if (s.numericRatio() > config.getFactNumericRatio() && s.rowCount() < config.getFactRowFloor()) {
            reasons.add("numeric-heavy but only " + s.rowCount() + " rows (fact floor " + config.getFactRowFloor() + ")");
        } else if (s.numericRatio() > config.getFactNumericRatio() && s.confidentKeyCoversWholeRow()) {
            reasons.add("numeric-heavy but the key spans every column");
        } else if (s.numericRatio() <= config.getFactNumericRatio()) {
            reasons.add(String.format("numeric ratio %.2f too low for a fact table", s.numericRatio()));
        }
        if (s.hasConfidentKey() && s.numericRatio() > config.getDimensionMaxNumericRatio()) {
            reasons.add(String.format("numeric ratio %.2f too high for a dimension", s.numericRatio()));
        }
        reasons.add(String.format("average non-numeric distinct ratio %.2f", s.avgNonNumericDistinctRatio()));
        return reasons;
    }
}
