package com.di.schemanova.model;

import com.di.schemanova.agent.cleaning.Dataset;
import com.di.schemanova.agent.dictionary.DataDictionaryEntry;
import com.di.schemanova.agent.keys.KeyCandidate;
import com.di.schemanova.agent.profiler.ColumnProfile;
import com.di.schemanova.agent.quality.QualityReport;
import com.di.schemanova.agent.relationships.RelationshipGraph;
import com.di.schemanova.agent.roles.TableRoleAssignment;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything one analysis run produced. All per-dataset maps iterate in input order; a
 * failed dataset appears only in {@link #statuses}.
 */
@Value
@Builder
public class AnalysisResult {
    String runId;
    Instant startedAt;
    Instant completedAt;
    Map<String, DatasetStatus> statuses;
    Map<String, Dataset> canonicalTables;
    Map<String, List<ColumnProfile>> profiles;
    Map<String, List<KeyCandidate>> keyCandidates;
    Map<String, TableRoleAssignment> roles;
    Map<String, QualityReport> qualityReports;
    RelationshipGraph relationshipGraph;
    Map<String, List<DataDictionaryEntry>> dictionaries;
    /** Session-level problems, e.g. relationship detection could not run. */
    List<String> sessionWarnings;

    public Optional<List<DataDictionaryEntry>> dictionaryOf(String dataset) {
        return Optional.ofNullable(dictionaries.get(dataset));
    }

    public long failedCount() {
        return statuses.values().stream().filter(DatasetStatus::isFailed).count();
    }
}
