package com.di.schemanova.agent.inference;

import com.di.schemanova.agent.cleaning.CleaningResult;
import com.di.schemanova.agent.keys.KeyCandidate;
import com.di.schemanova.agent.profiler.ColumnProfile;
import com.di.schemanova.agent.quality.QualityReport;
import com.di.schemanova.agent.relationships.DatasetSnapshot;
import com.di.schemanova.agent.roles.TableRoleAssignment;
import com.di.schemanova.model.DatasetStatus;

import java.util.List;

/**
 * Per-dataset output of stages 1-4. Stage outputs are null when the dataset failed.
 */
record DatasetAnalysis(String name,
                       DatasetStatus status,
                       CleaningResult cleaning,
                       List<ColumnProfile> profiles,
                       List<KeyCandidate> keyCandidates,
                       TableRoleAssignment role,
                       QualityReport quality) {

    static DatasetAnalysis failed(DatasetStatus status) {
        return new DatasetAnalysis(status.getDatasetName(), status, null, null, null, null, null);
    }

    boolean succeeded() {
        return !status.isFailed();
    }

    DatasetSnapshot snapshot() {
        return new DatasetSnapshot(cleaning.getDataset(), profiles, keyCandidates, role.getRole());
    }
}
