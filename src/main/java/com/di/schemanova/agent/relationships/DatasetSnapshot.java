package com.di.schemanova.agent.relationships;

import com.di.schemanova.agent.cleaning.Dataset;
import com.di.schemanova.agent.keys.KeyCandidate;
import com.di.schemanova.agent.profiler.ColumnProfile;
import com.di.schemanova.agent.roles.TableRole;

import java.util.List;

/**
 * Everything the relationship stage needs to know about one analysed dataset.
 */
public record DatasetSnapshot(Dataset dataset,
                              List<ColumnProfile> profiles,
                              List<KeyCandidate> keyCandidates,
                              TableRole role) {

    public String name() {
        return dataset.getName();
    }

    /** True when the column is a single-column key candidate of this dataset. */
    public boolean isKeyColumn(String column) {
        return keyCandidates.stream().anyMatch(k -> k.isSingleColumn(column));
    }
}
