package com.di.schemanova.agent.relationships;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only view of every successfully analysed dataset of a session, in input order.
 * Built once after the per-dataset stages finish and handed to the relationship stage.
 */
public final class SessionSnapshot {

    private final List<DatasetSnapshot> datasets;

    public SessionSnapshot(List<DatasetSnapshot> datasets) {
        this.datasets = Collections.unmodifiableList(new ArrayList<>(datasets));
    }

    public List<DatasetSnapshot> datasets() {
        return datasets;
    }

    public int size() {
        return datasets.size();
    }
}
