package com.di.schemanova.model;

import lombok.Value;

import java.util.List;

/**
 * Outcome of one dataset within an analysis run.
 * <ul>
 *   <li>{@code OK}: all stages ran with full signal</li>
 *   <li>{@code DEGRADED}: all stages ran, but some issue was recorded</li>
 *   <li>{@code FAILED}: the dataset was skipped; other datasets are unaffected</li>
 * </ul>
 */
@Value
public class DatasetStatus {

    public enum State { OK, DEGRADED, FAILED }

    String datasetName;
    State state;
    List<DatasetIssue> issues;

    public static DatasetStatus failed(String datasetName, DatasetIssue issue) {
        return new DatasetStatus(datasetName, State.FAILED, List.of(issue));
    }

    public static DatasetStatus of(String datasetName, List<DatasetIssue> issues) {
        return new DatasetStatus(datasetName, issues.isEmpty() ? State.OK : State.DEGRADED, List.copyOf(issues));
    }

    public boolean isFailed() {
        return state == State.FAILED;
    }
}
