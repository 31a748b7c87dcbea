package com.di.schemanova.agent.inference;

import com.di.schemanova.model.AnalysisResult;

import java.util.List;
import java.util.Optional;

/**
 * Keeps finished analysis runs so the display layer can fetch them by run id.
 */
public interface AnalysisStore {

    /**
     * @return the run id that was stored, or null when the result carries none
     */
    String save(AnalysisResult result);

    Optional<AnalysisResult> findByRunId(String runId);

    /**
     * Most recent runs first.
     *
     * @param limit max number of results
     */
    List<AnalysisResult> findRecent(int limit);
}
