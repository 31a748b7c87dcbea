package com.di.schemanova.agent.dictionary;

import com.di.schemanova.agent.profiler.SemanticType;
import lombok.Builder;
import lombok.Value;

/**
 * One human-readable line of the data dictionary. Regenerated wholesale on each run.
 */
@Value
@Builder
public class DataDictionaryEntry {
    String datasetName;
    String columnName;
    SemanticType semanticType;
    /** Short role guess, e.g. "likely identifier". */
    String roleDescription;
    String uniquenessNote;
    String sampleNote;
    boolean keyCandidate;

    long missingCount;
    double missingRatio;
    long distinctCount;
    double distinctRatio;
}
