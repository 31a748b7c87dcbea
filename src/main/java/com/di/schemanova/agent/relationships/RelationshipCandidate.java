package com.di.schemanova.agent.relationships;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A scored, advisory join link between a column of one dataset and a column of another.
 * Source and target are always different datasets.
 */
@Value
@Builder
public class RelationshipCandidate {
    String sourceDataset;
    List<String> sourceColumns;
    String targetDataset;
    List<String> targetColumns;
    /** Weighted combination of name similarity and value overlap, in [0, 1]. */
    double matchStrength;
    double nameSimilarity;
    /** Share of the source's distinct values found in the target. */
    double sourceOverlap;
    /** Share of the target's distinct values found in the source. */
    double targetOverlap;
    Directionality directionality;
    RelationshipCardinality cardinality;

    /** Dataset on the "one" side, or null when undetermined. */
    public String getOneSideDataset() {
        switch (directionality) {
            case SOURCE_IS_ONE_SIDE:
                return sourceDataset;
            case TARGET_IS_ONE_SIDE:
                return targetDataset;
            default:
                return null;
        }
    }
}
