package com.di.schemanova.agent.relationships;

/**
 * Cardinality hint derived from which sides are keyed.
 */
public enum RelationshipCardinality {
    ONE_TO_ONE,
    MANY_TO_ONE,
    MANY_TO_MANY;

    static RelationshipCardinality of(boolean sourceKeyed, boolean targetKeyed) {
        if (sourceKeyed && targetKeyed) return ONE_TO_ONE;
        if (sourceKeyed || targetKeyed) return MANY_TO_ONE;
        return MANY_TO_MANY;
    }
}
