package com.di.schemanova.agent.relationships;

/**
 * Which end of a candidate link looks like the "one" side of a one-to-many relationship.
 */
public enum Directionality {
    SOURCE_IS_ONE_SIDE,
    TARGET_IS_ONE_SIDE,
    /** Neither column, or both, is a key candidate of its dataset. */
    UNDETERMINED
}
