package com.di.schemanova.agent.roles;

public enum TableRole {
    /** Mostly numeric measurements, typically many rows. */
    FACT,
    /** Keyed descriptive attributes. */
    DIMENSION,
    /** Small lookup list without a reliable key. */
    REFERENCE,
    UNCLASSIFIED
}
