package com.di.schemanova.agent.profiler;

/**
 * What a column most likely represents, as opposed to how it is stored.
 */
public enum SemanticType {
    NUMERIC,
    TEXT,
    DATE,
    BOOLEAN,
    /** Short, (nearly) unique text values such as codes or UUIDs. */
    IDENTIFIER
}
