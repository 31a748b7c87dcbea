package com.di.schemanova.agent.profiler;

import com.di.schemanova.agent.cleaning.ColumnType;

/**
 * Raw counts gathered in one pass over a column; input to the semantic-type rules.
 */
record ColumnStats(ColumnType storageType,
                   long rowCount,
                   long nonMissingCount,
                   long distinctCount,
                   double distinctRatio,
                   double avgTextLength) {
}
