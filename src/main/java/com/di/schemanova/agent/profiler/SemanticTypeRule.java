package com.di.schemanova.agent.profiler;

import java.util.function.Predicate;

/**
 * One entry of the ordered semantic-type decision list: the first rule whose predicate
 * accepts the column statistics decides the type.
 */
record SemanticTypeRule(String name, Predicate<ColumnStats> predicate, SemanticType outcome) {

    boolean matches(ColumnStats stats) {
        return predicate.test(stats);
    }
}
