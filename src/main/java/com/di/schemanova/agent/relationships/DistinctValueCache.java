package com.di.schemanova.agent.relationships;

import com.di.schemanova.agent.cleaning.Dataset;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Memoizes the distinct non-missing value set of each (dataset, column) so that every set is
 * materialized once per session instead of once per table-pair comparison.
 * Unbounded: the key space is limited by the session's dataset and column counts.
 */
final class DistinctValueCache {

    private final Cache<ColumnRef, Set<Object>> cache = Caffeine.newBuilder().build();

    Set<Object> distinctValues(Dataset dataset, String column) {
        return cache.get(new ColumnRef(dataset.getName(), column), ref -> materialize(dataset, column));
    }

    long size() {
        return cache.estimatedSize();
    }

    private static Set<Object> materialize(Dataset dataset, String column) {
        List<Object> values = dataset.columnValues(column);
        Set<Object> distinct = new HashSet<>();
        for (Object v : values) {
            if (v != null) distinct.add(v);
        }
        return Collections.unmodifiableSet(distinct);
    }

    record ColumnRef(String dataset, String column) {
    }
}
