package com.di.schemanova.agent.relationships;

import lombok.Value;

import java.util.List;

/**
 * Nodes are datasets, edges are relationship candidates. No self-loops, and at most one
 * edge per unordered column pair. Consumed as-is by diagram renderers.
 */
@Value
public class RelationshipGraph {
    List<GraphNode> nodes;
    /** Sorted by match strength descending. */
    List<RelationshipCandidate> edges;
    /** Column pairs skipped because of an unexpected error. */
    List<String> warnings;

    public static RelationshipGraph empty() {
        return new RelationshipGraph(List.of(), List.of(), List.of());
    }

    /** Edges touching the given dataset on either end. */
    public List<RelationshipCandidate> edgesOf(String dataset) {
        return edges.stream()
                .filter(e -> e.getSourceDataset().equals(dataset) || e.getTargetDataset().equals(dataset))
                .toList();
    }
}
