package com.di.schemanova.agent.relationships;

import com.di.schemanova.agent.roles.TableRole;
import lombok.Value;

import java.util.List;

/**
 * A dataset as a node of the relationship graph.
 */
@Value
public class GraphNode {
    String dataset;
    TableRole role;
    long rowCount;
    List<String> columns;
}
