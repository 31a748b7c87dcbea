package com.di.schemanova.agent.roles;

import lombok.Value;

/**
 * The single role currently assigned to a dataset, with a short rationale.
 */
@Value
public class TableRoleAssignment {
    String datasetName;
    TableRole role;
    String rationale;
}
