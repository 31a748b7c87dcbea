package com.di.schemanova.agent.inference.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One dataset as parsed by the caller: column names plus rows of scalar values.
 * An empty column list is accepted here and reported as a shape error on the dataset.
 */
@Data
@Builder
@Jacksonized
public class DatasetPayload {

    @NotNull(message = "columns must be provided")
    private List<String> columns;

    /** Missing rows mean an empty dataset. */
    private List<List<Object>> rows;
}
