package com.di.schemanova.agent.inference.dto;

import com.di.schemanova.agent.cleaning.RawDataset;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inbound request body for {@code POST /api/schema/analyze}.
 */
@Data
@Builder
@Jacksonized
public class AnalyzeRequest {

    /** Dataset name to payload; iteration order is kept in the result. */
    @NotEmpty(message = "at least one dataset is required")
    private Map<String, @Valid DatasetPayload> datasets;

    public Map<String, RawDataset> toRawDatasets() {
        Map<String, RawDataset> raw = new LinkedHashMap<>();
        datasets.forEach((name, payload) -> raw.put(name,
                payload == null ? null : RawDataset.of(name, payload.getColumns(), payload.getRows())));
        return raw;
    }
}
