package com.di.schemanova.agent.inference;

import com.di.schemanova.agent.dictionary.DataDictionaryEntry;
import com.di.schemanova.agent.inference.dto.AnalyzeRequest;
import com.di.schemanova.agent.relationships.RelationshipGraph;
import com.di.schemanova.exception.RunNotFoundException;
import com.di.schemanova.model.AnalysisResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API for schema inference. Results stay available by run id for the display layer
 * (diagram renderer, dictionary and quality views) until they expire from the store.
 */
@RestController
@RequestMapping("/api/schema")
@RequiredArgsConstructor
public class SchemaInferenceController {

    private final SchemaInferenceService inferenceService;
    private final AnalysisStore analysisStore;

    /**
     * Runs the full pipeline on the posted datasets.
     */
    @PostMapping(value = "/analyze", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AnalysisResult> analyze(@Valid @RequestBody AnalyzeRequest request) {
        return ResponseEntity.ok(inferenceService.analyze(request.toRawDatasets()));
    }

    @GetMapping(value = "/runs/{runId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AnalysisResult> run(@PathVariable String runId) {
        return ResponseEntity.ok(findRun(runId));
    }

    /**
     * Run ids of the most recent runs with their per-dataset states.
     */
    @GetMapping(value = "/runs", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<Map<String, Object>>> recent(
            @RequestParam(required = false, defaultValue = "10") int limit) {
        List<Map<String, Object>> runs = analysisStore.findRecent(Math.min(limit, 100)).stream()
                .map(r -> Map.<String, Object>of(
                        "runId", r.getRunId(),
                        "completedAt", r.getCompletedAt(),
                        "statuses", r.getStatuses()))
                .toList();
        return ResponseEntity.ok(runs);
    }

    @GetMapping(value = "/runs/{runId}/graph", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RelationshipGraph> graph(@PathVariable String runId) {
        return ResponseEntity.ok(findRun(runId).getRelationshipGraph());
    }

    @GetMapping(value = "/runs/{runId}/dictionary/{dataset}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<DataDictionaryEntry>> dictionary(@PathVariable String runId,
                                                                @PathVariable String dataset) {
        List<DataDictionaryEntry> entries = findRun(runId).dictionaryOf(dataset)
                .orElseThrow(() -> new RunNotFoundException(
                        "Dataset '" + dataset + "' has no dictionary in run " + runId));
        return ResponseEntity.ok(entries);
    }

    private AnalysisResult findRun(String runId) {
        return analysisStore.findByRunId(runId)
                .orElseThrow(() -> new RunNotFoundException("Analysis run not found: " + runId));
    }
}
