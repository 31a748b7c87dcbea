package com.di.schemanova.agent.inference;

import com.di.schemanova.agent.cleaning.CleaningNormalizer;
import com.di.schemanova.agent.cleaning.CleaningResult;
import com.di.schemanova.agent.cleaning.ColumnCoercion;
import com.di.schemanova.agent.cleaning.Dataset;
import com.di.schemanova.agent.cleaning.RawDataset;
import com.di.schemanova.agent.dictionary.DataDictionaryBuilder;
import com.di.schemanova.agent.dictionary.DataDictionaryEntry;
import com.di.schemanova.agent.keys.KeyCandidate;
import com.di.schemanova.agent.keys.KeyCandidateDetector;
import com.di.schemanova.agent.profiler.ColumnProfile;
import com.di.schemanova.agent.profiler.ColumnProfiler;
import com.di.schemanova.agent.quality.QualityReport;
import com.di.schemanova.agent.quality.QualityReportBuilder;
import com.di.schemanova.agent.relationships.DatasetSnapshot;
import com.di.schemanova.agent.relationships.RelationshipCandidate;
import com.di.schemanova.agent.relationships.RelationshipDetector;
import com.di.schemanova.agent.relationships.RelationshipGraph;
import com.di.schemanova.agent.relationships.SessionSnapshot;
import com.di.schemanova.agent.roles.TableRoleAssignment;
import com.di.schemanova.agent.roles.TableRoleClassifier;
import com.di.schemanova.aspect.LogTransaction;
import com.di.schemanova.config.InferenceProperties;
import com.di.schemanova.exception.ShapeException;
import com.di.schemanova.model.AnalysisResult;
import com.di.schemanova.model.DatasetIssue;
import com.di.schemanova.model.DatasetStatus;
import com.di.schemanova.model.IssueCode;
import com.di.schemanova.util.MdcPropagation;
import com.di.schemanova.util.MetricsCollector;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * Runs one analysis session end to end.
 *
 * <ol>
 *   <li>per dataset: cleaning, profiling, key detection, role classification, quality report
 *       (optionally on a worker pool, gathered in input order)</li>
 *   <li>relationship detection over a read-only snapshot of every dataset that succeeded</li>
 *   <li>data dictionary per dataset</li>
 * </ol>
 * A failure in one dataset never aborts the session: it is recorded on that dataset's
 * {@link DatasetStatus} and the remaining datasets carry on.
 */
@Slf4j
@Service
public class SchemaInferenceService {

    static final String RUN_ID = "runId";
    static final String RUN_ID_PREFIX = "run-";

    private final CleaningNormalizer cleaningNormalizer;
    private final ColumnProfiler columnProfiler;
    private final KeyCandidateDetector keyCandidateDetector;
    private final TableRoleClassifier tableRoleClassifier;
    private final QualityReportBuilder qualityReportBuilder;
    private final RelationshipDetector relationshipDetector;
    private final DataDictionaryBuilder dataDictionaryBuilder;
    private final AnalysisStore analysisStore;
    private final MetricsCollector metricsCollector;
    private final int minRowsForKeys;
    private final ExecutorService workerPool;

    public SchemaInferenceService(CleaningNormalizer cleaningNormalizer,
                                  ColumnProfiler columnProfiler,
                                  KeyCandidateDetector keyCandidateDetector,
                                  TableRoleClassifier tableRoleClassifier,
                                  QualityReportBuilder qualityReportBuilder,
                                  RelationshipDetector relationshipDetector,
                                  DataDictionaryBuilder dataDictionaryBuilder,
                                  AnalysisStore analysisStore,
                                  MetricsCollector metricsCollector,
                                  InferenceProperties properties) {
        this.cleaningNormalizer = cleaningNormalizer;
        this.columnProfiler = columnProfiler;
        this.keyCandidateDetector = keyCandidateDetector;
        this.tableRoleClassifier = tableRoleClassifier;
        this.qualityReportBuilder = qualityReportBuilder;
        this.relationshipDetector = relationshipDetector;
        this.dataDictionaryBuilder = dataDictionaryBuilder;
        this.analysisStore = analysisStore;
        this.metricsCollector = metricsCollector;
        this.minRowsForKeys = properties.getKeys().getMinRowsForKeys();
        InferenceProperties.Execution execution = properties.getExecution();
        this.workerPool = execution.isParallel()
                ? MdcPropagation.wrapExecutor(Executors.newFixedThreadPool(Math.max(1, execution.getWorkerThreads())))
                : null;
    }

    /**
     * Analyses a session of datasets. Map keys are the dataset names and define the output order.
     *
     * @param datasets dataset name to raw dataset; a null value is reported as a shape error
     * @return the stored result, never null
     */
    @LogTransaction(eventType = "SCHEMA_INFERENCE", transactionContext = "schema_inference",
            transactionIdKey = RUN_ID, transactionIdPrefix = RUN_ID_PREFIX, includeResult = true)
    public AnalysisResult analyze(Map<String, RawDataset> datasets) {
        Map<String, RawDataset> input = datasets == null ? Map.of() : datasets;
        // the transaction aspect opens the run id when the call is advised
        String runId = MDC.get(RUN_ID);
        boolean ownsRunId = runId == null;
        if (ownsRunId) {
            runId = RUN_ID_PREFIX + UUID.randomUUID().toString().substring(0, 8);
            MDC.put(RUN_ID, runId);
        }
        Instant startedAt = Instant.now();
        long start = System.currentTimeMillis();
        try {
            log.info("[INFERENCE] run={} started with {} dataset(s), parallel={}", runId, input.size(), workerPool != null);
            List<DatasetAnalysis> analyses = analyseAll(input);

            List<String> sessionWarnings = new ArrayList<>();
            RelationshipGraph graph = detectRelationships(analyses, sessionWarnings);
            AnalysisResult result = assemble(runId, startedAt, analyses, graph, sessionWarnings);

            analysisStore.save(result);
            metricsCollector.recordRun(System.currentTimeMillis() - start);
            log.info("[INFERENCE] run={} completed: datasets={} failed={} relationships={} in {} ms",
                    runId, analyses.size(), result.failedCount(), graph.getEdges().size(),
                    System.currentTimeMillis() - start);
            return result;
        } finally {
            if (ownsRunId) {
                MDC.remove(RUN_ID);
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        if (workerPool != null) {
            workerPool.shutdownNow();
        }
    }

    // ============================================================================
    // Stages 1-4
    // ============================================================================

    private List<DatasetAnalysis> analyseAll(Map<String, RawDataset> input) {
        List<DatasetAnalysis> analyses = new ArrayList<>(input.size());
        if (workerPool == null) {
            input.forEach((name, raw) -> analyses.add(analyseDataset(name, raw)));
            return analyses;
        }

        Map<String, Future<DatasetAnalysis>> futures = new LinkedHashMap<>();
        input.forEach((name, raw) -> futures.put(name, workerPool.submit(() -> analyseDataset(name, raw))));
        for (Map.Entry<String, Future<DatasetAnalysis>> entry : futures.entrySet()) {
            analyses.add(await(entry.getKey(), entry.getValue()));
        }
        return analyses;
    }

    private DatasetAnalysis await(String name, Future<DatasetAnalysis> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[INFERENCE] dataset={} interrupted while waiting for worker", name);
            return failed(name, DatasetIssue.failure(IssueCode.PROCESSING_ERROR, e));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[INFERENCE] dataset={} worker failed", name, cause);
            return failed(name, DatasetIssue.failure(IssueCode.PROCESSING_ERROR, cause));
        }
    }

    /**
     * Stages 1-4 for one dataset. Never throws: every failure becomes a FAILED status.
     */
    DatasetAnalysis analyseDataset(String name, RawDataset raw) {
        try {
            RawDataset named = raw == null ? null : withName(name, raw);
            CleaningResult cleaning = timed("cleaning", () -> cleaningNormalizer.clean(named));
            List<ColumnProfile> profiles = timed("profiling", () -> columnProfiler.profile(cleaning));
            List<KeyCandidate> keys = timed("keys",
                    () -> keyCandidateDetector.detect(cleaning.getDataset(), profiles));
            TableRoleAssignment role = timed("roles", () -> tableRoleClassifier.classify(name, profiles, keys));
            QualityReport quality = timed("quality", () -> qualityReportBuilder.build(cleaning, profiles));

            DatasetStatus status = DatasetStatus.of(name, degradations(cleaning));
            if (status.getState() == DatasetStatus.State.DEGRADED) {
                metricsCollector.recordDatasetDegraded();
                log.info("[INFERENCE] dataset={} degraded: {}", name, status.getIssues());
            } else {
                metricsCollector.recordDatasetOk();
            }
            return new DatasetAnalysis(name, status, cleaning, profiles, keys, role, quality);
        } catch (ShapeException e) {
            log.warn("[INFERENCE] dataset={} skipped: {}", name, e.getMessage());
            return failed(name, DatasetIssue.failure(IssueCode.SHAPE_ERROR, e));
        } catch (RuntimeException e) {
            log.error("[INFERENCE] dataset={} failed unexpectedly", name, e);
            return failed(name, DatasetIssue.failure(IssueCode.PROCESSING_ERROR, e));
        }
    }

    private DatasetAnalysis failed(String name, DatasetIssue issue) {
        metricsCollector.recordDatasetFailed();
        return DatasetAnalysis.failed(DatasetStatus.failed(name, issue));
    }

    private List<DatasetIssue> degradations(CleaningResult cleaning) {
        List<DatasetIssue> issues = new ArrayList<>();
        int rows = cleaning.getDataset().rowCount();
        if (rows < minRowsForKeys) {
            issues.add(DatasetIssue.of(IssueCode.INSUFFICIENT_DATA,
                    rows + " row(s); key detection needs at least " + minRowsForKeys));
        }
        for (ColumnCoercion coercion : cleaning.getCoercions().values()) {
            if (coercion.isNumericAmbiguous()) {
                issues.add(DatasetIssue.ofColumn(IssueCode.TYPE_COERCION_AMBIGUOUS, coercion.getColumn(),
                        coercion.describe()));
            } else if (coercion.getDateParseFailures() > 0) {
                issues.add(DatasetIssue.ofColumn(IssueCode.DATE_PARSE_FAILURES, coercion.getColumn(),
                        coercion.describe()));
            }
        }
        return issues;
    }

    private static RawDataset withName(String name, RawDataset raw) {
        return name.equals(raw.getName()) ? raw : RawDataset.of(name, raw.getColumns(), raw.getRows());
    }

    // ============================================================================
    // Stage 5
    // ============================================================================

    private RelationshipGraph detectRelationships(List<DatasetAnalysis> analyses, List<String> sessionWarnings) {
        List<DatasetSnapshot> snapshots = analyses.stream()
                .filter(DatasetAnalysis::succeeded)
                .map(DatasetAnalysis::snapshot)
                .toList();
        try {
            RelationshipGraph graph = timed("relationships", () -> relationshipDetector.detect(new SessionSnapshot(snapshots)));
            metricsCollector.recordRelationships(graph.getEdges().size());
            graph.getEdges().stream()
                    .map(RelationshipCandidate::getMatchStrength)
                    .forEach(metricsCollector::recordRelationshipStrength);
            return graph;
        } catch (RuntimeException e) {
            log.error("[INFERENCE] relationship detection failed; returning an empty graph", e);
            sessionWarnings.add("Relationship detection failed: "
                    + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            return RelationshipGraph.empty();
        }
    }

    // ============================================================================
    // Stage 6 and assembly
    // ============================================================================

    private AnalysisResult assemble(String runId, Instant startedAt, List<DatasetAnalysis> analyses,
                                    RelationshipGraph graph, List<String> sessionWarnings) {
        Map<String, DatasetStatus> statuses = new LinkedHashMap<>();
        Map<String, Dataset> tables = new LinkedHashMap<>();
        Map<String, List<ColumnProfile>> profiles = new LinkedHashMap<>();
        Map<String, List<KeyCandidate>> keys = new LinkedHashMap<>();
        Map<String, TableRoleAssignment> roles = new LinkedHashMap<>();
        Map<String, QualityReport> quality = new LinkedHashMap<>();
        Map<String, List<DataDictionaryEntry>> dictionaries = new LinkedHashMap<>();

        for (DatasetAnalysis analysis : analyses) {
            String name = analysis.name();
            statuses.put(name, analysis.status());
            if (!analysis.succeeded()) {
                continue;
            }
            tables.put(name, analysis.cleaning().getDataset());
            profiles.put(name, analysis.profiles());
            keys.put(name, analysis.keyCandidates());
            roles.put(name, analysis.role());
            quality.put(name, analysis.quality());
            dictionaries.put(name, timed("dictionary",
                    () -> dataDictionaryBuilder.build(analysis.profiles(), analysis.keyCandidates())));
        }

        return AnalysisResult.builder()
                .runId(runId)
                .startedAt(startedAt)
                .completedAt(Instant.now())
                .statuses(Collections.unmodifiableMap(statuses))
                .canonicalTables(Collections.unmodifiableMap(tables))
                .profiles(Collections.unmodifiableMap(profiles))
                .keyCandidates(Collections.unmodifiableMap(keys))
                .roles(Collections.unmodifiableMap(roles))
                .qualityReports(Collections.unmodifiableMap(quality))
                .relationshipGraph(graph)
                .dictionaries(Collections.unmodifiableMap(dictionaries))
                .sessionWarnings(List.copyOf(sessionWarnings))
                .build();
    }

    private <T> T timed(String stage, Supplier<T> work) {
        long start = System.currentTimeMillis();
        try {
            return work.get();
        } finally {
            metricsCollector.recordStage(stage, System.currentTimeMillis() - start);
        }
    }
}
