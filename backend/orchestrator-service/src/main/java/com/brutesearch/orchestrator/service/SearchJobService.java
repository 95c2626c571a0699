package com.brutesearch.orchestrator.service;

import com.brutesearch.orchestrator.config.OrchestratorProperties;
import com.brutesearch.orchestrator.dto.ResultRecord;
import com.brutesearch.orchestrator.dto.SearchJobResult;
import com.brutesearch.orchestrator.dto.SearchResponse;
import com.brutesearch.orchestrator.dto.SourceOutcome;
import com.brutesearch.orchestrator.entity.ErrorKind;
import com.brutesearch.orchestrator.entity.MergeStrategy;
import com.brutesearch.orchestrator.service.buffer.ResultBuffer;
import com.brutesearch.orchestrator.service.checkpoint.CheckpointManager;
import com.brutesearch.orchestrator.service.checkpoint.CheckpointStore;
import com.brutesearch.orchestrator.service.checkpoint.ResumeInfo;
import com.brutesearch.orchestrator.service.sink.ResultSink;
import com.brutesearch.orchestrator.service.source.Source;
import com.brutesearch.orchestrator.service.source.SourceCallListener;
import com.brutesearch.orchestrator.service.source.SourceCallResult;
import com.brutesearch.orchestrator.service.source.SourceRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Checkpointed search jobs.
 *
 * <p>A job runs its sources through the {@link SearchOrchestrator} (DEDUP merge). Each source
 * that finishes is written to the job's checkpoint straight away, and its newly admitted
 * records go to the {@link ResultSink}. Running the same job id again skips every source the
 * checkpoint already has as completed or failed. The checkpoint is removed once every source
 * has an outcome; a job deadline or breaker skip leaves it in place for a later resume.
 */
@Service
@Slf4j
public class SearchJobService {

    private static final DateTimeFormatter JOB_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final SearchOrchestrator orchestrator;
    private final SourceRegistry sourceRegistry;
    private final CheckpointStore checkpointStore;
    private final ResultSink resultSink;
    private final OrchestratorProperties properties;
    private final Clock clock;

    public SearchJobService(SearchOrchestrator orchestrator,
                            SourceRegistry sourceRegistry,
                            CheckpointStore checkpointStore,
                            ResultSink resultSink,
                            OrchestratorProperties properties,
                            Clock clock) {
        this.orchestrator = orchestrator;
        this.sourceRegistry = sourceRegistry;
        this.checkpointStore = checkpointStore;
        this.resultSink = resultSink;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Starts a new job, or resumes {@code jobId} if a checkpoint for it exists.
     */
    public Mono<SearchJobResult> run(String jobId, String query, List<String> sourceCodes) {
        String id = jobId != null && !jobId.isBlank() ? jobId : newJobId();
        if (!CheckpointStore.isValidJobId(id)) {
            return Mono.error(new IllegalArgumentException("Invalid job id: " + id));
        }
        List<String> codes = new ArrayList<>(new LinkedHashSet<>(sourceCodes));

        return Mono.fromCallable(() -> openCheckpoint(id, query, codes))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(checkpoint -> execute(checkpoint, query, codes));
    }

    private CheckpointManager openCheckpoint(String jobId, String query, List<String> codes) {
        CheckpointManager checkpoint = CheckpointManager.open(jobId, checkpointStore,
                properties.getCheckpoint().getSaveEvery(), clock);
        if (checkpoint.isResumed()) {
            log.info("Resuming job {}: {}", jobId, checkpoint.progressSummary());
        }
        checkpoint.updateQueryInfo(query, codes);
        return checkpoint;
    }

    private Mono<SearchJobResult> execute(CheckpointManager checkpoint, String query, List<String> codes) {
        String jobId = checkpoint.getJobId();
        List<String> skipped = new ArrayList<>();
        List<Source> toRun = new ArrayList<>();
        Map<String, SourceOutcome> unknownOutcomes = new LinkedHashMap<>();

        for (String code : codes) {
            if (!checkpoint.shouldResumeEngine(code)) {
                skipped.add(code);
                continue;
            }
            Optional<Source> source = sourceRegistry.find(code);
            if (source.isPresent()) {
                toRun.add(source.get());
                checkpoint.addPendingQueries(code, List.of(query));
            } else {
                log.warn("Job {} requested unknown source {}", jobId, code);
                unknownOutcomes.put(code, SourceOutcome.failed(code, ErrorKind.UNKNOWN, "unknown source", 0));
                checkpoint.markEngineFailed(code, "unknown source");
            }
        }
        if (!skipped.isEmpty()) {
            log.info("Job {} skipping {} sources finished in a previous run: {}", jobId, skipped.size(), skipped);
        }

        ResumeInfo before = checkpoint.getResumeInfo();
        ResultBuffer jobResults = new ResultBuffer(properties.getBuffer().getMaxSize());
        int maxResults = properties.getJob().getMaxResultsPerSource();

        SourceCallListener progress = new SourceCallListener() {
            @Override
            public void onSourceStarted(String sourceCode) {
                checkpoint.markEngineStarted(sourceCode);
            }

            @Override
            public void onSourceFinished(SourceCallResult result) {
                SearchJobService.this.onSourceFinished(checkpoint, jobResults, query, result);
            }
        };

        return orchestrator.search(jobId, toRun, query, maxResults, MergeStrategy.DEDUP, progress)
                .publishOn(Schedulers.boundedElastic())
                .map(response -> finish(checkpoint, before, response, skipped, toRun, unknownOutcomes, jobResults));
    }

    private void onSourceFinished(CheckpointManager checkpoint, ResultBuffer jobResults, String query,
                                  SourceCallResult result) {
        String code = result.sourceCode();
        if (!result.isSuccess()) {
            checkpoint.markEngineFailed(code, result.errorKind().getCode() + ": " + result.error());
            return;
        }

        List<ResultRecord> admitted = new ArrayList<>();
        for (ResultRecord record : result.records()) {
            if (jobResults.add(record)) {
                admitted.add(record);
            }
        }
        checkpoint.markQueryCompleted(code, query, result.records().size());
        checkpoint.markEngineCompleted(code, result.records().size());
        pushToSink(checkpoint.getJobId(), code, admitted);
    }

    /**
     * Fire-and-forget: a sink failure is logged and the job carries on.
     */
    private void pushToSink(String jobId, String code, List<ResultRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        Mono.fromRunnable(() -> {
                    try {
                        resultSink.accept(jobId, records);
                    } catch (Exception e) {
                        throw new IllegalStateException(e.getMessage(), e);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        ignored -> { },
                        e -> log.warn("Result sink rejected {} records from {} for job {}: {}",
                                records.size(), code, jobId, e.getMessage()));
    }

    private SearchJobResult finish(CheckpointManager checkpoint, ResumeInfo before, SearchResponse response,
                                   List<String> skipped, List<Source> attempted,
                                   Map<String, SourceOutcome> unknownOutcomes, ResultBuffer jobResults) {
        checkpoint.updateResultCounts(before.resultsCount() + response.getStatistics().getTotalResults(),
                before.uniqueUrls() + jobResults.size());

        Map<String, SourceOutcome> outcomes = new LinkedHashMap<>(response.getPerSourceOutcome());
        outcomes.putAll(unknownOutcomes);

        ResumeInfo resumeInfo = checkpoint.getResumeInfo();
        boolean clean = !response.isTimedOut() && resumeInfo.pendingEngines().isEmpty();
        String summary = checkpoint.progressSummary();
        if (clean) {
            checkpoint.cleanup();
        } else {
            checkpoint.save();
            log.info("Job {} left resumable: {}", checkpoint.getJobId(), summary);
        }

        return SearchJobResult.builder()
                .jobId(checkpoint.getJobId())
                .query(response.getQuery())
                .resumed(checkpoint.isResumed())
                .skippedSources(skipped)
                .attemptedSources(attempted.stream().map(Source::getCode).toList())
                .perSourceOutcome(outcomes)
                .results(response.getResults())
                .statistics(response.getStatistics())
                .timedOut(response.isTimedOut())
                .checkpointCleared(clean)
                .progressSummary(summary)
                .build();
    }

    /**
     * Resume information for a stored job, or empty when no checkpoint exists.
     */
    public Optional<ResumeInfo> findCheckpoint(String jobId) {
        if (!CheckpointStore.isValidJobId(jobId) || !checkpointStore.exists(jobId)) {
            return Optional.empty();
        }
        CheckpointManager checkpoint = CheckpointManager.open(jobId, checkpointStore,
                properties.getCheckpoint().getSaveEvery(), clock);
        return checkpoint.isResumed() ? Optional.of(checkpoint.getResumeInfo()) : Optional.empty();
    }

    private String newJobId() {
        return "search_" + JOB_ID_FORMAT.format(clock.instant()) + "_"
                + UUID.randomUUID().toString().substring(0, 8);
    }
}
