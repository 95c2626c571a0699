package com.brutesearch.orchestrator.service;

import com.brutesearch.orchestrator.config.OrchestratorProperties;
import com.brutesearch.orchestrator.dto.MergedResult;
import com.brutesearch.orchestrator.dto.ResultRecord;
import com.brutesearch.orchestrator.dto.SearchEvent;
import com.brutesearch.orchestrator.dto.SearchResponse;
import com.brutesearch.orchestrator.dto.SearchStatistics;
import com.brutesearch.orchestrator.dto.SourceOutcome;
import com.brutesearch.orchestrator.entity.ErrorKind;
import com.brutesearch.orchestrator.entity.MergeStrategy;
import com.brutesearch.orchestrator.entity.OutcomeStatus;
import com.brutesearch.orchestrator.service.buffer.ResultBuffer;
import com.brutesearch.orchestrator.service.event.SearchEventPublisher;
import com.brutesearch.orchestrator.service.resilience.HealthRegistry;
import com.brutesearch.orchestrator.service.resilience.RateLimiter;
import com.brutesearch.orchestrator.service.source.Source;
import com.brutesearch.orchestrator.service.source.SourceCallResult;
import com.brutesearch.orchestrator.service.source.SourceCallListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fans one query out to many sources and merges what comes back.
 *
 * <p>Per source: circuit check, rate-limiter permit, per-call timeout, health recording.
 * A failing source never affects the others, and {@link #search} never errors because
 * of a source. When the job deadline passes, outstanding calls are cancelled and
 * reported as {@link OutcomeStatus#TIMEOUT}, and the response is flagged
 * {@code timedOut} next to whatever results had already arrived.
 */
@Service
@Slf4j
public class SearchOrchestrator {

    private final HealthRegistry healthRegistry;
    private final RateLimiter rateLimiter;
    private final SearchEventPublisher eventPublisher;
    private final OrchestratorProperties.Job jobConfig;
    private final int bufferMaxSize;
    private final MeterRegistry meterRegistry;

    public SearchOrchestrator(HealthRegistry healthRegistry,
                              RateLimiter rateLimiter,
                              SearchEventPublisher eventPublisher,
                              OrchestratorProperties properties,
                              MeterRegistry meterRegistry) {
        this.healthRegistry = healthRegistry;
        this.rateLimiter = rateLimiter;
        this.eventPublisher = eventPublisher;
        this.jobConfig = properties.getJob();
        this.bufferMaxSize = properties.getBuffer().getMaxSize();
        this.meterRegistry = meterRegistry;
    }

    public Mono<SearchResponse> search(List<Source> sources, String query, int maxResultsPerSource,
                                       MergeStrategy mergeStrategy) {
        return search(UUID.randomUUID().toString(), sources, query, maxResultsPerSource, mergeStrategy);
    }

    public Mono<SearchResponse> search(String jobId, List<Source> sources, String query,
                                       int maxResultsPerSource, MergeStrategy mergeStrategy) {
        return search(jobId, sources, query, maxResultsPerSource, mergeStrategy, SourceCallListener.NONE);
    }

    /**
     * @param jobId    used to tag progress events
     * @param listener told when each admitted call starts and finishes, before the merged response exists
     */
    public Mono<SearchResponse> search(String jobId, List<Source> sources, String query,
                                       int maxResultsPerSource, MergeStrategy mergeStrategy,
                                       SourceCallListener listener) {
        MergeStrategy strategy = mergeStrategy != null ? mergeStrategy : MergeStrategy.DEDUP;
        List<Source> requested = distinctByCode(sources);

        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            log.info("Starting search job {}: query='{}', sources={}, strategy={}",
                    jobId, query, requested.stream().map(Source::getCode).toList(), strategy);

            Map<String, CallState> states = new LinkedHashMap<>();
            List<Source> admitted = new ArrayList<>();
            for (Source source : requested) {
                healthRegistry.register(source.getCode(), source.getName());
                CallState state = new CallState(source.getCode());
                states.put(source.getCode(), state);
                if (healthRegistry.shouldAllow(source.getCode())) {
                    admitted.add(source);
                } else {
                    log.info("Skipping source {} for job {}: circuit open", source.getCode(), jobId);
                    state.settle(SourceCallResult.failure(source.getCode(), ErrorKind.CIRCUIT_OPEN,
                            "circuit breaker open", 0));
                    publish(SearchEvent.EventType.SOURCE_SKIPPED, jobId, source.getCode(), Map.of());
                }
            }

            ResultBuffer arrivals = new ResultBuffer(bufferMaxSize);
            AtomicBoolean timedOut = new AtomicBoolean(false);

            return Flux.fromIterable(admitted)
                    .flatMap(source -> call(jobId, source, query, maxResultsPerSource,
                                    states.get(source.getCode()), listener)
                            .doOnNext(result -> {
                                if (states.get(source.getCode()).result() != result) {
                                    return;
                                }
                                if (result.isSuccess()) {
                                    arrivals.addBatch(result.records());
                                }
                                notifyListener(listener, result);
                            }), jobConfig.getMaxWorkers())
                    .then()
                    .timeout(Duration.ofSeconds(jobConfig.getJobTimeoutSeconds()))
                    .onErrorResume(TimeoutException.class, e -> {
                        timedOut.set(true);
                        log.warn("Search job {} hit its {}s deadline, cancelling outstanding calls",
                                jobId, jobConfig.getJobTimeoutSeconds());
                        return Mono.empty();
                    })
                    .then(Mono.fromCallable(() -> {
                        settleUnfinished(jobId, states);
                        SearchResponse response = buildResponse(query, strategy, states, arrivals,
                                timedOut.get(), elapsedMs(startNanos));
                        publish(SearchEvent.EventType.SEARCH_COMPLETED, jobId, null, Map.of(
                                "uniqueResults", response.getStatistics().getUniqueResults(),
                                "timedOut", response.isTimedOut()));
                        log.info("Search job {} completed: {} unique results, {}/{} sources succeeded, {}ms{}",
                                jobId, response.getStatistics().getUniqueResults(),
                                response.getStatistics().getSuccessfulSources(),
                                response.getStatistics().getTotalSources(),
                                response.getStatistics().getElapsedMs(),
                                response.isTimedOut() ? " (timed out)" : "");
                        return response;
                    }));
        });
    }

    // ============================================
    // Single source call
    // ============================================

    private Mono<SourceCallResult> call(String jobId, Source source, String query, int maxResults,
                                        CallState state, SourceCallListener listener) {
        String code = source.getCode();
        Mono<SourceCallResult> guarded = Mono.defer(() -> {
            state.startNanos = System.nanoTime();
            state.start = healthRegistry.recordStart(code);
            publish(SearchEvent.EventType.SOURCE_STARTED, jobId, code, Map.of());
            notifyStarted(listener, code);

            return Mono.defer(() -> source.query(query, maxResults))
                    .timeout(Duration.ofSeconds(jobConfig.getCallTimeoutSeconds()))
                    .defaultIfEmpty(List.of())
                    .map(records -> normalize(code, records, maxResults))
                    .map(records -> {
                        SourceCallResult result = SourceCallResult.success(code, records,
                                elapsedMs(state.startNanos));
                        if (state.settle(result)) {
                            healthRegistry.recordSuccess(code, state.start, records.size());
                            counter(code, "success").increment();
                            publish(SearchEvent.EventType.SOURCE_COMPLETED, jobId, code,
                                    Map.of("resultCount", records.size(), "latencyMs", result.latencyMs()));
                            log.debug("Source {} returned {} results in {}ms", code, records.size(), result.latencyMs());
                        }
                        return result;
                    })
                    .onErrorResume(e -> Mono.just(fail(jobId, state, e)));
        });

        return rateLimiter.withPermit(guarded)
                .onErrorResume(e -> Mono.just(fail(jobId, state, e)));
    }

    private SourceCallResult fail(String jobId, CallState state, Throwable e) {
        ErrorKind kind = ErrorKind.fromException(e);
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        long latency = state.start != null ? elapsedMs(state.startNanos) : 0;
        SourceCallResult result = SourceCallResult.failure(state.code, kind, message, latency);
        if (state.settle(result)) {
            if (state.start != null) {
                healthRegistry.recordFailure(state.code, state.start, kind, message);
            } else {
                healthRegistry.releaseUnstarted(state.code);
            }
            counter(state.code, "failure").increment();
            publish(SearchEvent.EventType.SOURCE_FAILED, jobId, state.code,
                    Map.of("errorKind", kind.getCode(), "error", message));
            log.warn("Source {} failed for job {}: {} ({})", state.code, jobId, kind.getCode(), message);
        }
        return result;
    }

    /**
     * Anything still running when the job deadline hit is a timeout. Calls that had
     * started are recorded against the source's health; calls still waiting for a
     * permit are only reported, and give back a half-open probe slot if they held one.
     */
    private void settleUnfinished(String jobId, Map<String, CallState> states) {
        for (CallState state : states.values()) {
            if (state.result() != null) {
                continue;
            }
            long latency = state.start != null ? elapsedMs(state.startNanos) : 0;
            String message = "job timeout";
            SourceCallResult timeout = SourceCallResult.failure(state.code, ErrorKind.TIMEOUT, message, latency);
            if (state.settle(timeout)) {
                if (state.start != null) {
                    healthRegistry.recordFailure(state.code, state.start, ErrorKind.TIMEOUT, message);
                } else {
                    healthRegistry.releaseUnstarted(state.code);
                }
                counter(state.code, "timeout").increment();
                publish(SearchEvent.EventType.SOURCE_FAILED, jobId, state.code,
                        Map.of("errorKind", ErrorKind.TIMEOUT.getCode(), "error", message));
            }
        }
    }

    private static List<ResultRecord> normalize(String code, List<ResultRecord> records, int maxResults) {
        List<ResultRecord> normalized = new ArrayList<>(Math.min(records.size(), maxResults));
        for (ResultRecord record : records) {
            if (record == null) {
                continue;
            }
            if (normalized.size() >= maxResults) {
                break;
            }
            if (record.getSourceCode() == null) {
                record.setSourceCode(code);
            }
            normalized.add(record);
        }
        return normalized;
    }

    // ============================================
    // Merge
    // ============================================

    private SearchResponse buildResponse(String query, MergeStrategy strategy, Map<String, CallState> states,
                                         ResultBuffer arrivals, boolean timedOut, long elapsedMs) {
        Map<String, List<ResultRecord>> perSourceResults = new LinkedHashMap<>();
        Map<String, SourceOutcome> perSourceOutcome = new LinkedHashMap<>();
        for (CallState state : states.values()) {
            perSourceResults.put(state.code, state.result().records());
            perSourceOutcome.put(state.code, state.result().toOutcome());
        }

        List<ResultRecord> results;
        List<MergedResult> merged = List.of();
        switch (strategy) {
            case APPEND:
                results = mergeAppend(perSourceResults);
                break;
            case RANKED:
                merged = mergeRanked(perSourceResults);
                results = merged.stream().map(MergedResult::record).toList();
                break;
            case INTERLEAVE:
                merged = mergeInterleave(perSourceResults);
                results = merged.stream().map(MergedResult::record).toList();
                break;
            case DEDUP:
            default:
                results = arrivals.getAll();
                break;
        }

        return SearchResponse.builder()
                .query(query)
                .mergeStrategy(strategy)
                .results(results)
                .mergedResults(merged)
                .perSourceResults(perSourceResults)
                .perSourceOutcome(perSourceOutcome)
                .statistics(statistics(perSourceOutcome, perSourceResults, results, elapsedMs))
                .timedOut(timedOut)
                .build();
    }

    /**
     * Source lists concatenated in request order, duplicates kept.
     */
    static List<ResultRecord> mergeAppend(Map<String, List<ResultRecord>> perSource) {
        List<ResultRecord> merged = new ArrayList<>();
        perSource.values().forEach(merged::addAll);
        return merged;
    }

    /**
     * One entry per URL, ordered by how many sources agree on it, then by the sum of
     * reciprocal positions (1/1 + 1/2 + ...). Ties keep first-seen order.
     */
    static List<MergedResult> mergeRanked(Map<String, List<ResultRecord>> perSource) {
        Map<String, RankedEntry> byUrl = new LinkedHashMap<>();
        perSource.forEach((code, records) -> {
            for (int position = 0; position < records.size(); position++) {
                ResultRecord record = records.get(position);
                if (!record.hasUrl()) {
                    continue;
                }
                RankedEntry entry = byUrl.computeIfAbsent(record.getUrl(), url -> new RankedEntry(record));
                entry.sources.add(code);
                entry.score += 1.0 / (position + 1);
            }
        });

        return byUrl.values().stream()
                .sorted(Comparator.comparingInt((RankedEntry e) -> e.sources.size())
                        .thenComparingDouble(e -> e.score)
                        .reversed())
                .map(e -> new MergedResult(e.first, new ArrayList<>(e.sources)))
                .toList();
    }

    /**
     * Round-robin by position across sources in request order, first occurrence of a URL wins.
     */
    static List<MergedResult> mergeInterleave(Map<String, List<ResultRecord>> perSource) {
        Map<String, RankedEntry> byUrl = new LinkedHashMap<>();
        List<List<ResultRecord>> lists = new ArrayList<>(perSource.values());
        List<String> codes = new ArrayList<>(perSource.keySet());
        int longest = lists.stream().mapToInt(List::size).max().orElse(0);

        for (int position = 0; position < longest; position++) {
            for (int i = 0; i < lists.size(); i++) {
                List<ResultRecord> records = lists.get(i);
                if (position >= records.size() || !records.get(position).hasUrl()) {
                    continue;
                }
                ResultRecord record = records.get(position);
                byUrl.computeIfAbsent(record.getUrl(), url -> new RankedEntry(record)).sources.add(codes.get(i));
            }
        }
        return byUrl.values().stream()
                .map(e -> new MergedResult(e.first, new ArrayList<>(e.sources)))
                .toList();
    }

    private static SearchStatistics statistics(Map<String, SourceOutcome> outcomes,
                                               Map<String, List<ResultRecord>> perSource,
                                               List<ResultRecord> results, long elapsedMs) {
        int successful = 0;
        int failed = 0;
        int timedOut = 0;
        int skipped = 0;
        for (SourceOutcome outcome : outcomes.values()) {
            switch (outcome.status()) {
                case SUCCESS, NO_RESULTS -> successful++;
                case FAILED -> failed++;
                case TIMEOUT -> timedOut++;
                case CIRCUIT_OPEN -> skipped++;
            }
        }
        int total = outcomes.size();
        int raw = perSource.values().stream().mapToInt(List::size).sum();
        long unique = results.stream()
                .filter(ResultRecord::hasUrl)
                .map(ResultRecord::getUrl)
                .distinct()
                .count();

        return SearchStatistics.builder()
                .totalSources(total)
                .successfulSources(successful)
                .failedSources(failed)
                .timedOutSources(timedOut)
                .skippedSources(skipped)
                .totalResults(raw)
                .uniqueResults((int) unique)
                .successRate(total == 0 ? 0.0 : (double) successful / total)
                .elapsedMs(elapsedMs)
                .build();
    }

    // ============================================
    // Helpers
    // ============================================

    private static List<Source> distinctByCode(List<Source> sources) {
        Map<String, Source> byCode = new LinkedHashMap<>();
        for (Source source : sources) {
            if (byCode.putIfAbsent(source.getCode(), source) != null) {
                log.debug("Ignoring duplicate source {} in request", source.getCode());
            }
        }
        return new ArrayList<>(byCode.values());
    }

    private static void notifyStarted(SourceCallListener listener, String code) {
        try {
            listener.onSourceStarted(code);
        } catch (Exception e) {
            log.warn("Source call listener failed on start of {}: {}", code, e.getMessage());
        }
    }

    private static void notifyListener(SourceCallListener listener, SourceCallResult result) {
        try {
            listener.onSourceFinished(result);
        } catch (Exception e) {
            log.warn("Source call listener failed for {}: {}", result.sourceCode(), e.getMessage());
        }
    }

    private void publish(SearchEvent.EventType type, String jobId, String sourceCode, Map<String, Object> data) {
        if (eventPublisher != null) {
            eventPublisher.publish(SearchEvent.of(type, jobId, sourceCode, data));
        }
    }

    private Counter counter(String code, String result) {
        return Counter.builder("orchestrator.source.calls")
                .description("Source calls by outcome")
                .tag("source", code)
                .tag("result", result)
                .register(meterRegistry);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /**
     * Outcome bookkeeping for one source in one search. Whoever settles first (the call
     * itself or the job deadline) owns the health recording.
     */
    private static final class CallState {
        private final String code;
        private final AtomicReference<SourceCallResult> result = new AtomicReference<>();
        private volatile Instant start;
        private volatile long startNanos;

        private CallState(String code) {
            this.code = code;
        }

        private boolean settle(SourceCallResult outcome) {
            return result.compareAndSet(null, outcome);
        }

        private SourceCallResult result() {
            return result.get();
        }
    }

    private static final class RankedEntry {
        private final ResultRecord first;
        private final Set<String> sources = new LinkedHashSet<>();
        private double score;

        private RankedEntry(ResultRecord first) {
            this.first = first;
        }
    }
}
