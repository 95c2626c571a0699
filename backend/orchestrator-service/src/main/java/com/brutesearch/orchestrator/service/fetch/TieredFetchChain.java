package com.brutesearch.orchestrator.service.fetch;

import com.brutesearch.orchestrator.dto.FetchAttempt;
import com.brutesearch.orchestrator.dto.FetchOutcome;
import com.brutesearch.orchestrator.dto.ResultRecord;
import com.brutesearch.orchestrator.entity.ErrorKind;
import com.brutesearch.orchestrator.exception.SourceCallException;
import com.brutesearch.orchestrator.service.resilience.HealthRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * 단계별 페치 체인 (cheap → expensive).
 *
 * <p>Every URL starts at the first tier. Only URLs a tier fails on move to the next one,
 * so paid tiers see nothing but the residue of the free ones. A tier counts as
 * successful when the text Jsoup extracts from its response is at least
 * {@code minContentLength} characters long.
 *
 * <p>Each tier is tracked in the {@link HealthRegistry} as {@code fetch:<name>}; while its
 * breaker is open the tier is skipped and its URLs go straight to the next one.
 */
@Slf4j
public class TieredFetchChain {

    public static final String HEALTH_PREFIX = "fetch:";

    private static final String[] BLOCK_MARKERS = {
            "captcha", "cf-browser-verification", "cf-challenge", "access denied",
            "are you a robot", "unusual traffic", "request blocked"
    };

    private final List<TierSlot> tiers;
    private final HealthRegistry healthRegistry;
    private final int minContentLength;

    public TieredFetchChain(List<FetchTier> tiers, HealthRegistry healthRegistry,
                            int minContentLength, MeterRegistry meterRegistry) {
        this.healthRegistry = healthRegistry;
        this.minContentLength = minContentLength;
        this.tiers = new ArrayList<>(tiers.size());
        for (FetchTier tier : tiers) {
            String code = HEALTH_PREFIX + tier.getName();
            healthRegistry.register(code, "Fetch tier " + tier.getName());
            this.tiers.add(new TierSlot(tier, code, meterRegistry));
        }
        log.info("Fetch chain initialized with tiers: {}", tierNames());
    }

    public List<String> tierNames() {
        return tiers.stream().map(slot -> slot.tier.getName()).toList();
    }

    // ============================================
    // Public API
    // ============================================

    public Mono<FetchOutcome> fetch(String url) {
        if (url == null || url.isBlank()) {
            return Mono.just(FetchOutcome.exhausted(url, List.of()));
        }
        return fetchAll(List.of(url)).map(results -> results.get(url));
    }

    /**
     * Runs the URLs through the chain wave by wave. The returned map has one entry per
     * distinct non-blank input URL, in input order.
     */
    public Mono<Map<String, FetchOutcome>> fetchAll(Collection<String> urls) {
        List<String> distinct = urls.stream()
                .filter(Objects::nonNull)
                .filter(url -> !url.isBlank())
                .distinct()
                .toList();
        if (distinct.isEmpty()) {
            return Mono.just(Map.of());
        }

        Map<String, List<FetchAttempt>> attempts = new ConcurrentHashMap<>();
        Map<String, FetchOutcome> finished = new ConcurrentHashMap<>();
        distinct.forEach(url -> attempts.put(url, new ArrayList<>()));

        Mono<List<String>> residual = Mono.just(distinct);
        for (TierSlot slot : tiers) {
            residual = residual.flatMap(pending -> runWave(slot, pending, attempts, finished));
        }

        return residual.map(exhausted -> {
            if (!exhausted.isEmpty()) {
                log.info("Fetch chain exhausted for {} of {} URLs", exhausted.size(), distinct.size());
            }
            Map<String, FetchOutcome> ordered = new LinkedHashMap<>();
            for (String url : distinct) {
                FetchOutcome outcome = finished.get(url);
                ordered.put(url, outcome != null ? outcome : FetchOutcome.exhausted(url, attempts.get(url)));
            }
            return ordered;
        });
    }

    /**
     * Fetches the pages behind search results. Records whose page was fetched come back
     * as copies with the page under {@code payload.content} plus the accepting tier's
     * {@code fetchMethod} and {@code fetchLatencyMs}; the rest come back unchanged.
     */
    public Mono<List<ResultRecord>> enrich(List<ResultRecord> records) {
        List<String> urls = records.stream()
                .filter(ResultRecord::hasUrl)
                .map(ResultRecord::getUrl)
                .toList();
        return fetchAll(urls).map(outcomes -> records.stream()
                .map(record -> record.hasUrl() ? withContent(record, outcomes.get(record.getUrl())) : record)
                .toList());
    }

    private static ResultRecord withContent(ResultRecord record, FetchOutcome outcome) {
        if (outcome == null || !outcome.isSuccess()) {
            return record;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        if (record.getPayload() != null) {
            payload.putAll(record.getPayload());
        }
        payload.put("content", outcome.content());
        return record.toBuilder()
                .payload(payload)
                .fetchMethod(outcome.methodUsed())
                .fetchLatencyMs(outcome.latencyMs())
                .build();
    }

    // ============================================
    // Waves
    // ============================================

    private Mono<List<String>> runWave(TierSlot slot, List<String> pending,
                                       Map<String, List<FetchAttempt>> attempts,
                                       Map<String, FetchOutcome> finished) {
        if (pending.isEmpty()) {
            return Mono.just(pending);
        }

        String tierName = slot.tier.getName();
        log.debug("Fetch wave {}: {} URLs", tierName, pending.size());

        return Flux.fromIterable(pending)
                .flatMap(url -> attempt(slot, url)
                        .doOnNext(result -> {
                            attempts.get(url).add(result.attempt);
                            if (result.content != null) {
                                finished.put(url, FetchOutcome.success(url, result.content, tierName,
                                        attempts.get(url)));
                            }
                        }), slot.tier.getMaxConcurrent())
                .then(Mono.fromCallable(() -> {
                    long refused = pending.stream()
                            .filter(url -> lastAttempt(attempts.get(url)).errorKind() == ErrorKind.CIRCUIT_OPEN)
                            .count();
                    if (refused > 0) {
                        log.info("Fetch tier {} refused {} of {} URLs, circuit open", tierName, refused, pending.size());
                    }
                    return pending.stream()
                            .filter(url -> !finished.containsKey(url))
                            .toList();
                }));
    }

    /**
     * One URL on one tier. The breaker is asked per URL, so a half-open tier gets a
     * single probe and the rest of the wave moves on to the next tier. Waiting for a
     * tier slot is bounded by {@link FetchTier#getSlotWaitTimeout()}.
     */
    private Mono<TierResult> attempt(TierSlot slot, String url) {
        String tierName = slot.tier.getName();
        long waitMs = slot.tier.getSlotWaitTimeout().toMillis();
        return Mono.using(
                        () -> slot.permits.tryAcquire(waitMs, TimeUnit.MILLISECONDS),
                        acquired -> {
                            if (!acquired) {
                                return Mono.just(new TierResult(null, FetchAttempt.failed(tierName, waitMs,
                                        ErrorKind.TIMEOUT, "no free " + tierName + " slot within " + waitMs + "ms")));
                            }
                            if (!healthRegistry.shouldAllow(slot.code)) {
                                return Mono.just(new TierResult(null, FetchAttempt.failed(tierName, 0,
                                        ErrorKind.CIRCUIT_OPEN, ErrorKind.CIRCUIT_OPEN.getCode())));
                            }
                            return Mono.defer(() -> call(slot, url));
                        },
                        acquired -> {
                            if (acquired) {
                                slot.permits.release();
                            }
                        })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<TierResult> call(TierSlot slot, String url) {
        String tierName = slot.tier.getName();
        Instant start = healthRegistry.recordStart(slot.code);
        long t0 = System.nanoTime();
        return slot.tier.fetch(url)
                .timeout(slot.tier.getTimeout())
                .switchIfEmpty(Mono.error(new SourceCallException(
                        ErrorKind.PARSE_FAILURE, "empty response")))
                .map(this::accept)
                .map(content -> {
                    long latency = elapsedMs(t0);
                    healthRegistry.recordSuccess(slot.code, start, 1);
                    slot.successes.increment();
                    log.debug("[{}] fetched {} in {}ms", tierName, url, latency);
                    return new TierResult(content, FetchAttempt.succeeded(tierName, latency));
                })
                .onErrorResume(e -> {
                    long latency = elapsedMs(t0);
                    ErrorKind kind = ErrorKind.fromException(e);
                    String message = describe(e);
                    healthRegistry.recordFailure(slot.code, start, kind, message);
                    slot.failures.increment();
                    log.debug("[{}] failed for {}: {} ({})", tierName, url, kind.getCode(), message);
                    return Mono.just(new TierResult(null,
                            FetchAttempt.failed(tierName, latency, kind, message)));
                });
    }

    private static FetchAttempt lastAttempt(List<FetchAttempt> attempts) {
        return attempts.get(attempts.size() - 1);
    }

    /**
     * Returns the raw content if it carries enough text, otherwise raises a classified
     * failure so the URL escalates.
     */
    private String accept(String raw) {
        String text = Jsoup.parse(raw).text();
        if (text.length() >= minContentLength) {
            return raw;
        }
        String lower = raw.toLowerCase(Locale.ROOT);
        for (String marker : BLOCK_MARKERS) {
            if (lower.contains(marker)) {
                throw new SourceCallException(ErrorKind.BLOCKED, "blocked page (" + marker + ")");
            }
        }
        throw new SourceCallException(ErrorKind.PARSE_FAILURE,
                "content too short (" + text.length() + " < " + minContentLength + ")");
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static final class TierSlot {
        private final FetchTier tier;
        private final String code;
        private final Semaphore permits;
        private final Counter successes;
        private final Counter failures;

        private TierSlot(FetchTier tier, String code, MeterRegistry meterRegistry) {
            this.tier = tier;
            this.code = code;
            this.permits = new Semaphore(tier.getMaxConcurrent(), true);
            this.successes = Counter.builder("orchestrator.fetch.attempts")
                    .description("Fetch attempts per tier")
                    .tag("tier", tier.getName())
                    .tag("result", "success")
                    .register(meterRegistry);
            this.failures = Counter.builder("orchestrator.fetch.attempts")
                    .description("Fetch attempts per tier")
                    .tag("tier", tier.getName())
                    .tag("result", "failure")
                    .register(meterRegistry);
        }
    }

    private static final class TierResult {
        private final String content;
        private final FetchAttempt attempt;

        private TierResult(String content, FetchAttempt attempt) {
            this.content = content;
            this.attempt = attempt;
        }
    }
}
