package com.brutesearch.orchestrator.service.resilience;

import com.brutesearch.orchestrator.config.OrchestratorProperties;
import com.brutesearch.orchestrator.dto.EngineHealthSnapshot;
import com.brutesearch.orchestrator.dto.EngineHealthSnapshot.BreakerState;
import com.brutesearch.orchestrator.entity.EngineStatus;
import com.brutesearch.orchestrator.entity.ErrorKind;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 소스별 건강 상태 및 Circuit Breaker 레지스트리.
 *
 * <p>Every source code (search engines as well as fetch tiers, registered as
 * {@code fetch:<name>}) gets one {@link EngineMetrics} and one {@link CircuitBreaker}.
 * All reads and writes go through a single lock; callers only ever see
 * {@link EngineHealthSnapshot} copies.
 *
 * <p>Unknown codes are always allowed.
 */
@Slf4j
public class HealthRegistry {

    private final OrchestratorProperties.CircuitBreaker config;
    private final Clock clock;
    private final Object lock = new Object();

    // guarded by lock
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public HealthRegistry(OrchestratorProperties.CircuitBreaker config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    // ============================================
    // Registration
    // ============================================

    public void register(String code, String name) {
        synchronized (lock) {
            if (entries.containsKey(code)) {
                return;
            }
            entries.put(code, new Entry(new EngineMetrics(code, name), new CircuitBreaker(config)));
        }
        log.debug("Registered source for health tracking: {} ({})", code, name);
    }

    public boolean isRegistered(String code) {
        synchronized (lock) {
            return entries.containsKey(code);
        }
    }

    public List<String> registeredSources() {
        synchronized (lock) {
            return List.copyOf(entries.keySet());
        }
    }

    // ============================================
    // Admission
    // ============================================

    /**
     * Whether a call to this source may proceed right now. Once the recovery timeout
     * has passed on an open breaker, exactly one caller gets {@code true} (the probe)
     * until that probe records its outcome.
     */
    public boolean shouldAllow(String code) {
        synchronized (lock) {
            Entry entry = entries.get(code);
            if (entry == null) {
                return true;
            }
            BreakerState before = entry.breaker.getState();
            boolean allowed = entry.breaker.tryAcquire(clock.instant());
            if (before == BreakerState.OPEN && entry.breaker.getState() == BreakerState.HALF_OPEN) {
                entry.metrics.setStatus(EngineStatus.DEGRADED);
                log.info("Circuit half-open for {}, admitting one probe call", code);
            }
            return allowed;
        }
    }

    /**
     * For an admitted call that settled without ever starting (cancelled while waiting
     * for a permit). Nothing is recorded; a half-open breaker gets its probe slot back
     * so the next caller can probe instead.
     */
    public void releaseUnstarted(String code) {
        synchronized (lock) {
            Entry entry = entries.get(code);
            if (entry != null && entry.breaker.releaseProbe()) {
                log.info("Probe for {} never started, half-open slot released", code);
            }
        }
    }

    // ============================================
    // Recording
    // ============================================

    /**
     * Marks the start of a call and returns the instant latency is measured from.
     * Unregistered codes are registered on the fly.
     */
    public Instant recordStart(String code) {
        synchronized (lock) {
            Entry entry = entries.computeIfAbsent(code,
                    c -> new Entry(new EngineMetrics(c, c), new CircuitBreaker(config)));
            entry.metrics.onStart();
            return clock.instant();
        }
    }

    public void recordSuccess(String code, Instant start, int resultCount) {
        synchronized (lock) {
            Entry entry = entries.get(code);
            if (entry == null) {
                log.warn("recordSuccess for unknown source {}", code);
                return;
            }
            Instant now = clock.instant();
            entry.metrics.onSuccess(now, latencyMs(start, now));

            if (entry.breaker.onSuccess()) {
                entry.metrics.setStatus(statusFromSuccessRate(entry.metrics));
                log.info("Circuit closed for {} after successful probe", code);
            } else if (entry.metrics.getStatus() != EngineStatus.CIRCUIT_OPEN) {
                entry.metrics.setStatus(statusFromSuccessRate(entry.metrics));
            }
            log.debug("Source {} succeeded with {} results", code, resultCount);
        }
    }

    /**
     * Records a failed call. {@code kind} may be null or UNKNOWN, in which case the
     * message is classified.
     */
    public void recordFailure(String code, Instant start, ErrorKind kind, String message) {
        synchronized (lock) {
            Entry entry = entries.get(code);
            if (entry == null) {
                log.warn("recordFailure for unknown source {}: {}", code, message);
                return;
            }
            ErrorKind resolved = (kind == null || kind == ErrorKind.UNKNOWN)
                    ? ErrorKind.fromErrorMessage(message)
                    : kind;
            boolean timeout = resolved == ErrorKind.TIMEOUT;
            boolean rateLimited = resolved == ErrorKind.RATE_LIMITED;

            Instant now = clock.instant();
            EngineMetrics metrics = entry.metrics;
            metrics.onFailure(now, latencyMs(start, now), timeout, rateLimited);

            if (metrics.getStatus() != EngineStatus.CIRCUIT_OPEN) {
                metrics.setStatus(statusFromFailureRate(metrics));
            }

            if (entry.breaker.onFailure(metrics, timeout, now)) {
                metrics.setStatus(EngineStatus.CIRCUIT_OPEN);
                log.warn("Circuit OPEN for {} until {} (consecutiveFailures={}, timeouts={}/{}, lastError={})",
                        code, entry.breaker.getOpenUntil(), metrics.getConsecutiveFailures(),
                        metrics.getTimeoutRequests(), metrics.completedRequests(), resolved.getCode());
            }
        }
    }

    // ============================================
    // Reporting
    // ============================================

    public Optional<EngineHealthSnapshot> snapshot(String code) {
        synchronized (lock) {
            Entry entry = entries.get(code);
            return entry == null ? Optional.empty() : Optional.of(toSnapshot(entry));
        }
    }

    public List<EngineHealthSnapshot> healthReport() {
        synchronized (lock) {
            List<EngineHealthSnapshot> report = new ArrayList<>(entries.size());
            for (Entry entry : entries.values()) {
                report.add(toSnapshot(entry));
            }
            return report;
        }
    }

    /**
     * Forgets all counters for a source and closes its breaker.
     */
    public void reset(String code) {
        synchronized (lock) {
            Entry entry = entries.get(code);
            if (entry == null) {
                return;
            }
            entries.put(code, new Entry(new EngineMetrics(code, entry.metrics.getName()), new CircuitBreaker(config)));
        }
        log.info("Health metrics reset for {}", code);
    }

    private EngineHealthSnapshot toSnapshot(Entry entry) {
        EngineMetrics m = entry.metrics;
        return new EngineHealthSnapshot(
                m.getCode(),
                m.getName(),
                m.getStatus(),
                entry.breaker.getState(),
                m.getTotalRequests(),
                m.getSuccessfulRequests(),
                m.getFailedRequests(),
                m.getTimeoutRequests(),
                m.getRateLimitedRequests(),
                m.getConsecutiveFailures(),
                m.successRate(),
                m.averageLatencyMs(),
                m.getLastSuccessAt(),
                m.getLastFailureAt(),
                entry.breaker.getOpenUntil()
        );
    }

    private static EngineStatus statusFromSuccessRate(EngineMetrics metrics) {
        double rate = metrics.successRate();
        if (rate >= 0.95) return EngineStatus.HEALTHY;
        if (rate >= 0.80) return EngineStatus.DEGRADED;
        return EngineStatus.DOWN;
    }

    private static EngineStatus statusFromFailureRate(EngineMetrics metrics) {
        double rate = metrics.failureRate();
        if (rate > 0.5) return EngineStatus.DOWN;
        if (rate > 0.2) return EngineStatus.DEGRADED;
        return EngineStatus.HEALTHY;
    }

    private static long latencyMs(Instant start, Instant end) {
        if (start == null) {
            return 0;
        }
        return Math.max(0, Duration.between(start, end).toMillis());
    }

    private static final class Entry {
        private final EngineMetrics metrics;
        private final CircuitBreaker breaker;

        private Entry(EngineMetrics metrics, CircuitBreaker breaker) {
            this.metrics = metrics;
            this.breaker = breaker;
        }
    }
}
