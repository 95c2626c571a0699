package com.brutesearch.orchestrator.service.resilience;

import com.brutesearch.orchestrator.entity.EngineStatus;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Reliability counters for one source. Only {@link HealthRegistry} mutates these,
 * always while holding its lock, so nothing here is synchronized.
 */
@Getter
public class EngineMetrics {

    static final int LATENCY_WINDOW = 100;

    private final String code;
    private final String name;

    private long totalRequests;
    private long successfulRequests;
    private long failedRequests;
    private long timeoutRequests;
    private long rateLimitedRequests;
    private int consecutiveFailures;

    private Instant lastSuccessAt;
    private Instant lastFailureAt;

    private EngineStatus status = EngineStatus.HEALTHY;

    @Getter(lombok.AccessLevel.NONE)
    private final Deque<Long> latencies = new ArrayDeque<>(LATENCY_WINDOW);
    @Getter(lombok.AccessLevel.NONE)
    private long latencySum;

    EngineMetrics(String code, String name) {
        this.code = code;
        this.name = name;
    }

    void onStart() {
        totalRequests++;
    }

    void onSuccess(Instant at, long latencyMs) {
        successfulRequests++;
        consecutiveFailures = 0;
        lastSuccessAt = at;
        addLatency(latencyMs);
    }

    void onFailure(Instant at, long latencyMs, boolean timeout, boolean rateLimited) {
        failedRequests++;
        consecutiveFailures++;
        lastFailureAt = at;
        if (timeout) timeoutRequests++;
        if (rateLimited) rateLimitedRequests++;
        addLatency(latencyMs);
    }

    void setStatus(EngineStatus status) {
        this.status = status;
    }

    private void addLatency(long latencyMs) {
        if (latencies.size() == LATENCY_WINDOW) {
            latencySum -= latencies.removeFirst();
        }
        long sample = Math.max(0, latencyMs);
        latencies.addLast(sample);
        latencySum += sample;
    }

    public long completedRequests() {
        return successfulRequests + failedRequests;
    }

    /**
     * Successes over completed calls; 1.0 before any call completed.
     */
    public double successRate() {
        long completed = completedRequests();
        return completed == 0 ? 1.0 : (double) successfulRequests / completed;
    }

    public double failureRate() {
        long completed = completedRequests();
        return completed == 0 ? 0.0 : (double) failedRequests / completed;
    }

    public double timeoutRate() {
        long completed = completedRequests();
        return completed == 0 ? 0.0 : (double) timeoutRequests / completed;
    }

    public double averageLatencyMs() {
        return latencies.isEmpty() ? 0.0 : (double) latencySum / latencies.size();
    }
}
