package com.brutesearch.orchestrator.dto;

import com.brutesearch.orchestrator.entity.EngineStatus;

import java.time.Instant;

/**
 * Immutable view of one source's reliability counters and breaker state.
 */
public record EngineHealthSnapshot(
        String code,
        String name,
        EngineStatus status,
        BreakerState breakerState,
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        long timeoutRequests,
        long rateLimitedRequests,
        int consecutiveFailures,
        double successRate,
        double averageLatencyMs,
        Instant lastSuccessAt,
        Instant lastFailureAt,
        Instant circuitOpenUntil
) {
    public enum BreakerState {
        CLOSED,
        OPEN,
        HALF_OPEN
    }
}
