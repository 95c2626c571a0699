package com.brutesearch.orchestrator.service.resilience;

import com.brutesearch.orchestrator.config.OrchestratorProperties;
import com.brutesearch.orchestrator.dto.EngineHealthSnapshot.BreakerState;

import java.time.Duration;
import java.time.Instant;

/**
 * Breaker state for one source.
 *
 * <pre>
 * CLOSED ──(trip)──▶ OPEN ──(recovery elapsed, one probe)──▶ HALF_OPEN
 *   ▲                  ▲                                        │
 *   └────(success)─────┼────────────────────────────────────────┤
 *                      └──────────────(failure)─────────────────┘
 * </pre>
 *
 * Not thread-safe; {@link HealthRegistry} calls it under its lock.
 */
class CircuitBreaker {

    private final int failureThreshold;
    private final int timeoutThreshold;
    private final Duration recoveryTimeout;
    private final int minRequests;

    private BreakerState state = BreakerState.CLOSED;
    private Instant openUntil;
    private boolean probeInFlight;

    CircuitBreaker(OrchestratorProperties.CircuitBreaker config) {
        this.failureThreshold = config.getFailureThreshold();
        this.timeoutThreshold = config.getTimeoutThreshold();
        this.recoveryTimeout = config.recoveryTimeout();
        this.minRequests = config.getMinRequestsBeforeBreaking();
    }

    /**
     * Admission check. Moving OPEN to HALF_OPEN hands out the single probe slot.
     */
    boolean tryAcquire(Instant now) {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (now.isAfter(openUntil)) {
                    state = BreakerState.HALF_OPEN;
                    probeInFlight = true;
                    return true;
                }
                return false;
            case HALF_OPEN:
            default:
                if (!probeInFlight) {
                    probeInFlight = true;
                    return true;
                }
                return false;
        }
    }

    /**
     * Returns the half-open probe slot when the admitted call never reached the source.
     *
     * @return true if a probe slot was handed back
     */
    boolean releaseProbe() {
        if (state == BreakerState.HALF_OPEN && probeInFlight) {
            probeInFlight = false;
            return true;
        }
        return false;
    }

    /**
     * A success only closes the breaker when it is the half-open probe. Late successes
     * from calls admitted before the trip leave an open breaker alone.
     *
     * @return true if this success closed the breaker
     */
    boolean onSuccess() {
        if (state == BreakerState.HALF_OPEN) {
            close();
            return true;
        }
        return false;
    }

    /**
     * @return true if this failure opened (or re-opened) the breaker
     */
    boolean onFailure(EngineMetrics metrics, boolean timeout, Instant now) {
        if (state == BreakerState.HALF_OPEN) {
            open(now);
            return true;
        }
        if (state == BreakerState.OPEN) {
            return false;
        }
        if (shouldTrip(metrics, timeout)) {
            open(now);
            return true;
        }
        return false;
    }

    private boolean shouldTrip(EngineMetrics metrics, boolean timeout) {
        if (metrics.getTotalRequests() < minRequests) {
            return false;
        }
        if (metrics.getConsecutiveFailures() >= failureThreshold) {
            return true;
        }
        return timeout
                && metrics.getTimeoutRequests() >= timeoutThreshold
                && metrics.timeoutRate() > 0.5;
    }

    private void open(Instant now) {
        state = BreakerState.OPEN;
        openUntil = now.plus(recoveryTimeout);
        probeInFlight = false;
    }

    private void close() {
        state = BreakerState.CLOSED;
        openUntil = null;
        probeInFlight = false;
    }

    BreakerState getState() {
        return state;
    }

    Instant getOpenUntil() {
        return openUntil;
    }
}
