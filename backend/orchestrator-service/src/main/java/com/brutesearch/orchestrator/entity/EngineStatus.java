package com.brutesearch.orchestrator.entity;

/**
 * Descriptive health of a source. CIRCUIT_OPEN is owned by the breaker,
 * the other three follow the rolling success/failure rate.
 * DEGRADED also stands for the half-open probe window.
 */
public enum EngineStatus {
    HEALTHY,
    DEGRADED,
    DOWN,
    CIRCUIT_OPEN
}
