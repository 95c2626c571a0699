package com.brutesearch.orchestrator.entity;

/**
 * Per-source result of one search. NO_RESULTS and FAILED are deliberately distinct.
 */
public enum OutcomeStatus {
    SUCCESS,
    NO_RESULTS,
    FAILED,
    TIMEOUT,
    CIRCUIT_OPEN;

    public boolean isFailure() {
        return this == FAILED || this == TIMEOUT || this == CIRCUIT_OPEN;
    }
}
