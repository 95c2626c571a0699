package com.brutesearch.orchestrator.dto;

import com.brutesearch.orchestrator.entity.ErrorKind;
import com.brutesearch.orchestrator.entity.OutcomeStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What happened to one source during one search.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceOutcome(
        String sourceCode,
        OutcomeStatus status,
        ErrorKind errorKind,
        String error,
        int resultCount,
        long latencyMs
) {
    public static SourceOutcome success(String sourceCode, int resultCount, long latencyMs) {
        OutcomeStatus status = resultCount > 0 ? OutcomeStatus.SUCCESS : OutcomeStatus.NO_RESULTS;
        return new SourceOutcome(sourceCode, status, null, null, resultCount, latencyMs);
    }

    public static SourceOutcome failed(String sourceCode, ErrorKind kind, String error, long latencyMs) {
        if (kind == ErrorKind.CIRCUIT_OPEN) {
            return circuitOpen(sourceCode);
        }
        OutcomeStatus status = kind == ErrorKind.TIMEOUT ? OutcomeStatus.TIMEOUT : OutcomeStatus.FAILED;
        return new SourceOutcome(sourceCode, status, kind, error, 0, latencyMs);
    }

    public static SourceOutcome circuitOpen(String sourceCode) {
        return new SourceOutcome(sourceCode, OutcomeStatus.CIRCUIT_OPEN, ErrorKind.CIRCUIT_OPEN,
                "circuit breaker open", 0, 0);
    }

    public boolean isFailure() {
        return status.isFailure();
    }
}
