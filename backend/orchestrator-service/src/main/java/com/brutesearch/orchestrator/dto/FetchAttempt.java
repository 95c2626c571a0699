package com.brutesearch.orchestrator.dto;

import com.brutesearch.orchestrator.entity.ErrorKind;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One tier's try at one URL.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FetchAttempt(
        String method,
        boolean success,
        long latencyMs,
        ErrorKind errorKind,
        String error
) {
    public static FetchAttempt succeeded(String method, long latencyMs) {
        return new FetchAttempt(method, true, latencyMs, null, null);
    }

    public static FetchAttempt failed(String method, long latencyMs, ErrorKind kind, String error) {
        return new FetchAttempt(method, false, latencyMs, kind, error);
    }
}
