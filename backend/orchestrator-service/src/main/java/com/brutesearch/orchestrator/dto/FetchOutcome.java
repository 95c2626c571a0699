package com.brutesearch.orchestrator.dto;

import com.brutesearch.orchestrator.entity.ErrorKind;
import com.brutesearch.orchestrator.entity.FetchStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Final result of pushing one URL through the fetch chain.
 * {@code methodUsed} is the accepting tier, or null when every tier failed.
 * {@code latencyMs} is the accepting tier's own latency on success and the sum over
 * all attempts otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FetchOutcome(
        String url,
        FetchStatus status,
        String content,
        String methodUsed,
        long latencyMs,
        List<FetchAttempt> attempts
) {
    public FetchOutcome {
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public static FetchOutcome success(String url, String content, String method, List<FetchAttempt> attempts) {
        return new FetchOutcome(url, FetchStatus.SUCCESS, content, method, acceptedLatency(method, attempts), attempts);
    }

    /**
     * Every tier tried and none accepted. Reported as BLOCKED when at least one tier
     * saw an anti-bot or rate-limit response.
     */
    public static FetchOutcome exhausted(String url, List<FetchAttempt> attempts) {
        boolean blocked = attempts.stream()
                .anyMatch(a -> a.errorKind() == ErrorKind.BLOCKED || a.errorKind() == ErrorKind.RATE_LIMITED);
        return new FetchOutcome(url, blocked ? FetchStatus.BLOCKED : FetchStatus.FAILED,
                null, null, totalLatency(attempts), attempts);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == FetchStatus.SUCCESS;
    }

    private static long acceptedLatency(String method, List<FetchAttempt> attempts) {
        for (int i = attempts.size() - 1; i >= 0; i--) {
            FetchAttempt attempt = attempts.get(i);
            if (attempt.success() && attempt.method().equals(method)) {
                return attempt.latencyMs();
            }
        }
        return 0;
    }

    private static long totalLatency(List<FetchAttempt> attempts) {
        return attempts.stream().mapToLong(FetchAttempt::latencyMs).sum();
    }
}
