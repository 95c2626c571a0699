package com.brutesearch.orchestrator.service.fetch;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * One rung of the fetch escalation ladder.
 *
 * <p>{@link #fetch(String)} emits the page body (HTML or extracted text), completes
 * empty when the tier got nothing usable, or errors. Errors carrying an
 * {@link com.brutesearch.orchestrator.entity.ErrorKind} should be raised as
 * {@link com.brutesearch.orchestrator.exception.SourceCallException}.
 */
public interface FetchTier {

    String getName();

    /**
     * Upper bound on simultaneous fetches through this tier. Expensive tiers get less.
     */
    int getMaxConcurrent();

    Duration getTimeout();

    /**
     * How long a URL may wait for one of the {@link #getMaxConcurrent()} slots before
     * it is counted as a timeout on this tier and moves on.
     */
    default Duration getSlotWaitTimeout() {
        return getTimeout();
    }

    Mono<String> fetch(String url);
}
