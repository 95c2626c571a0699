package com.brutesearch.orchestrator.service.source;

/**
 * Hook into the life of each source call within one search.
 *
 * <p>{@link #onSourceFinished} is told about every call that actually ran to an outcome,
 * success or failure, on the thread that settled it. Sources refused by an open breaker
 * or cancelled by the job deadline are not reported.
 */
@FunctionalInterface
public interface SourceCallListener {

    SourceCallListener NONE = result -> { };

    /**
     * Called once the call holds its rate-limiter permit, right before the source is queried.
     */
    default void onSourceStarted(String sourceCode) {
    }

    void onSourceFinished(SourceCallResult result);
}
