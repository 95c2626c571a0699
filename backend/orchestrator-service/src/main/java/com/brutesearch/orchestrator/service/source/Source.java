package com.brutesearch.orchestrator.service.source;

import com.brutesearch.orchestrator.dto.ResultRecord;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * An external search source (engine, API, index).
 *
 * <p>Implementations must be safe to call concurrently and keep no reliability state
 * of their own; health, breaking and pacing are handled around them. Register an
 * implementation as a Spring bean and it becomes addressable by {@link #getCode()}.
 */
public interface Source {

    /**
     * Short stable id used in outcome maps, checkpoints and health reports.
     */
    String getCode();

    String getName();

    /**
     * Results in the source's own order. An empty list means the source answered
     * with nothing; an error signal means it failed.
     */
    Mono<List<ResultRecord>> query(String text, int maxResults);
}
