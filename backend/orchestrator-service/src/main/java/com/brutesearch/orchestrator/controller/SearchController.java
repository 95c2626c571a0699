package com.brutesearch.orchestrator.controller;

import com.brutesearch.orchestrator.config.OrchestratorProperties;
import com.brutesearch.orchestrator.dto.SearchRequest;
import com.brutesearch.orchestrator.dto.SearchResponse;
import com.brutesearch.orchestrator.entity.MergeStrategy;
import com.brutesearch.orchestrator.service.SearchOrchestrator;
import com.brutesearch.orchestrator.service.fetch.TieredFetchChain;
import com.brutesearch.orchestrator.service.source.Source;
import com.brutesearch.orchestrator.service.source.SourceRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * One-shot fan-out search, no checkpoint. With {@code fetchContent} the merged results
 * are also run through the tiered fetch chain.
 */
@RestController
@RequestMapping("/api/v1/search")
@RequiredArgsConstructor
@Slf4j
public class SearchController {

    private final SearchOrchestrator searchOrchestrator;
    private final SourceRegistry sourceRegistry;
    private final TieredFetchChain tieredFetchChain;
    private final OrchestratorProperties properties;

    @PostMapping
    public Mono<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
        List<Source> sources = new ArrayList<>();
        List<String> unknown = new ArrayList<>();
        for (String code : request.sources()) {
            sourceRegistry.find(code).ifPresentOrElse(sources::add, () -> unknown.add(code));
        }
        if (!unknown.isEmpty()) {
            return Mono.error(new IllegalArgumentException("Unknown sources: " + unknown));
        }

        int maxResults = request.maxResultsPerSource() != null
                ? request.maxResultsPerSource()
                : properties.getJob().getMaxResultsPerSource();
        MergeStrategy strategy = request.mergeStrategy() != null ? request.mergeStrategy() : MergeStrategy.DEDUP;

        log.info("Search request: query='{}', sources={}, strategy={}", request.query(), request.sources(), strategy);
        Mono<SearchResponse> response = searchOrchestrator.search(sources, request.query(), maxResults, strategy);
        if (!request.shouldFetchContent()) {
            return response;
        }
        return response.flatMap(result -> tieredFetchChain.enrich(result.getResults())
                .map(enriched -> {
                    result.setResults(enriched);
                    return result;
                }));
    }
}
