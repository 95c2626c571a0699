package com.brutesearch.orchestrator.controller;

import com.brutesearch.orchestrator.dto.FetchOutcome;
import com.brutesearch.orchestrator.dto.FetchRequest;
import com.brutesearch.orchestrator.service.fetch.TieredFetchChain;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pushes URLs through the tiered fetch chain. Responds with a per-URL summary
 * (the page bodies themselves are not returned).
 */
@RestController
@RequestMapping("/api/v1/fetch")
@RequiredArgsConstructor
@Slf4j
public class FetchController {

    private final TieredFetchChain tieredFetchChain;

    @PostMapping
    public Mono<Map<String, Map<String, Object>>> fetch(@Valid @RequestBody FetchRequest request) {
        log.info("Fetch request for {} URLs", request.urls().size());
        return tieredFetchChain.fetchAll(request.urls())
                .map(outcomes -> {
                    Map<String, Map<String, Object>> summary = new LinkedHashMap<>();
                    outcomes.forEach((url, outcome) -> summary.put(url, summarize(outcome)));
                    return summary;
                });
    }

    private static Map<String, Object> summarize(FetchOutcome outcome) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("status", outcome.status());
        summary.put("methodUsed", outcome.methodUsed());
        summary.put("latencyMs", outcome.latencyMs());
        summary.put("contentLength", outcome.content() != null ? outcome.content().length() : 0);
        summary.put("attempts", outcome.attempts());
        return summary;
    }
}
