package com.brutesearch.orchestrator.service.fetch;

import com.brutesearch.orchestrator.config.OrchestratorProperties;
import com.brutesearch.orchestrator.service.resilience.ConnectionPool;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.MediaType;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Delegates to a self-hosted crawl service (scripted crawler or headless browser).
 * The service receives the target URL in a JSON body and answers with either JSON
 * ({@code html}/{@code markdown}/{@code content}, optionally under {@code result}) or
 * the raw page.
 */
public class RemoteCrawlerFetchTier extends HttpFetchTier {

    public RemoteCrawlerFetchTier(OrchestratorProperties.Tier config, ConnectionPool connectionPool,
                                  ObjectMapper objectMapper) {
        super(config, connectionPool, objectMapper);
    }

    @Override
    public Mono<String> fetch(String url) {
        Map<String, Object> payload = Map.of(
                "url", url,
                "bypass_cache", true,
                "remove_overlay_elements", true,
                "timeout_seconds", config.getTimeoutSeconds()
        );

        return connectionPool.get()
                .post()
                .uri(config.getBaseUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON, MediaType.TEXT_HTML, MediaType.ALL)
                .bodyValue(payload)
                .exchangeToMono(this::readBody);
    }
}
