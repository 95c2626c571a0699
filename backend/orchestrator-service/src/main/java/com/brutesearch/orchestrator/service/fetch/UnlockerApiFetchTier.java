package com.brutesearch.orchestrator.service.fetch;

import com.brutesearch.orchestrator.config.OrchestratorProperties;
import com.brutesearch.orchestrator.service.resilience.ConnectionPool;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Paid managed-unlocking API. Authenticated with a bearer key; billed per request,
 * so only the URLs every cheaper tier failed on reach it.
 */
public class UnlockerApiFetchTier extends HttpFetchTier {

    public UnlockerApiFetchTier(OrchestratorProperties.Tier config, ConnectionPool connectionPool,
                                ObjectMapper objectMapper) {
        super(config, connectionPool, objectMapper);
    }

    @Override
    public Mono<String> fetch(String url) {
        Map<String, Object> payload = Map.of(
                "url", url,
                "format", "raw"
        );

        return connectionPool.get()
                .post()
                .uri(config.getBaseUrl())
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON, MediaType.TEXT_HTML, MediaType.ALL)
                .bodyValue(payload)
                .exchangeToMono(this::readBody);
    }
}
