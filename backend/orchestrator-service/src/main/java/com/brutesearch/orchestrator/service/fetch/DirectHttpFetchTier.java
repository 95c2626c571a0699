package com.brutesearch.orchestrator.service.fetch;

import com.brutesearch.orchestrator.config.OrchestratorProperties;
import com.brutesearch.orchestrator.service.resilience.ConnectionPool;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.MediaType;
import reactor.core.publisher.Mono;

/**
 * Plain GET through the shared client. Cheapest tier, most likely to be blocked.
 */
public class DirectHttpFetchTier extends HttpFetchTier {

    public DirectHttpFetchTier(OrchestratorProperties.Tier config, ConnectionPool connectionPool,
                               ObjectMapper objectMapper) {
        super(config, connectionPool, objectMapper);
    }

    @Override
    public Mono<String> fetch(String url) {
        return connectionPool.get()
                .get()
                .uri(url)
                .accept(MediaType.TEXT_HTML, MediaType.APPLICATION_XHTML_XML, MediaType.ALL)
                .header("Accept-Language", "en-US,en;q=0.9")
                .exchangeToMono(this::readBody);
    }
}
