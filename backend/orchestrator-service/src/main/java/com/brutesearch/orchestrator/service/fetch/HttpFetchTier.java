package com.brutesearch.orchestrator.service.fetch;

import com.brutesearch.orchestrator.config.OrchestratorProperties;
import com.brutesearch.orchestrator.service.resilience.ConnectionPool;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Base for tiers that reach their page over the shared HTTP client.
 * Handles the JSON-or-raw response shapes crawl and unlocking services return.
 */
@Slf4j
abstract class HttpFetchTier implements FetchTier {

    protected final OrchestratorProperties.Tier config;
    protected final ConnectionPool connectionPool;
    protected final ObjectMapper objectMapper;

    protected HttpFetchTier(OrchestratorProperties.Tier config, ConnectionPool connectionPool,
                            ObjectMapper objectMapper) {
        this.config = config;
        this.connectionPool = connectionPool;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return config.getName();
    }

    @Override
    public int getMaxConcurrent() {
        return config.getMaxConcurrent();
    }

    @Override
    public Duration getTimeout() {
        return Duration.ofSeconds(config.getTimeoutSeconds());
    }

    /**
     * 2xx bodies are unwrapped; anything else becomes a WebClientResponseException
     * so the status can be classified.
     */
    protected Mono<String> readBody(ClientResponse response) {
        if (response.statusCode().isError()) {
            return response.createException().flatMap(ex -> Mono.<String>error(ex));
        }
        MediaType contentType = response.headers().contentType().orElse(MediaType.TEXT_HTML);
        return response.bodyToMono(String.class)
                .mapNotNull(body -> isJson(contentType) ? contentFromJson(body) : body);
    }

    private static boolean isJson(MediaType contentType) {
        return contentType.isCompatibleWith(MediaType.APPLICATION_JSON)
                || contentType.getSubtype().contains("json");
    }

    /**
     * Looks for the page in the usual fields, including a nested {@code result} object.
     */
    protected String contentFromJson(String body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node.has("result") && node.get("result").isObject()) {
                String nested = firstContentField(node.get("result"));
                if (nested != null) {
                    return nested;
                }
            }
            return firstContentField(node);
        } catch (Exception e) {
            log.debug("[{}] Response was not valid JSON, using raw body: {}", getName(), e.getMessage());
            return body;
        }
    }

    private static String firstContentField(JsonNode node) {
        for (String field : new String[]{"html", "content", "body", "markdown", "text"}) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                String text = value.isTextual() ? value.asText() : value.toString();
                if (!text.isBlank()) {
                    return text;
                }
            }
        }
        return null;
    }
}
