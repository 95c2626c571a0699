package com.brutesearch.orchestrator.config;

import com.brutesearch.orchestrator.service.checkpoint.CheckpointStore;
import com.brutesearch.orchestrator.service.event.SearchEventPublisher;
import com.brutesearch.orchestrator.service.fetch.DirectHttpFetchTier;
import com.brutesearch.orchestrator.service.fetch.FetchTier;
import com.brutesearch.orchestrator.service.fetch.RemoteCrawlerFetchTier;
import com.brutesearch.orchestrator.service.fetch.TieredFetchChain;
import com.brutesearch.orchestrator.service.fetch.UnlockerApiFetchTier;
import com.brutesearch.orchestrator.service.resilience.ConnectionPool;
import com.brutesearch.orchestrator.service.resilience.HealthRegistry;
import com.brutesearch.orchestrator.service.resilience.RateLimiter;
import com.brutesearch.orchestrator.service.sink.JsonLinesResultSink;
import com.brutesearch.orchestrator.service.sink.ResultSink;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.smile.databind.SmileMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires the shared orchestration primitives. Each one is a process-wide singleton
 * built from its own {@link OrchestratorProperties} group.
 */
@Configuration
@Slf4j
public class OrchestrationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateLimiter rateLimiter(OrchestratorProperties properties) {
        OrchestratorProperties.RateLimit config = properties.getRateLimit();
        return new RateLimiter(config.getMaxConcurrent(), config.getRequestsPerSecond());
    }

    @Bean
    public HealthRegistry healthRegistry(OrchestratorProperties properties, Clock clock) {
        return new HealthRegistry(properties.getCircuitBreaker(), clock);
    }

    @Bean(destroyMethod = "close")
    public ConnectionPool connectionPool(OrchestratorProperties properties) {
        return new ConnectionPool(properties.getConnectionPool());
    }

    @Bean(destroyMethod = "close")
    public SearchEventPublisher searchEventPublisher(OrchestratorProperties properties) {
        return new SearchEventPublisher(properties.getEvents().getCapacity());
    }

    @Bean
    public CheckpointStore checkpointStore(OrchestratorProperties properties, ObjectMapper objectMapper) {
        ObjectMapper jsonMapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        ObjectMapper smileMapper = SmileMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
        Path dir = Path.of(properties.getCheckpoint().getDir());
        log.info("Checkpoints stored under {}", dir.toAbsolutePath());
        return new CheckpointStore(dir, jsonMapper, smileMapper);
    }

    @Bean
    @ConditionalOnMissingBean(ResultSink.class)
    public ResultSink resultSink(OrchestratorProperties properties, ObjectMapper objectMapper) {
        return new JsonLinesResultSink(Path.of(properties.getSink().getDir()), objectMapper);
    }

    @Bean
    public TieredFetchChain tieredFetchChain(OrchestratorProperties properties,
                                             ConnectionPool connectionPool,
                                             HealthRegistry healthRegistry,
                                             ObjectMapper objectMapper,
                                             MeterRegistry meterRegistry) {
        List<FetchTier> tiers = new ArrayList<>();
        for (OrchestratorProperties.Tier tier : properties.getFetch().getTiers()) {
            if (!tier.isEnabled()) {
                log.info("Fetch tier {} disabled", tier.getName());
                continue;
            }
            switch (tier.getType()) {
                case DIRECT_HTTP -> tiers.add(new DirectHttpFetchTier(tier, connectionPool, objectMapper));
                case REMOTE_CRAWLER -> {
                    if (isBlank(tier.getBaseUrl())) {
                        log.info("Fetch tier {} has no base-url, leaving it out", tier.getName());
                    } else {
                        tiers.add(new RemoteCrawlerFetchTier(tier, connectionPool, objectMapper));
                    }
                }
                case UNLOCKER_API -> {
                    if (isBlank(tier.getBaseUrl()) || isBlank(tier.getApiKey())) {
                        log.info("Fetch tier {} has no base-url or api-key, leaving it out", tier.getName());
                    } else {
                        tiers.add(new UnlockerApiFetchTier(tier, connectionPool, objectMapper));
                    }
                }
            }
        }
        return new TieredFetchChain(tiers, healthRegistry, properties.getFetch().getMinContentLength(), meterRegistry);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
