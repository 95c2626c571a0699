package com.brutesearch.orchestrator.controller;

import com.brutesearch.orchestrator.dto.EngineHealthSnapshot;
import com.brutesearch.orchestrator.entity.EngineStatus;
import com.brutesearch.orchestrator.service.resilience.HealthRegistry;
import com.brutesearch.orchestrator.service.resilience.RateLimiter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * SourceHealthController 단위 테스트
 */
@WebFluxTest(SourceHealthController.class)
@ActiveProfiles("test")
class SourceHealthControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private HealthRegistry healthRegistry;

    @MockBean
    private RateLimiter rateLimiter;

    private static EngineHealthSnapshot snapshot(String code, EngineStatus status,
                                                 EngineHealthSnapshot.BreakerState breaker) {
        return new EngineHealthSnapshot(code, "Engine " + code, status, breaker,
                10, 4, 6, 2, 1, 6, 0.4, 120.0,
                Instant.parse("2024-05-01T09:00:00Z"), Instant.parse("2024-05-01T10:00:00Z"),
                breaker == EngineHealthSnapshot.BreakerState.OPEN ? Instant.parse("2024-05-01T10:05:00Z") : null);
    }

    @Test
    @DisplayName("GET /api/v1/sources/health - 전체 건강 보고서")
    void healthReport() {
        when(healthRegistry.healthReport()).thenReturn(List.of(
                snapshot("google", EngineStatus.HEALTHY, EngineHealthSnapshot.BreakerState.CLOSED),
                snapshot("bing", EngineStatus.CIRCUIT_OPEN, EngineHealthSnapshot.BreakerState.OPEN)));

        webTestClient.get()
                .uri("/api/v1/sources/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[1].code").isEqualTo("bing")
                .jsonPath("$[1].breakerState").isEqualTo("OPEN")
                .jsonPath("$[1].circuitOpenUntil").isEqualTo("2024-05-01T10:05:00Z");
    }

    @Test
    @DisplayName("GET /api/v1/sources/health/{code} - 없는 소스는 404")
    void unknownSourceHealth() {
        when(healthRegistry.snapshot("ghost")).thenReturn(Optional.empty());

        webTestClient.get()
                .uri("/api/v1/sources/health/ghost")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("GET /api/v1/sources/rate-limit - 현재 슬롯 상태")
    void rateLimit() {
        when(rateLimiter.getMaxConcurrent()).thenReturn(10);
        when(rateLimiter.availablePermits()).thenReturn(7);
        when(rateLimiter.getRequestsPerSecond()).thenReturn(5.0);

        webTestClient.get()
                .uri("/api/v1/sources/rate-limit")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.availablePermits").isEqualTo(7)
                .jsonPath("$.maxConcurrent").isEqualTo(10);
    }

    @Test
    @DisplayName("POST /api/v1/sources/{code}/reset - 등록된 소스 초기화")
    void resetKnownSource() {
        when(healthRegistry.isRegistered("bing")).thenReturn(true);

        webTestClient.post()
                .uri("/api/v1/sources/bing/reset")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.reset").isEqualTo(true);

        verify(healthRegistry).reset("bing");
    }

    @Test
    @DisplayName("POST /api/v1/sources/{code}/reset - 없는 소스는 404")
    void resetUnknownSource() {
        when(healthRegistry.isRegistered("ghost")).thenReturn(false);

        webTestClient.post()
                .uri("/api/v1/sources/ghost/reset")
                .exchange()
                .expectStatus().isNotFound();

        verify(healthRegistry, never()).reset(anyString());
    }
}
