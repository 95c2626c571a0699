package com.brutesearch.orchestrator.controller;

import com.brutesearch.orchestrator.dto.EngineHealthSnapshot;
import com.brutesearch.orchestrator.service.resilience.HealthRegistry;
import com.brutesearch.orchestrator.service.resilience.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Source (and fetch tier) health report.
 */
@RestController
@RequestMapping("/api/v1/sources")
@RequiredArgsConstructor
@Slf4j
public class SourceHealthController {

    private final HealthRegistry healthRegistry;
    private final RateLimiter rateLimiter;

    @GetMapping("/health")
    public List<EngineHealthSnapshot> health() {
        return healthRegistry.healthReport();
    }

    @GetMapping("/health/{code}")
    public ResponseEntity<EngineHealthSnapshot> sourceHealth(@PathVariable String code) {
        return healthRegistry.snapshot(code)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/rate-limit")
    public Map<String, Object> rateLimit() {
        return Map.of(
                "maxConcurrent", rateLimiter.getMaxConcurrent(),
                "availablePermits", rateLimiter.availablePermits(),
                "requestsPerSecond", rateLimiter.getRequestsPerSecond()
        );
    }

    /**
     * Clears a source's counters and closes its breaker.
     */
    @PostMapping("/{code}/reset")
    public ResponseEntity<Map<String, Object>> reset(@PathVariable String code) {
        if (!healthRegistry.isRegistered(code)) {
            return ResponseEntity.notFound().build();
        }
        healthRegistry.reset(code);
        log.info("Health reset requested for {}", code);
        return ResponseEntity.ok(Map.of("code", code, "reset", true));
    }
}
