package com.brutesearch.orchestrator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Orchestration settings, bound once at startup from {@code orchestrator.*}.
 *
 * Every component receives the group it needs through its constructor;
 * nothing reads these values lazily at call time.
 */
@ConfigurationProperties(prefix = "orchestrator")
@Validated
@Data
public class OrchestratorProperties {

    @Valid
    private RateLimit rateLimit = new RateLimit();

    @Valid
    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    @Valid
    private Buffer buffer = new Buffer();

    @Valid
    private Job job = new Job();

    @Valid
    private Checkpoint checkpoint = new Checkpoint();

    @Valid
    private ConnectionPool connectionPool = new ConnectionPool();

    @Valid
    private Fetch fetch = new Fetch();

    @Valid
    private Events events = new Events();

    @Valid
    private Sink sink = new Sink();

    @Data
    public static class RateLimit {
        /** Maximum outstanding source calls across the process */
        @Min(1)
        private int maxConcurrent = 10;

        /** Minimum spacing between admitted calls is 1 / requestsPerSecond */
        @DecimalMin(value = "0.0", inclusive = false)
        private double requestsPerSecond = 5.0;
    }

    @Data
    public static class CircuitBreaker {
        @Min(1)
        private int failureThreshold = 5;

        @Min(1)
        private int timeoutThreshold = 3;

        @Min(1)
        private long recoveryTimeoutSeconds = 300;

        @Min(0)
        private int minRequestsBeforeBreaking = 3;

        public Duration recoveryTimeout() {
            return Duration.ofSeconds(recoveryTimeoutSeconds);
        }
    }

    @Data
    public static class Buffer {
        @Min(1)
        private int maxSize = 10_000;
    }

    @Data
    public static class Job {
        /** Whole-search deadline; outstanding calls are cancelled and reported as timeouts */
        @Min(1)
        private long jobTimeoutSeconds = 300;

        @Min(1)
        private long callTimeoutSeconds = 60;

        /** Global worker count for source calls, independent of the rate limiter */
        @Min(1)
        private int maxWorkers = 10;

        @Min(1)
        private int maxResultsPerSource = 100;
    }

    @Data
    public static class Checkpoint {
        @NotBlank
        private String dir = "./checkpoints";

        /** Persist after this many sub-query completions */
        @Min(1)
        private int saveEvery = 10;
    }

    @Data
    public static class ConnectionPool {
        @Min(1)
        private int maxConnections = 100;

        @Min(1)
        private int maxPerTarget = 20;

        @Min(0)
        private long dnsCacheTtlSeconds = 300;

        @Min(1)
        private int connectTimeoutMs = 10_000;

        @Min(1)
        private int readTimeoutMs = 30_000;

        /** Longest wait for a free connection slot before the exchange fails */
        @Min(1)
        private int acquireTimeoutMs = 10_000;

        @NotBlank
        private String userAgent = "BruteSearch-Orchestrator/1.0";
    }

    @Data
    public static class Fetch {
        /** Extracted text shorter than this is treated as a failed fetch */
        @Min(0)
        private int minContentLength = 500;

        /** Cheapest first. The chain tries them in this order. */
        @Valid
        private List<Tier> tiers = new ArrayList<>();
    }

    @Data
    public static class Tier {
        @NotBlank
        private String name;

        @NotNull
        private TierType type;

        /** Service endpoint for crawler and unlocker tiers; unused by DIRECT_HTTP */
        private String baseUrl;

        private String apiKey;

        @Min(1)
        private int maxConcurrent = 5;

        @Min(1)
        private long timeoutSeconds = 30;

        private boolean enabled = true;
    }

    public enum TierType {
        DIRECT_HTTP,
        REMOTE_CRAWLER,
        UNLOCKER_API
    }

    @Data
    public static class Events {
        @Min(1)
        private int capacity = 256;
    }

    @Data
    public static class Sink {
        @NotBlank
        private String dir = "./results";
    }
}
