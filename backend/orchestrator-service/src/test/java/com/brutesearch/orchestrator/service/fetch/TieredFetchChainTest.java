package com.brutesearch.orchestrator.service.fetch;

import com.brutesearch.orchestrator.config.OrchestratorProperties;
import com.brutesearch.orchestrator.dto.EngineHealthSnapshot.BreakerState;
import com.brutesearch.orchestrator.dto.FetchAttempt;
import com.brutesearch.orchestrator.dto.FetchOutcome;
import com.brutesearch.orchestrator.dto.ResultRecord;
import com.brutesearch.orchestrator.entity.ErrorKind;
import com.brutesearch.orchestrator.entity.FetchStatus;
import com.brutesearch.orchestrator.exception.SourceCallException;
import com.brutesearch.orchestrator.service.resilience.HealthRegistry;
import com.brutesearch.orchestrator.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * TieredFetchChain 단위 테스트
 */
class TieredFetchChainTest {

    private static final int MIN_LENGTH = 50;
    private static final String GOOD_PAGE = "<html><body><p>" + "article text ".repeat(10) + "</p></body></html>";
    private static final String SHORT_PAGE = "<html><body><p>tiny</p></body></html>";
    private static final String CAPTCHA_PAGE = "<html><body>Please solve the captcha</body></html>";

    private HealthRegistry healthRegistry;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        OrchestratorProperties.CircuitBreaker breaker = new OrchestratorProperties.CircuitBreaker();
        breaker.setFailureThreshold(2);
        breaker.setMinRequestsBeforeBreaking(2);
        healthRegistry = new HealthRegistry(breaker, Clock.systemUTC());
        meterRegistry = new SimpleMeterRegistry();
    }

    private TieredFetchChain chain(StubTier... tiers) {
        return new TieredFetchChain(Arrays.asList(tiers), healthRegistry, MIN_LENGTH, meterRegistry);
    }

    private static Mono<String> connectionFailure(String url) {
        return Mono.error(new SourceCallException(ErrorKind.CONNECTION_FAILURE, "connection refused"));
    }

    @Nested
    @DisplayName("단계별 에스컬레이션")
    class EscalationTests {

        @Test
        @DisplayName("3단계에서 성공하면 4, 5단계는 호출되지 않는다")
        void stopsAtFirstAcceptingTier() {
            // given
            StubTier direct = new StubTier("direct", TieredFetchChainTest::connectionFailure);
            StubTier crawler = new StubTier("crawler", url -> Mono.just(SHORT_PAGE));
            StubTier browser = new StubTier("browser", url -> Mono.just(GOOD_PAGE));
            StubTier unlocker = new StubTier("unlocker", url -> Mono.just(GOOD_PAGE));
            StubTier premium = new StubTier("premium", url -> Mono.just(GOOD_PAGE));
            TieredFetchChain chain = chain(direct, crawler, browser, unlocker, premium);

            // when
            FetchOutcome outcome = chain.fetch("https://news.example/a").block();

            // then
            assertThat(outcome).isNotNull();
            assertThat(outcome.status()).isEqualTo(FetchStatus.SUCCESS);
            assertThat(outcome.methodUsed()).isEqualTo("browser");
            assertThat(outcome.content()).isEqualTo(GOOD_PAGE);
            assertThat(outcome.attempts()).extracting(FetchAttempt::method)
                    .containsExactly("direct", "crawler", "browser");
            assertThat(outcome.attempts().get(1).errorKind()).isEqualTo(ErrorKind.PARSE_FAILURE);
            assertThat(unlocker.calls).isEmpty();
            assertThat(premium.calls).isEmpty();
        }

        @Test
        @DisplayName("다음 단계는 이전 단계에서 실패한 URL만 받는다")
        void nextWaveGetsResidualOnly() {
            StubTier direct = new StubTier("direct",
                    url -> url.endsWith("/ok") ? Mono.just(GOOD_PAGE) : Mono.just(SHORT_PAGE));
            StubTier crawler = new StubTier("crawler", url -> Mono.just(GOOD_PAGE));
            TieredFetchChain chain = chain(direct, crawler);

            Map<String, FetchOutcome> outcomes = chain.fetchAll(List.of(
                    "https://site/ok", "https://site/hard", "https://site/ok", " ")).block();

            assertThat(outcomes).containsOnlyKeys("https://site/ok", "https://site/hard");
            assertThat(outcomes.get("https://site/ok").methodUsed()).isEqualTo("direct");
            assertThat(outcomes.get("https://site/hard").methodUsed()).isEqualTo("crawler");
            assertThat(direct.calls).containsExactlyInAnyOrder("https://site/ok", "https://site/hard");
            assertThat(crawler.calls).containsExactly("https://site/hard");
        }

        @Test
        @DisplayName("빈 응답은 parse_failure로 기록되고 다음 단계로 넘어간다")
        void emptyResponseEscalates() {
            StubTier direct = new StubTier("direct", url -> Mono.empty());
            StubTier crawler = new StubTier("crawler", url -> Mono.just(GOOD_PAGE));

            FetchOutcome outcome = chain(direct, crawler).fetch("https://site/x").block();

            assertThat(outcome.methodUsed()).isEqualTo("crawler");
            assertThat(outcome.attempts().get(0).errorKind()).isEqualTo(ErrorKind.PARSE_FAILURE);
        }

        @Test
        @DisplayName("단계 타임아웃은 timeout으로 분류된다")
        void tierTimeoutIsClassified() {
            StubTier slow = new StubTier("slow", Duration.ofMillis(100), url -> Mono.never());
            StubTier crawler = new StubTier("crawler", url -> Mono.just(GOOD_PAGE));

            FetchOutcome outcome = chain(slow, crawler).fetch("https://site/slow").block(Duration.ofSeconds(5));

            assertThat(outcome.status()).isEqualTo(FetchStatus.SUCCESS);
            assertThat(outcome.attempts().get(0).errorKind()).isEqualTo(ErrorKind.TIMEOUT);
        }
    }

    @Nested
    @DisplayName("모든 단계 실패")
    class ExhaustionTests {

        @Test
        @DisplayName("차단 응답이 하나라도 있으면 BLOCKED")
        void blockedWhenAnyTierWasBlocked() {
            StubTier direct = new StubTier("direct", url -> Mono.just(CAPTCHA_PAGE));
            StubTier crawler = new StubTier("crawler", TieredFetchChainTest::connectionFailure);

            StepVerifier.create(chain(direct, crawler).fetch("https://guarded.example"))
                    .assertNext(outcome -> {
                        assertThat(outcome.status()).isEqualTo(FetchStatus.BLOCKED);
                        assertThat(outcome.methodUsed()).isNull();
                        assertThat(outcome.content()).isNull();
                        assertThat(outcome.attempts()).hasSize(2);
                        assertThat(outcome.attempts().get(0).errorKind()).isEqualTo(ErrorKind.BLOCKED);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("차단 없이 실패하면 FAILED")
        void failedOtherwise() {
            StubTier direct = new StubTier("direct", TieredFetchChainTest::connectionFailure);
            StubTier crawler = new StubTier("crawler", url -> Mono.just(SHORT_PAGE));

            FetchOutcome outcome = chain(direct, crawler).fetch("https://down.example").block();

            assertThat(outcome.status()).isEqualTo(FetchStatus.FAILED);
            assertThat(outcome.isSuccess()).isFalse();
        }

        @Test
        @DisplayName("빈 URL은 시도 없이 실패한다")
        void blankUrl() {
            StubTier direct = new StubTier("direct", url -> Mono.just(GOOD_PAGE));

            FetchOutcome outcome = chain(direct).fetch("").block();

            assertThat(outcome.status()).isEqualTo(FetchStatus.FAILED);
            assertThat(direct.calls).isEmpty();
        }
    }

    @Nested
    @DisplayName("단계별 Circuit Breaker")
    class BreakerTests {

        @Test
        @DisplayName("회로가 열린 단계는 건너뛴다")
        void skipsTierWithOpenBreaker() {
            // given
            StubTier direct = new StubTier("direct", url -> Mono.just(GOOD_PAGE));
            StubTier crawler = new StubTier("crawler", url -> Mono.just(GOOD_PAGE));
            TieredFetchChain chain = chain(direct, crawler);
            String code = TieredFetchChain.HEALTH_PREFIX + "direct";
            for (int i = 0; i < 2; i++) {
                Instant start = healthRegistry.recordStart(code);
                healthRegistry.recordFailure(code, start, ErrorKind.BLOCKED, "403");
            }

            // when
            FetchOutcome outcome = chain.fetch("https://site/y").block();

            // then
            assertThat(direct.calls).isEmpty();
            assertThat(outcome.methodUsed()).isEqualTo("crawler");
            assertThat(outcome.attempts().get(0).errorKind()).isEqualTo(ErrorKind.CIRCUIT_OPEN);
        }

        @Test
        @DisplayName("half-open 단계에는 probe 하나만 보내고 나머지 URL은 다음 단계로 넘긴다")
        void halfOpenTierGetsSingleProbe() {
            // given
            OrchestratorProperties.CircuitBreaker breaker = new OrchestratorProperties.CircuitBreaker();
            breaker.setFailureThreshold(2);
            breaker.setMinRequestsBeforeBreaking(2);
            MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
            healthRegistry = new HealthRegistry(breaker, clock);

            StubTier paid = new StubTier("paid", url -> Mono.delay(Duration.ofMillis(500)).thenReturn(GOOD_PAGE));
            StubTier premium = new StubTier("premium", url -> Mono.just(GOOD_PAGE));
            TieredFetchChain chain = chain(paid, premium);
            String code = TieredFetchChain.HEALTH_PREFIX + "paid";
            for (int i = 0; i < 2; i++) {
                Instant start = healthRegistry.recordStart(code);
                healthRegistry.recordFailure(code, start, ErrorKind.BLOCKED, "403");
            }
            clock.advance(breaker.recoveryTimeout().plusSeconds(1));
            List<String> urls = List.of("https://p/1", "https://p/2", "https://p/3", "https://p/4", "https://p/5");

            // when
            Map<String, FetchOutcome> outcomes = chain.fetchAll(urls).block();

            // then
            assertThat(paid.calls).hasSize(1);
            assertThat(premium.calls).hasSize(4);
            assertThat(outcomes.values()).allMatch(FetchOutcome::isSuccess);
            assertThat(outcomes.values())
                    .filteredOn(o -> o.attempts().get(0).errorKind() == ErrorKind.CIRCUIT_OPEN)
                    .hasSize(4)
                    .allMatch(o -> "premium".equals(o.methodUsed()));
            assertThat(healthRegistry.snapshot(code).orElseThrow().breakerState()).isEqualTo(BreakerState.CLOSED);
        }

        @Test
        @DisplayName("단계 결과가 건강 레지스트리와 메트릭에 기록된다")
        void recordsHealthAndMetrics() {
            StubTier direct = new StubTier("direct",
                    url -> url.contains("good") ? Mono.just(GOOD_PAGE) : connectionFailure(url));
            TieredFetchChain chain = chain(direct);

            chain.fetchAll(List.of("https://good/1", "https://bad/1")).block();

            var snapshot = healthRegistry.snapshot("fetch:direct").orElseThrow();
            assertThat(snapshot.successfulRequests()).isEqualTo(1);
            assertThat(snapshot.failedRequests()).isEqualTo(1);
            assertThat(meterRegistry.get("orchestrator.fetch.attempts")
                    .tag("tier", "direct").tag("result", "success").counter().count()).isEqualTo(1.0);
            assertThat(chain.tierNames()).containsExactly("direct");
        }
    }

    @Nested
    @DisplayName("단계 동시 실행 한도")
    class SlotTests {

        @Test
        @DisplayName("슬롯을 기다리는 시간이 한도를 넘으면 TIMEOUT으로 다음 단계로 넘어간다")
        void slotWaitIsBounded() throws InterruptedException {
            // given
            StubTier single = new StubTier("single", Duration.ofSeconds(10),
                    url -> url.endsWith("/hang") ? Mono.never() : Mono.just(GOOD_PAGE))
                    .limitedTo(1, Duration.ofMillis(100));
            StubTier backup = new StubTier("backup", url -> Mono.just(GOOD_PAGE));
            TieredFetchChain chain = chain(single, backup);

            Disposable hanging = chain.fetch("https://slow/hang").subscribe();
            try {
                long deadline = System.currentTimeMillis() + 5_000;
                while (single.calls.isEmpty() && System.currentTimeMillis() < deadline) {
                    Thread.sleep(10);
                }
                assertThat(single.calls).containsExactly("https://slow/hang");

                // when
                FetchOutcome outcome = chain.fetch("https://slow/next").block(Duration.ofSeconds(5));

                // then
                assertThat(outcome.methodUsed()).isEqualTo("backup");
                FetchAttempt waited = outcome.attempts().get(0);
                assertThat(waited.method()).isEqualTo("single");
                assertThat(waited.errorKind()).isEqualTo(ErrorKind.TIMEOUT);
                assertThat(single.calls).containsExactly("https://slow/hang");
            } finally {
                hanging.dispose();
            }
        }
    }

    @Nested
    @DisplayName("검색 결과 본문 보강")
    class EnrichTests {

        @Test
        @DisplayName("성공한 URL만 본문과 페치 메타데이터가 채워진다")
        void enrichesFetchedRecordsOnly() {
            // given
            StubTier direct = new StubTier("direct",
                    url -> url.endsWith("/ok") ? Mono.just(GOOD_PAGE) : Mono.just(SHORT_PAGE));
            TieredFetchChain chain = chain(direct);
            ResultRecord ok = ResultRecord.of("https://news.example/ok", "OK", null, "s1");
            ok.getPayload().put("rank", 1);
            ResultRecord thin = ResultRecord.of("https://news.example/thin", "Thin", null, "s1");
            ResultRecord noUrl = ResultRecord.of(null, "No url", null, "s2");

            // when
            List<ResultRecord> enriched = chain.enrich(List.of(ok, thin, noUrl)).block();

            // then
            assertThat(enriched).hasSize(3);
            ResultRecord first = enriched.get(0);
            assertThat(first.getFetchMethod()).isEqualTo("direct");
            assertThat(first.getFetchLatencyMs()).isNotNull();
            assertThat(first.getPayload()).containsEntry("rank", 1).containsEntry("content", GOOD_PAGE);
            assertThat(ok.getPayload()).doesNotContainKey("content");
            assertThat(enriched.get(1)).isSameAs(thin);
            assertThat(enriched.get(2)).isSameAs(noUrl);
        }

        @Test
        @DisplayName("fetchLatencyMs는 실패한 앞 단계를 빼고 수락한 단계의 지연 시간만 담는다")
        void latencyIsAcceptingTiersOwn() {
            // given
            StubTier direct = new StubTier("direct",
                    url -> Mono.delay(Duration.ofMillis(1500)).then(connectionFailure(url)));
            StubTier crawler = new StubTier("crawler", url -> Mono.just(GOOD_PAGE));
            ResultRecord record = ResultRecord.of("https://news.example/a", "A", null, "s1");

            // when
            ResultRecord enriched = chain(direct, crawler).enrich(List.of(record)).block().get(0);

            // then
            assertThat(enriched.getFetchMethod()).isEqualTo("crawler");
            assertThat(enriched.getFetchLatencyMs()).isLessThan(1500L);
        }

        @Test
        @DisplayName("URL이 없는 결과만 있으면 어떤 단계도 호출하지 않는다")
        void noUrlsNoFetch() {
            StubTier direct = new StubTier("direct", url -> Mono.just(GOOD_PAGE));
            ResultRecord noUrl = ResultRecord.of(" ", "blank", null, "s1");

            List<ResultRecord> enriched = chain(direct).enrich(List.of(noUrl)).block();

            assertThat(enriched).containsExactly(noUrl);
            assertThat(direct.calls).isEmpty();
        }
    }

    /**
     * Records every URL it is asked for and answers with the given function.
     */
    private static final class StubTier implements FetchTier {

        private final String name;
        private final Duration timeout;
        private final Function<String, Mono<String>> behaviour;
        private final List<String> calls = new CopyOnWriteArrayList<>();
        private int maxConcurrent = 4;
        private Duration slotWait;

        StubTier(String name, Function<String, Mono<String>> behaviour) {
            this(name, Duration.ofSeconds(5), behaviour);
        }

        StubTier(String name, Duration timeout, Function<String, Mono<String>> behaviour) {
            this.name = name;
            this.timeout = timeout;
            this.behaviour = behaviour;
        }

        @Override
        public String getName() {
            return name;
        }

        StubTier limitedTo(int maxConcurrent, Duration slotWait) {
            this.maxConcurrent = maxConcurrent;
            this.slotWait = slotWait;
            return this;
        }

        @Override
        public int getMaxConcurrent() {
            return maxConcurrent;
        }

        @Override
        public Duration getSlotWaitTimeout() {
            return slotWait != null ? slotWait : timeout;
        }

        @Override
        public Duration getTimeout() {
            return timeout;
        }

        @Override
        public Mono<String> fetch(String url) {
            calls.add(url);
            return behaviour.apply(url);
        }
    }
}
