package com.brutesearch.orchestrator.service.resilience;

import com.brutesearch.orchestrator.config.OrchestratorProperties;
import com.brutesearch.orchestrator.entity.ErrorKind;
import com.brutesearch.orchestrator.exception.SourceCallException;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the one shared {@link WebClient} every fetch tier and HTTP source goes through.
 *
 * <p>The client is built on first use and rebuilt if its connection provider has been
 * disposed. reactor-netty keeps one pool per remote address, so {@code maxPerTarget}
 * bounds connections per host; {@code maxConnections} bounds in-flight exchanges across
 * all hosts. An exchange holds its slot until the response body completes, errors or is
 * cancelled, and waits at most {@code acquireTimeoutMs} for one. Build and teardown
 * share one mutex.
 */
@Slf4j
public class ConnectionPool implements AutoCloseable {

    private static final String POOL_NAME = "orchestrator-http";

    private final OrchestratorProperties.ConnectionPool config;
    private final Semaphore inFlightExchanges;
    private final Object lock = new Object();

    // guarded by lock
    private ConnectionProvider provider;
    private WebClient client;
    private int creationCount;

    public ConnectionPool(OrchestratorProperties.ConnectionPool config) {
        this.config = config;
        this.inFlightExchanges = new Semaphore(config.getMaxConnections(), true);
    }

    /**
     * Shared client; constructs one if none exists or the previous one was closed.
     */
    public WebClient get() {
        synchronized (lock) {
            if (client == null || provider == null || provider.isDisposed()) {
                build();
            }
            return client;
        }
    }

    private void build() {
        provider = ConnectionProvider.builder(POOL_NAME)
                .maxConnections(config.getMaxPerTarget())
                .pendingAcquireMaxCount(-1)
                .pendingAcquireTimeout(Duration.ofMillis(config.getAcquireTimeoutMs()))
                .maxIdleTime(Duration.ofSeconds(30))
                .build();

        int readTimeout = config.getReadTimeoutMs();
        HttpClient httpClient = HttpClient.create(provider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, config.getConnectTimeoutMs())
                .responseTimeout(Duration.ofMillis(readTimeout))
                .resolver(spec -> spec.cacheMaxTimeToLive(Duration.ofSeconds(config.getDnsCacheTtlSeconds())))
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(readTimeout, TimeUnit.MILLISECONDS))
                                .addHandlerLast(new WriteTimeoutHandler(readTimeout, TimeUnit.MILLISECONDS))
                )
                .followRedirect(true);

        client = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .filter(inFlightLimit())
                .defaultHeader("User-Agent", config.getUserAgent())
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(8 * 1024 * 1024))
                .build();

        creationCount++;
        log.info("Created shared HTTP client #{} (maxConnections={}, maxPerTarget={}, dnsTtl={}s)",
                creationCount, config.getMaxConnections(), config.getMaxPerTarget(),
                config.getDnsCacheTtlSeconds());
    }

    private ExchangeFilterFunction inFlightLimit() {
        return (request, next) -> Mono.fromCallable(this::acquireExchangeSlot)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(slot -> next.exchange(request)
                        .map(response -> response.mutate()
                                .body(body -> body.doFinally(signal -> slot.release()))
                                .build())
                        .doOnError(e -> slot.release())
                        .doOnCancel(slot::release));
    }

    private ExchangeSlot acquireExchangeSlot() throws InterruptedException {
        if (!inFlightExchanges.tryAcquire(config.getAcquireTimeoutMs(), TimeUnit.MILLISECONDS)) {
            throw new SourceCallException(ErrorKind.CONNECTION_FAILURE,
                    "no free connection slot within " + config.getAcquireTimeoutMs() + "ms");
        }
        return new ExchangeSlot(inFlightExchanges);
    }

    /**
     * Free in-flight slots right now.
     */
    public int availableExchangeSlots() {
        return inFlightExchanges.availablePermits();
    }

    /**
     * Disposes the transport. Safe to call any number of times.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (provider != null && !provider.isDisposed()) {
                provider.dispose();
                log.info("Closed shared HTTP client #{}", creationCount);
            }
            provider = null;
            client = null;
        }
    }

    public boolean isOpen() {
        synchronized (lock) {
            return client != null && provider != null && !provider.isDisposed();
        }
    }

    public int getCreationCount() {
        synchronized (lock) {
            return creationCount;
        }
    }

    private static final class ExchangeSlot {
        private final Semaphore slots;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private ExchangeSlot(Semaphore slots) {
            this.slots = slots;
        }

        private void release() {
            if (released.compareAndSet(false, true)) {
                slots.release();
            }
        }
    }
}
