package com.brutesearch.orchestrator.service.event;

import com.brutesearch.orchestrator.dto.SearchEvent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 검색 진행 이벤트 발행기.
 *
 * <p>Publishers never block: events go into a bounded queue that one daemon thread
 * drains, handing each event to the listeners of its job and then to the global ones.
 * When the queue is full the oldest queued event is dropped.
 */
@Slf4j
public class SearchEventPublisher implements AutoCloseable {

    private final BlockingQueue<SearchEvent> queue;
    private final Map<String, List<Consumer<SearchEvent>>> jobListeners = new ConcurrentHashMap<>();
    private final List<Consumer<SearchEvent>> globalListeners = new CopyOnWriteArrayList<>();
    private final AtomicLong droppedEvents = new AtomicLong();
    private final AtomicLong deliveredEvents = new AtomicLong();
    private final Thread consumer;
    private volatile boolean running = true;

    public SearchEventPublisher(int capacity) {
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.consumer = new Thread(this::drain, "search-event-publisher");
        this.consumer.setDaemon(true);
        this.consumer.start();
    }

    // ============================================
    // Publishing
    // ============================================

    public void publish(SearchEvent event) {
        if (event == null || !running) {
            return;
        }
        synchronized (queue) {
            if (!queue.offer(event)) {
                SearchEvent dropped = queue.poll();
                long total = droppedEvents.incrementAndGet();
                log.warn("Event queue full, dropped oldest event {} for job {} (total dropped: {})",
                        dropped != null ? dropped.type().getValue() : "none",
                        dropped != null ? dropped.jobId() : "-", total);
                queue.offer(event);
            }
        }
    }

    private void drain() {
        while (running || !queue.isEmpty()) {
            try {
                SearchEvent event = queue.poll(200, TimeUnit.MILLISECONDS);
                if (event != null) {
                    dispatch(event);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("Search event consumer stopped");
    }

    private void dispatch(SearchEvent event) {
        List<Consumer<SearchEvent>> forJob = event.jobId() != null ? jobListeners.get(event.jobId()) : null;
        if (forJob != null) {
            forJob.forEach(listener -> deliver(listener, event));
        }
        globalListeners.forEach(listener -> deliver(listener, event));
        deliveredEvents.incrementAndGet();
    }

    private void deliver(Consumer<SearchEvent> listener, SearchEvent event) {
        try {
            listener.accept(event);
        } catch (Exception e) {
            log.warn("Event listener failed on {} for job {}: {}",
                    event.type().getValue(), event.jobId(), e.getMessage());
        }
    }

    // ============================================
    // Listeners
    // ============================================

    public void addListener(String jobId, Consumer<SearchEvent> listener) {
        jobListeners.computeIfAbsent(jobId, id -> new CopyOnWriteArrayList<>()).add(listener);
    }

    public void removeListener(String jobId, Consumer<SearchEvent> listener) {
        jobListeners.computeIfPresent(jobId, (id, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    public void addGlobalListener(Consumer<SearchEvent> listener) {
        globalListeners.add(listener);
    }

    public void removeGlobalListener(Consumer<SearchEvent> listener) {
        globalListeners.remove(listener);
    }

    /**
     * Live event stream for one job, for SSE subscribers. The listener is removed
     * when the subscriber goes away.
     */
    public Flux<SearchEvent> stream(String jobId) {
        Sinks.Many<SearchEvent> sink = Sinks.many().multicast().onBackpressureBuffer(100);
        Consumer<SearchEvent> listener = event -> {
            sink.tryEmitNext(event);
            if (event.type() == SearchEvent.EventType.SEARCH_COMPLETED) {
                sink.tryEmitComplete();
            }
        };
        return sink.asFlux()
                .doOnSubscribe(sub -> {
                    addListener(jobId, listener);
                    log.info("New event subscriber for job: {}", jobId);
                })
                .doFinally(signal -> {
                    removeListener(jobId, listener);
                    log.info("Event subscriber for job {} finished ({})", jobId, signal);
                });
    }

    // ============================================
    // Lifecycle & stats
    // ============================================

    public long getDroppedCount() {
        return droppedEvents.get();
    }

    public long getDeliveredCount() {
        return deliveredEvents.get();
    }

    public int getQueuedCount() {
        return queue.size();
    }

    /**
     * Stops accepting events, lets the consumer flush what is queued, and waits
     * briefly for it to exit.
     */
    @Override
    public void close() {
        if (!running) {
            return;
        }
        running = false;
        try {
            consumer.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (consumer.isAlive()) {
            consumer.interrupt();
        }
    }
}
