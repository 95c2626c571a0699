package com.brutesearch.orchestrator.service.buffer;

import com.brutesearch.orchestrator.dto.ResultRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Bounded, URL-deduplicated result collector.
 *
 * <p>When full, the oldest 10% of records (at least one) are evicted and their URLs
 * forgotten, so the seen-set only ever covers what is currently held. An evicted URL
 * can be admitted again later.
 */
@Slf4j
public class ResultBuffer {

    private final int maxSize;
    private final Object lock = new Object();

    // guarded by lock; insertion-ordered, keyed by URL
    private final LinkedHashMap<String, ResultRecord> records = new LinkedHashMap<>();
    private long evictedCount;

    public ResultBuffer(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1: " + maxSize);
        }
        this.maxSize = maxSize;
    }

    /**
     * @return false for a missing URL or one already held
     */
    public boolean add(ResultRecord record) {
        if (record == null || !record.hasUrl()) {
            return false;
        }
        synchronized (lock) {
            return addLocked(record);
        }
    }

    /**
     * @return number of records admitted
     */
    public int addBatch(Collection<ResultRecord> batch) {
        if (batch == null || batch.isEmpty()) {
            return 0;
        }
        int added = 0;
        synchronized (lock) {
            for (ResultRecord record : batch) {
                if (record != null && record.hasUrl() && addLocked(record)) {
                    added++;
                }
            }
        }
        return added;
    }

    private boolean addLocked(ResultRecord record) {
        if (records.containsKey(record.getUrl())) {
            return false;
        }
        if (records.size() >= maxSize) {
            evictOldest();
        }
        records.put(record.getUrl(), record);
        return true;
    }

    private void evictOldest() {
        int toEvict = Math.max(1, maxSize / 10);
        var it = records.entrySet().iterator();
        for (int i = 0; i < toEvict && it.hasNext(); i++) {
            it.next();
            it.remove();
        }
        evictedCount += toEvict;
        log.debug("Result buffer full ({}), evicted {} oldest records", maxSize, toEvict);
    }

    /**
     * Copy of the held records, oldest first.
     */
    public List<ResultRecord> getAll() {
        synchronized (lock) {
            return new ArrayList<>(records.values());
        }
    }

    public boolean contains(String url) {
        if (url == null) {
            return false;
        }
        synchronized (lock) {
            return records.containsKey(url);
        }
    }

    public int size() {
        synchronized (lock) {
            return records.size();
        }
    }

    public void clear() {
        synchronized (lock) {
            records.clear();
        }
    }

    public long evictedCount() {
        synchronized (lock) {
            return evictedCount;
        }
    }

    public int getMaxSize() {
        return maxSize;
    }
}
