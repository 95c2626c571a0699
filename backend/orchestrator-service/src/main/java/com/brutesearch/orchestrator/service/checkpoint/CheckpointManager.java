package com.brutesearch.orchestrator.service.checkpoint;

import com.brutesearch.orchestrator.entity.EngineProgress;
import com.brutesearch.orchestrator.entity.SearchJob;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 검색 작업 체크포인트 관리자.
 *
 * <p>Wraps one {@link SearchJob} and decides when it is written: after every
 * {@code saveEvery} sub-query completions, and always when a source completes or fails.
 * Sources finish concurrently, so every method holds the manager's monitor.
 */
@Slf4j
public class CheckpointManager {

    private static final int MAX_ERROR_LENGTH = 200;

    private final SearchJob job;
    private final CheckpointStore store;
    private final int saveEvery;
    private final Clock clock;
    private final boolean resumed;

    private int completionsSinceSave;

    private CheckpointManager(SearchJob job, CheckpointStore store, int saveEvery, Clock clock, boolean resumed) {
        this.job = job;
        this.store = store;
        this.saveEvery = Math.max(1, saveEvery);
        this.clock = clock;
        this.resumed = resumed;
    }

    /**
     * Loads the job's checkpoint if one is readable, otherwise starts a new document.
     */
    public static CheckpointManager open(String jobId, CheckpointStore store, int saveEvery, Clock clock) {
        return store.load(jobId)
                .map(job -> {
                    log.info("Loaded checkpoint for job {}: {} completed, {} failed",
                            jobId, job.getCompletedEngines().size(), job.getFailedEngines().size());
                    return new CheckpointManager(job, store, saveEvery, clock, true);
                })
                .orElseGet(() -> new CheckpointManager(SearchJob.start(jobId, clock.instant()),
                        store, saveEvery, clock, false));
    }

    // ============================================
    // Updates
    // ============================================

    /**
     * Records the query and source list. Progress already loaded for a source is kept.
     */
    public synchronized void updateQueryInfo(String query, List<String> sources) {
        job.setQuery(query);
        List<String> merged = new ArrayList<>(job.getSources());
        for (String source : sources) {
            if (!merged.contains(source)) {
                merged.add(source);
            }
            job.getEngineProgress().computeIfAbsent(source, code -> new EngineProgress());
        }
        job.setSources(merged);
        save();
    }

    public synchronized void markEngineStarted(String code) {
        EngineProgress progress = progress(code);
        progress.setStatus(EngineProgress.Status.RUNNING);
        progress.setStartedAt(clock.instant());
    }

    public synchronized void markEngineCompleted(String code, int resultCount) {
        if (!job.getCompletedEngines().contains(code)) {
            job.getCompletedEngines().add(code);
        }
        job.getFailedEngines().remove(code);

        EngineProgress progress = progress(code);
        progress.setStatus(EngineProgress.Status.COMPLETED);
        progress.setResultsCount(Math.max(progress.getResultsCount(), resultCount));
        progress.setFinishedAt(clock.instant());
        progress.setError(null);
        save();
    }

    public synchronized void markEngineFailed(String code, String error) {
        String message = truncate(error);
        job.getCompletedEngines().remove(code);
        job.getFailedEngines().put(code, message);

        EngineProgress progress = progress(code);
        progress.setStatus(EngineProgress.Status.FAILED);
        progress.setFinishedAt(clock.instant());
        progress.setError(message);
        save();
    }

    public synchronized void addPendingQueries(String code, List<String> subQueries) {
        EngineProgress progress = progress(code);
        for (String subQuery : subQueries) {
            if (!progress.getCompletedQueries().contains(subQuery)
                    && !progress.getPendingQueries().contains(subQuery)) {
                progress.getPendingQueries().add(subQuery);
            }
        }
    }

    public synchronized void markQueryCompleted(String code, String subQuery, int resultCount) {
        EngineProgress progress = progress(code);
        progress.getPendingQueries().remove(subQuery);
        if (!progress.getCompletedQueries().contains(subQuery)) {
            progress.getCompletedQueries().add(subQuery);
        }
        progress.setResultsCount(progress.getResultsCount() + resultCount);

        completionsSinceSave++;
        if (completionsSinceSave >= saveEvery) {
            save();
        }
    }

    public synchronized void updateResultCounts(int total, int unique) {
        job.setResultsCount(total);
        job.setUniqueUrls(unique);
    }

    /**
     * Writes the document now. A failed write is logged and reported, never thrown:
     * losing a checkpoint must not stop the search.
     */
    public synchronized boolean save() {
        job.setUpdatedAt(clock.instant());
        try {
            store.save(job);
            completionsSinceSave = 0;
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to save checkpoint {}: {}", job.getJobId(), e.getMessage());
            return false;
        }
    }

    // ============================================
    // Queries
    // ============================================

    public synchronized ResumeInfo getResumeInfo() {
        List<String> pending = new ArrayList<>();
        for (String source : job.getSources()) {
            if (shouldResumeEngine(source)) {
                pending.add(source);
            }
        }
        return new ResumeInfo(job.getJobId(), job.getQuery(), resumed,
                job.getCompletedEngines(), job.getFailedEngines(), pending,
                job.getResultsCount(), job.getUniqueUrls());
    }

    /**
     * False for sources a previous run already completed or gave up on.
     */
    public synchronized boolean shouldResumeEngine(String code) {
        return !job.getCompletedEngines().contains(code) && !job.getFailedEngines().containsKey(code);
    }

    public synchronized String progressSummary() {
        int total = job.getSources().size();
        int completed = job.getCompletedEngines().size();
        int failed = job.getFailedEngines().size();
        int pending = Math.max(0, total - completed - failed);
        StringBuilder summary = new StringBuilder()
                .append("Job ").append(job.getJobId())
                .append(": ").append(completed).append('/').append(total).append(" sources completed, ")
                .append(failed).append(" failed, ")
                .append(pending).append(" pending; ")
                .append(job.getResultsCount()).append(" results (")
                .append(job.getUniqueUrls()).append(" unique)");
        if (!job.getFailedEngines().isEmpty()) {
            summary.append("; failed: ");
            boolean first = true;
            for (Map.Entry<String, String> entry : job.getFailedEngines().entrySet()) {
                if (!first) {
                    summary.append(", ");
                }
                summary.append(entry.getKey()).append(" (").append(entry.getValue()).append(')');
                first = false;
            }
        }
        return summary.toString();
    }

    public boolean isResumed() {
        return resumed;
    }

    public String getJobId() {
        return job.getJobId();
    }

    /**
     * Removes both checkpoint files. Call only after a clean completion.
     */
    public synchronized void cleanup() {
        try {
            store.delete(job.getJobId());
            log.info("Checkpoint cleaned up for job {}", job.getJobId());
        } catch (IOException e) {
            log.warn("Failed to delete checkpoint {}: {}", job.getJobId(), e.getMessage());
        }
    }

    private EngineProgress progress(String code) {
        return job.getEngineProgress().computeIfAbsent(code, c -> new EngineProgress());
    }

    private static String truncate(String error) {
        if (error == null) {
            return "unknown error";
        }
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }
}
