package com.brutesearch.orchestrator.service.checkpoint;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a previous run of a job already finished.
 */
public record ResumeInfo(
        String jobId,
        String query,
        boolean resumed,
        List<String> completedEngines,
        Map<String, String> failedEngines,
        List<String> pendingEngines,
        int resultsCount,
        int uniqueUrls
) {
    public ResumeInfo {
        completedEngines = List.copyOf(completedEngines);
        failedEngines = Collections.unmodifiableMap(new LinkedHashMap<>(failedEngines));
        pendingEngines = List.copyOf(pendingEngines);
    }

    public boolean hasProgress() {
        return !completedEngines.isEmpty() || !failedEngines.isEmpty();
    }
}
