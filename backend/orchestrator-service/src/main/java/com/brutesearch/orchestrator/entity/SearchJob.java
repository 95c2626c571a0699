package com.brutesearch.orchestrator.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checkpoint document for one search job, persisted as {@code <jobId>.json}.
 *
 * <p>{@code completedEngines} and {@code failedEngines} never share a code.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchJob {

    private String jobId;

    private Instant createdAt;

    private Instant updatedAt;

    private String query;

    @Builder.Default
    private List<String> sources = new ArrayList<>();

    @Builder.Default
    private List<String> completedEngines = new ArrayList<>();

    /**
     * source code -> last error message
     */
    @Builder.Default
    private Map<String, String> failedEngines = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, EngineProgress> engineProgress = new LinkedHashMap<>();

    private int resultsCount;

    private int uniqueUrls;

    public static SearchJob start(String jobId, Instant now) {
        return SearchJob.builder()
                .jobId(jobId)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
