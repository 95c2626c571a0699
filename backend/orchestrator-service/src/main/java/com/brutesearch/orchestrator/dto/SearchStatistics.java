package com.brutesearch.orchestrator.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 검색 1회 실행 통계
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchStatistics {

    private int totalSources;

    private int successfulSources;

    private int failedSources;

    private int timedOutSources;

    /**
     * Sources refused by an open circuit breaker
     */
    private int skippedSources;

    private int totalResults;

    private int uniqueResults;

    private double successRate;

    private long elapsedMs;
}
