package com.brutesearch.orchestrator.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 체크포인트 기반 검색 작업 실행 결과
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchJobResult {

    private String jobId;

    private String query;

    /**
     * True when this run picked up an existing checkpoint
     */
    private boolean resumed;

    /**
     * Sources skipped because a previous run already finished them
     */
    private List<String> skippedSources;

    private List<String> attemptedSources;

    private Map<String, SourceOutcome> perSourceOutcome;

    private List<ResultRecord> results;

    private SearchStatistics statistics;

    private boolean timedOut;

    /**
     * False when the checkpoint was kept for a later resume
     */
    private boolean checkpointCleared;

    private String progressSummary;
}
