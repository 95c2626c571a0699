package com.brutesearch.orchestrator.dto;

import com.brutesearch.orchestrator.entity.MergeStrategy;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Result of one fan-out search.
 *
 * <ul>
 *   <li>{@code results}: merged list in the requested strategy's order</li>
 *   <li>{@code mergedResults}: per-URL source sets, filled for RANKED and INTERLEAVE</li>
 *   <li>{@code perSourceOutcome}: one entry per requested source, always</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class SearchResponse {

    private String query;

    private MergeStrategy mergeStrategy;

    private List<ResultRecord> results;

    private List<MergedResult> mergedResults;

    private Map<String, List<ResultRecord>> perSourceResults;

    private Map<String, SourceOutcome> perSourceOutcome;

    private SearchStatistics statistics;

    /**
     * Job deadline hit; results are partial
     */
    private boolean timedOut;
}
