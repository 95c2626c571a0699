package com.brutesearch.orchestrator.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 소스(엔진)별 진행 상황. Part of the checkpoint document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineProgress {

    @Builder.Default
    private Status status = Status.PENDING;

    /**
     * Sub-queries already answered by this source
     */
    @Builder.Default
    private List<String> completedQueries = new ArrayList<>();

    @Builder.Default
    private List<String> pendingQueries = new ArrayList<>();

    private int resultsCount;

    private Instant startedAt;

    private Instant finishedAt;

    private String error;

    public enum Status {
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED
    }
}
