package com.brutesearch.orchestrator.dto;

import com.brutesearch.orchestrator.entity.MergeStrategy;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record SearchRequest(
        @NotBlank String query,
        @NotEmpty List<String> sources,
        @Min(1) @Max(1000) Integer maxResultsPerSource,
        MergeStrategy mergeStrategy,
        Boolean fetchContent
) {
    public boolean shouldFetchContent() {
        return Boolean.TRUE.equals(fetchContent);
    }
}
