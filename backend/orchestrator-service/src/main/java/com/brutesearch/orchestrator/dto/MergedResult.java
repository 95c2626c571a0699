package com.brutesearch.orchestrator.dto;

import java.util.List;

/**
 * A deduplicated record together with every source that returned its URL,
 * in the order the sources reported it.
 */
public record MergedResult(
        ResultRecord record,
        List<String> sources
) {
    public MergedResult {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public int sourceCount() {
        return sources.size();
    }
}
