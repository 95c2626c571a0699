package com.brutesearch.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Progress notification emitted while a search runs.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record SearchEvent(
        EventType type,
        String jobId,
        String sourceCode,
        Instant timestamp,
        Map<String, Object> data
) {
    public SearchEvent {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static SearchEvent of(EventType type, String jobId, String sourceCode, Map<String, Object> data) {
        return new SearchEvent(type, jobId, sourceCode, Instant.now(), data);
    }

    public enum EventType {
        SOURCE_STARTED("source_started"),
        SOURCE_COMPLETED("source_completed"),
        SOURCE_FAILED("source_failed"),
        SOURCE_SKIPPED("source_skipped"),
        SEARCH_COMPLETED("search_completed");

        private final String value;

        EventType(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }
}
