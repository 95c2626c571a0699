package com.brutesearch.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One search hit. {@code url} is the deduplication key across sources.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResultRecord {

    private String url;

    private String title;

    private String snippet;

    /**
     * Source-specific extras (rank, published date, raw score ...)
     */
    @Builder.Default
    private Map<String, Object> payload = new LinkedHashMap<>();

    private String sourceCode;

    // ========== 페치 메타데이터 (tiered fetch 경유 시) ==========

    private String fetchMethod;

    private Long fetchLatencyMs;

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }

    public static ResultRecord of(String url, String title, String snippet, String sourceCode) {
        return ResultRecord.builder()
                .url(url)
                .title(title)
                .snippet(snippet)
                .sourceCode(sourceCode)
                .build();
    }
}
