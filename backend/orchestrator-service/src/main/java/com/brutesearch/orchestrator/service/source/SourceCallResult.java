package com.brutesearch.orchestrator.service.source;

import com.brutesearch.orchestrator.dto.ResultRecord;
import com.brutesearch.orchestrator.dto.SourceOutcome;
import com.brutesearch.orchestrator.entity.ErrorKind;

import java.util.List;

/**
 * Value returned across the source-call boundary in place of an exception.
 */
public record SourceCallResult(
        String sourceCode,
        List<ResultRecord> records,
        ErrorKind errorKind,
        String error,
        long latencyMs
) {
    public SourceCallResult {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static SourceCallResult success(String sourceCode, List<ResultRecord> records, long latencyMs) {
        return new SourceCallResult(sourceCode, records, null, null, latencyMs);
    }

    public static SourceCallResult failure(String sourceCode, ErrorKind kind, String error, long latencyMs) {
        return new SourceCallResult(sourceCode, List.of(), kind, error, latencyMs);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public SourceOutcome toOutcome() {
        return isSuccess()
                ? SourceOutcome.success(sourceCode, records.size(), latencyMs)
                : SourceOutcome.failed(sourceCode, errorKind, error, latencyMs);
    }
}
