package com.brutesearch.orchestrator.entity;

import com.brutesearch.orchestrator.exception.SourceCallException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

/**
 * Failure taxonomy shared by source calls, fetch tiers and checkpoint recovery.
 * The code is what ends up in outcome maps, events and checkpoint documents.
 */
public enum ErrorKind {
    TIMEOUT("timeout", "Call exceeded its time limit"),
    CONNECTION_FAILURE("connection_failure", "Could not reach the remote service"),
    RATE_LIMITED("rate_limited", "Remote service is rate limiting us"),
    BLOCKED("blocked", "Explicit denial (anti-bot, captcha, forbidden)"),
    PARSE_FAILURE("parse_failure", "Response could not be interpreted"),
    CIRCUIT_OPEN("circuit_open", "Rejected before attempt, circuit breaker is open"),
    CHECKPOINT_CORRUPT("checkpoint_corrupt", "Checkpoint document unreadable"),
    UNKNOWN("unknown", "Unknown error occurred");

    private final String code;
    private final String description;

    ErrorKind(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Classify a throwable. Explicit kinds win, then HTTP status, then exception type,
     * then message keywords.
     */
    public static ErrorKind fromException(Throwable e) {
        if (e == null) return UNKNOWN;

        if (e instanceof SourceCallException sce) {
            return sce.getErrorKind();
        }
        if (e instanceof WebClientResponseException wre) {
            ErrorKind byStatus = fromStatusCode(wre.getStatusCode().value());
            if (byStatus != UNKNOWN) return byStatus;
        }
        if (e instanceof TimeoutException) {
            return TIMEOUT;
        }
        if (e instanceof ConnectException || e instanceof UnknownHostException) {
            return CONNECTION_FAILURE;
        }
        if (e instanceof WebClientRequestException && e.getCause() != null && e.getCause() != e) {
            ErrorKind byCause = fromException(e.getCause());
            if (byCause != UNKNOWN) return byCause;
            return CONNECTION_FAILURE;
        }

        String className = e.getClass().getSimpleName().toLowerCase();
        if (className.contains("timeout")) {
            return TIMEOUT;
        }
        if (className.contains("json") || className.contains("parse")) {
            return PARSE_FAILURE;
        }
        return fromErrorMessage(e.getMessage());
    }

    /**
     * Classify a free-form error message (also accepts our own codes).
     */
    public static ErrorKind fromErrorMessage(String errorMessage) {
        if (errorMessage == null || errorMessage.isBlank()) return UNKNOWN;

        String message = errorMessage.toLowerCase();

        for (ErrorKind kind : values()) {
            if (kind != UNKNOWN && message.contains(kind.code)) {
                return kind;
            }
        }

        if (message.contains("timeout") || message.contains("timed out")) {
            return TIMEOUT;
        }
        if (message.contains("429") || message.contains("rate limit") || message.contains("too many requests")) {
            return RATE_LIMITED;
        }
        if (message.contains("captcha") || message.contains("403") || message.contains("forbidden")
                || message.contains("blocked") || message.contains("access denied")) {
            return BLOCKED;
        }
        if (message.contains("connection refused") || message.contains("connection reset")
                || message.contains("unknown host") || message.contains("unreachable")
                || message.contains("dns")) {
            return CONNECTION_FAILURE;
        }
        if (message.contains("parse") || message.contains("json") || message.contains("malformed")) {
            return PARSE_FAILURE;
        }
        return UNKNOWN;
    }

    public static ErrorKind fromStatusCode(int status) {
        if (status == 429) return RATE_LIMITED;
        if (status == 403 || status == 451) return BLOCKED;
        if (status == 408 || status == 504) return TIMEOUT;
        if (status >= 500) return CONNECTION_FAILURE;
        return UNKNOWN;
    }
}
