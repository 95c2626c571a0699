package com.brutesearch.orchestrator.exception;

import com.brutesearch.orchestrator.entity.ErrorKind;
import lombok.Getter;

/**
 * Thrown (or emitted as an error signal) by source adapters and fetch tiers
 * that know exactly what went wrong.
 */
@Getter
public class SourceCallException extends RuntimeException {

    private final ErrorKind errorKind;

    public SourceCallException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    public SourceCallException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }
}
