package com.brutesearch.orchestrator.exception;

/**
 * A checkpoint file exists but cannot be read back into a job.
 */
public class CheckpointCorruptException extends RuntimeException {

    public CheckpointCorruptException(String message) {
        super(message);
    }

    public CheckpointCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
