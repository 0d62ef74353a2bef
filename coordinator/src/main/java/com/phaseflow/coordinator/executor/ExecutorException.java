package com.phaseflow.coordinator.executor;

/**
 * Thrown when the execution service returns an error or is unreachable.
 * The coordinator treats it as transient and retries on the next tick.
 */
public class ExecutorException extends RuntimeException {

    public ExecutorException(String message) {
        super(message);
    }

    public ExecutorException(String message, Throwable cause) {
        super(message, cause);
    }
}
