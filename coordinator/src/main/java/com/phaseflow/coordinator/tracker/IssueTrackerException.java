package com.phaseflow.coordinator.tracker;

/**
 * Thrown when the issue tracker returns an error or cannot be reached.
 */
public class IssueTrackerException extends RuntimeException {

    public IssueTrackerException(String message) {
        super(message);
    }

    public IssueTrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}
