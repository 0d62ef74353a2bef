package com.phaseflow.coordinator.service;

/**
 * A submitted phase batch is malformed. Nothing was persisted.
 */
public class PhaseValidationException extends RuntimeException {

    public PhaseValidationException(String message) {
        super(message);
    }

    public PhaseValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
