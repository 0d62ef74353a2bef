package com.phaseflow.coordinator.service;

import java.util.UUID;

public class PhaseNotFoundException extends RuntimeException {

    public PhaseNotFoundException(UUID queueId) {
        super("Queue ID not found: " + queueId);
    }
}
