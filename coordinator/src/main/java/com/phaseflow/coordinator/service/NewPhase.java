package com.phaseflow.coordinator.service;

import java.util.Map;

/**
 * One phase of a batch being submitted.
 *
 * @param dependsOnPhase predecessor phase number; null means "the previous phase"
 *                       (and nothing for phase 1)
 * @param payload        opaque data for the executor (title, content, references, ...)
 */
public record NewPhase(int phaseNumber, Integer dependsOnPhase, Map<String, Object> payload) {

    public NewPhase {
        if (payload == null) payload = Map.of();
    }
}
