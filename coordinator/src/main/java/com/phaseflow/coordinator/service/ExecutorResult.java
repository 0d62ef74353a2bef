package com.phaseflow.coordinator.service;

import com.phaseflow.coordinator.model.PhaseRecord;

import java.util.List;

/**
 * Outcome of applying a pushed executor result to a phase.
 *
 * @param phaseUpdated false when the phase already carried this result
 * @param promoted     successor moved to READY, null if none
 * @param blocked      dependents blocked by a failure
 */
public record ExecutorResult(boolean phaseUpdated, PhaseRecord promoted, List<PhaseRecord> blocked) {

    static ExecutorResult alreadyApplied() {
        return new ExecutorResult(false, null, List.of());
    }
}
