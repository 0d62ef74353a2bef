package com.phaseflow.coordinator.service;

import com.phaseflow.coordinator.model.PhaseRecord;
import com.phaseflow.coordinator.model.PhaseStatus;

/**
 * An illegal status change was requested. The phase was left unchanged.
 */
public class PhaseTransitionException extends RuntimeException {

    public PhaseTransitionException(String message) {
        super(message);
    }

    static PhaseTransitionException illegal(PhaseRecord phase, PhaseStatus target) {
        return new PhaseTransitionException(String.format(
                "Phase %d of parent %d is %s and cannot become %s",
                phase.getPhaseNumber(), phase.getParentTaskId(), phase.getStatus(), target));
    }
}
