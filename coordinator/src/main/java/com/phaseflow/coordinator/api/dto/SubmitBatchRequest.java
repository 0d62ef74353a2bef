package com.phaseflow.coordinator.api.dto;

import com.phaseflow.coordinator.service.NewPhase;

import java.util.List;
import java.util.Map;

/**
 * Request body for POST /queue.
 *
 * Required: parentTaskId, phases
 * Optional: autoStart (default true), dispatches phase 1 right away unless the
 *   queue is paused. With autoStart=false phase 1 waits READY for
 *   POST /queue/{queueId}/execute.
 */
public record SubmitBatchRequest(Long parentTaskId, Boolean autoStart, List<Phase> phases) {

    public SubmitBatchRequest {
        if (autoStart == null) autoStart = true;
    }

    /**
     * @param dependsOnPhase omitted means "the previous phase"
     */
    public record Phase(int phaseNumber, Integer dependsOnPhase, Map<String, Object> payload) {

        public NewPhase toNewPhase() {
            return new NewPhase(phaseNumber, dependsOnPhase, payload);
        }
    }

    public List<NewPhase> toNewPhases() {
        return phases == null ? List.of() : phases.stream().map(Phase::toNewPhase).toList();
    }
}
