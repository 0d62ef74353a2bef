package com.phaseflow.coordinator.api.dto;

import com.phaseflow.coordinator.model.PhaseRecord;
import com.phaseflow.coordinator.service.ExecutorResult;

import java.util.List;
import java.util.UUID;

/**
 * Response body for POST /queue/{queueId}/result.
 *
 * nextQueueId is the successor that became READY; the coordinator dispatches
 * it on its next tick unless the queue is paused.
 */
public record ExecutorResultResponse(
        boolean    success,
        String     message,
        boolean    phaseUpdated,
        UUID       nextQueueId,
        List<UUID> blockedQueueIds
) {
    public static ExecutorResultResponse from(ExecutorResult result) {
        String message;
        if (!result.phaseUpdated()) {
            message = "Duplicate result, already processed";
        } else if (result.promoted() != null) {
            message = "Phase " + result.promoted().getPhaseNumber() + " is ready";
        } else if (!result.blocked().isEmpty()) {
            message = result.blocked().size() + " dependent phase(s) blocked";
        } else {
            message = "Result recorded";
        }
        return new ExecutorResultResponse(
                true,
                message,
                result.phaseUpdated(),
                result.promoted() == null ? null : result.promoted().getQueueId(),
                result.blocked().stream().map(PhaseRecord::getQueueId).toList());
    }
}
