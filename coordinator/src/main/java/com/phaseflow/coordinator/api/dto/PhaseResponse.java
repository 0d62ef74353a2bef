package com.phaseflow.coordinator.api.dto;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.phaseflow.coordinator.model.PhaseRecord;
import com.phaseflow.coordinator.model.PhaseStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of one phase.
 *
 * payload is emitted as the JSON object that was submitted, not as a string.
 * errorMessage carries the executor's reason for FAILED phases and the
 * upstream phase for BLOCKED ones.
 */
public record PhaseResponse(
        UUID         queueId,
        long         parentTaskId,
        int          phaseNumber,
        PhaseStatus  status,
        Integer      dependsOnPhase,
        String       externalJobId,
        @JsonRawValue String payload,
        String       errorMessage,
        Instant      createdAt,
        Instant      updatedAt,
        Instant      readyAt,
        Instant      startedAt,
        Instant      finishedAt
) {
    public static PhaseResponse from(PhaseRecord p) {
        return new PhaseResponse(
                p.getQueueId(),
                p.getParentTaskId(),
                p.getPhaseNumber(),
                p.getStatus(),
                p.getDependsOnPhase(),
                p.getExternalJobId(),
                p.getPayload(),
                p.getErrorMessage(),
                p.getCreatedAt(),
                p.getUpdatedAt(),
                p.getReadyAt(),
                p.getStartedAt(),
                p.getFinishedAt()
        );
    }
}
