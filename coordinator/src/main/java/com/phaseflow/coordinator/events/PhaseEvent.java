package com.phaseflow.coordinator.events;

import com.phaseflow.coordinator.model.PhaseRecord;
import com.phaseflow.coordinator.model.PhaseStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * A change to one phase, fanned out to observers by {@link PhaseEventBroadcaster}.
 *
 * @param type         one of {@link #ENQUEUED}, {@link #STATUS_CHANGED}, {@link #CANCELLED}
 * @param status       the phase's status after the change (for CANCELLED, the status it was deleted in)
 * @param errorMessage failure or blocking reason, null otherwise
 */
public record PhaseEvent(
        String      type,
        UUID        queueId,
        long        parentTaskId,
        int         phaseNumber,
        PhaseStatus status,
        String      errorMessage,
        Instant     timestamp
) {
    public static final String ENQUEUED       = "phase.enqueued";
    public static final String STATUS_CHANGED = "phase.status_changed";
    public static final String CANCELLED      = "phase.cancelled";

    public static PhaseEvent enqueued(PhaseRecord phase) {
        return of(ENQUEUED, phase, phase.getStatus(), null);
    }

    public static PhaseEvent statusChanged(PhaseRecord phase, PhaseStatus status, String errorMessage) {
        return of(STATUS_CHANGED, phase, status, errorMessage);
    }

    public static PhaseEvent cancelled(PhaseRecord phase) {
        return of(CANCELLED, phase, phase.getStatus(), null);
    }

    private static PhaseEvent of(String type, PhaseRecord phase, PhaseStatus status, String errorMessage) {
        return new PhaseEvent(type, phase.getQueueId(), phase.getParentTaskId(),
                phase.getPhaseNumber(), status, errorMessage, Instant.now());
    }
}
