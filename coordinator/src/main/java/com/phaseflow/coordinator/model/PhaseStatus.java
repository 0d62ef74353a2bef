package com.phaseflow.coordinator.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a single phase in the queue.
 *
 * Transitions:
 *   QUEUED  → READY     (predecessor completed)
 *   QUEUED  → BLOCKED   (an upstream phase failed or was cancelled)
 *   READY   → RUNNING   (dispatched to the executor)
 *   READY   → BLOCKED
 *   RUNNING → COMPLETED (executor reported success)
 *   RUNNING → FAILED    (executor reported failure, or the watchdog gave up)
 *
 * COMPLETED, FAILED and BLOCKED are terminal. Every status change in the
 * service and the store is checked against this table.
 */
public enum PhaseStatus {
    QUEUED,
    READY,
    RUNNING,
    COMPLETED,
    BLOCKED,
    FAILED;

    private static final Map<PhaseStatus, Set<PhaseStatus>> TRANSITIONS = new EnumMap<>(PhaseStatus.class);

    static {
        TRANSITIONS.put(QUEUED,    EnumSet.of(READY, BLOCKED));
        TRANSITIONS.put(READY,     EnumSet.of(RUNNING, BLOCKED));
        TRANSITIONS.put(RUNNING,   EnumSet.of(COMPLETED, FAILED));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(PhaseStatus.class));
        TRANSITIONS.put(BLOCKED,   EnumSet.noneOf(PhaseStatus.class));
        TRANSITIONS.put(FAILED,    EnumSet.noneOf(PhaseStatus.class));
    }

    /** Statuses a phase may be cancelled (deleted) from. */
    public static final Set<PhaseStatus> CANCELLABLE = EnumSet.of(QUEUED, READY, BLOCKED);

    public boolean canTransitionTo(PhaseStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    public boolean isCancellable() {
        return CANCELLABLE.contains(this);
    }
}
