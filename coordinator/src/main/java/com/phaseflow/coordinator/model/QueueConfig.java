package com.phaseflow.coordinator.model;

import java.time.Instant;

/**
 * Snapshot of the global queue settings.
 *
 * @param paused    when true the coordinator does not auto-dispatch READY phases
 * @param updatedAt last change of the flag, null if it was never written
 * @param version   optimistic-lock version of the backing row
 */
public record QueueConfig(boolean paused, Instant updatedAt, long version) {

    public static QueueConfig unpaused() {
        return new QueueConfig(false, null, 0L);
    }
}
