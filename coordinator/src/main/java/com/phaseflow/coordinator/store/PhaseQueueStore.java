package com.phaseflow.coordinator.store;

import com.phaseflow.coordinator.model.PhaseRecord;
import com.phaseflow.coordinator.model.PhaseStatus;
import com.phaseflow.coordinator.model.QueueConfig;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable storage for phases and the global queue config.
 *
 * Pure persistence: no readiness or blocking rules live here. Every status
 * change is a compare-and-set on a single row; the boolean results say
 * whether the row actually moved.
 */
public interface PhaseQueueStore {

    /**
     * Insert all phases of one parent task in a single transaction.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException if a (parent, phase number) pair already exists
     */
    void insertBatch(List<PhaseRecord> phases);

    Optional<PhaseRecord> get(UUID queueId);

    /** Phases of one parent ordered by phase number. */
    List<PhaseRecord> listByParent(long parentTaskId);

    List<PhaseRecord> listAll();

    List<PhaseRecord> listByStatus(PhaseStatus status);

    /** Phases of {@code parentTaskId} whose depends_on_phase equals {@code phaseNumber}. */
    List<PhaseRecord> findDependents(long parentTaskId, int phaseNumber);

    boolean existsForParent(long parentTaskId);

    /**
     * Move a phase from {@code expected} to {@code next}, recording {@code error}
     * for FAILED and BLOCKED. RUNNING is reached through {@link #markRunning}.
     *
     * @return false if the phase was not in {@code expected} (or does not exist)
     * @throws IllegalArgumentException if the pair is not a legal transition
     */
    boolean updateStatus(UUID queueId, PhaseStatus expected, PhaseStatus next, String error);

    /** READY → RUNNING with the executor's job id. */
    boolean markRunning(UUID queueId, String externalJobId);

    /** Delete the phase only if its current status is one of {@code statuses}. */
    boolean deleteIfStatusIn(UUID queueId, Collection<PhaseStatus> statuses);

    QueueConfig getConfig();

    QueueConfig setConfig(boolean paused);
}
