package com.phaseflow.coordinator.store;

import com.phaseflow.coordinator.model.PhaseRecord;
import com.phaseflow.coordinator.model.PhaseStatus;
import com.phaseflow.coordinator.model.QueueConfig;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Map-backed {@link PhaseQueueStore} for service and coordinator tests.
 *
 * Like the JPA store, every read returns a snapshot: a record obtained before
 * an update keeps its old state. Inserted records are copied as well, so the
 * caller's instances never alias stored rows.
 */
public class InMemoryPhaseQueueStore implements PhaseQueueStore {

    private static final Comparator<PhaseRecord> BY_PARENT_AND_NUMBER = Comparator
            .comparingLong(PhaseRecord::getParentTaskId)
            .thenComparingInt(PhaseRecord::getPhaseNumber);

    private final Map<UUID, PhaseRecord> phases = new LinkedHashMap<>();
    private QueueConfig config = QueueConfig.unpaused();

    @Override
    public synchronized void insertBatch(List<PhaseRecord> batch) {
        for (PhaseRecord phase : batch) {
            boolean clash = phases.values().stream().anyMatch(p ->
                    p.getParentTaskId() == phase.getParentTaskId()
                            && p.getPhaseNumber() == phase.getPhaseNumber());
            if (clash) {
                throw new DataIntegrityViolationException(
                        "duplicate key value violates unique constraint uq_phase_queue_parent_phase: " + phase);
            }
        }
        batch.forEach(p -> phases.put(p.getQueueId(), copyOf(p)));
    }

    @Override
    public synchronized Optional<PhaseRecord> get(UUID queueId) {
        return Optional.ofNullable(phases.get(queueId)).map(InMemoryPhaseQueueStore::copyOf);
    }

    @Override
    public synchronized List<PhaseRecord> listByParent(long parentTaskId) {
        return select(p -> p.getParentTaskId() == parentTaskId);
    }

    @Override
    public synchronized List<PhaseRecord> listAll() {
        return select(p -> true);
    }

    @Override
    public synchronized List<PhaseRecord> listByStatus(PhaseStatus status) {
        return select(p -> p.getStatus() == status);
    }

    @Override
    public synchronized List<PhaseRecord> findDependents(long parentTaskId, int phaseNumber) {
        return select(p -> p.getParentTaskId() == parentTaskId
                && Objects.equals(p.getDependsOnPhase(), phaseNumber));
    }

    @Override
    public synchronized boolean existsForParent(long parentTaskId) {
        return phases.values().stream().anyMatch(p -> p.getParentTaskId() == parentTaskId);
    }

    @Override
    public synchronized boolean updateStatus(UUID queueId, PhaseStatus expected, PhaseStatus next, String error) {
        if (!expected.canTransitionTo(next) || next == PhaseStatus.RUNNING) {
            throw new IllegalArgumentException("Illegal transition " + expected + " → " + next);
        }
        PhaseRecord phase = phases.get(queueId);
        if (phase == null || phase.getStatus() != expected) {
            return false;
        }
        Instant now = Instant.now();
        phase.setStatus(next);
        phase.setUpdatedAt(now);
        switch (next) {
            case READY -> phase.setReadyAt(now);
            case COMPLETED, FAILED -> {
                phase.setErrorMessage(error);
                phase.setFinishedAt(now);
            }
            case BLOCKED -> phase.setErrorMessage(error);
            default -> { }
        }
        return true;
    }

    @Override
    public synchronized boolean markRunning(UUID queueId, String externalJobId) {
        PhaseRecord phase = phases.get(queueId);
        if (phase == null || phase.getStatus() != PhaseStatus.READY) {
            return false;
        }
        Instant now = Instant.now();
        phase.setStatus(PhaseStatus.RUNNING);
        phase.setExternalJobId(externalJobId);
        phase.setStartedAt(now);
        phase.setUpdatedAt(now);
        return true;
    }

    @Override
    public synchronized boolean deleteIfStatusIn(UUID queueId, Collection<PhaseStatus> statuses) {
        PhaseRecord phase = phases.get(queueId);
        if (phase == null || !statuses.contains(phase.getStatus())) {
            return false;
        }
        phases.remove(queueId);
        return true;
    }

    @Override
    public synchronized QueueConfig getConfig() {
        return config;
    }

    @Override
    public synchronized QueueConfig setConfig(boolean paused) {
        config = new QueueConfig(paused, Instant.now(), config.version() + 1);
        return config;
    }

    /** Moves a stored phase's startedAt into the past, for watchdog tests. */
    public synchronized void backdateStartedAt(UUID queueId, Instant startedAt) {
        phases.get(queueId).setStartedAt(startedAt);
    }

    private List<PhaseRecord> select(Predicate<PhaseRecord> filter) {
        return phases.values().stream()
                .filter(filter)
                .sorted(BY_PARENT_AND_NUMBER)
                .map(InMemoryPhaseQueueStore::copyOf)
                .toList();
    }

    /** Detached copy with the same id, like a row loaded in a fresh persistence context. */
    private static PhaseRecord copyOf(PhaseRecord source) {
        PhaseRecord copy = new PhaseRecord(source.getParentTaskId(), source.getPhaseNumber(),
                source.getDependsOnPhase(), source.getPayload(), source.getStatus());
        ReflectionTestUtils.setField(copy, "queueId", source.getQueueId());
        ReflectionTestUtils.setField(copy, "createdAt", source.getCreatedAt());
        copy.setExternalJobId(source.getExternalJobId());
        copy.setErrorMessage(source.getErrorMessage());
        copy.setUpdatedAt(source.getUpdatedAt());
        copy.setReadyAt(source.getReadyAt());
        copy.setStartedAt(source.getStartedAt());
        copy.setFinishedAt(source.getFinishedAt());
        return copy;
    }
}
