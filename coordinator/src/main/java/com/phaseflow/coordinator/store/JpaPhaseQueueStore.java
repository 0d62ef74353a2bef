package com.phaseflow.coordinator.store;

import com.phaseflow.coordinator.model.PhaseRecord;
import com.phaseflow.coordinator.model.PhaseStatus;
import com.phaseflow.coordinator.model.QueueConfig;
import com.phaseflow.coordinator.model.QueueConfigEntry;
import com.phaseflow.coordinator.repository.PhaseRecordRepository;
import com.phaseflow.coordinator.repository.QueueConfigRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link PhaseQueueStore} backed by Spring Data JPA (PostgreSQL in production).
 */
@Component
public class JpaPhaseQueueStore implements PhaseQueueStore {

    private final PhaseRecordRepository phaseRepo;
    private final QueueConfigRepository configRepo;

    public JpaPhaseQueueStore(PhaseRecordRepository phaseRepo, QueueConfigRepository configRepo) {
        this.phaseRepo  = phaseRepo;
        this.configRepo = configRepo;
    }

    /**
     * Flushes right away so a unique-key violation surfaces here as a
     * DataIntegrityViolationException rather than at commit.
     */
    @Override
    @Transactional
    public void insertBatch(List<PhaseRecord> phases) {
        phaseRepo.saveAllAndFlush(phases);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PhaseRecord> get(UUID queueId) {
        return phaseRepo.findById(queueId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PhaseRecord> listByParent(long parentTaskId) {
        return phaseRepo.findByParentTaskIdOrderByPhaseNumberAsc(parentTaskId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PhaseRecord> listAll() {
        return phaseRepo.findAllByOrderByParentTaskIdAscPhaseNumberAsc();
    }

    @Override
    @Transactional(readOnly = true)
    public List<PhaseRecord> listByStatus(PhaseStatus status) {
        return phaseRepo.findByStatusOrderByParentTaskIdAscPhaseNumberAsc(status);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PhaseRecord> findDependents(long parentTaskId, int phaseNumber) {
        return phaseRepo.findByParentTaskIdAndDependsOnPhaseOrderByPhaseNumberAsc(parentTaskId, phaseNumber);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsForParent(long parentTaskId) {
        return phaseRepo.existsByParentTaskId(parentTaskId);
    }

    @Override
    @Transactional
    public boolean updateStatus(UUID queueId, PhaseStatus expected, PhaseStatus next, String error) {
        if (!expected.canTransitionTo(next)) {
            throw new IllegalArgumentException("Illegal transition " + expected + " → " + next);
        }
        Instant now = Instant.now();
        int rows = switch (next) {
            case READY                -> phaseRepo.promoteToReady(queueId, now);
            case COMPLETED, FAILED    -> phaseRepo.finish(queueId, next, error, now);
            case BLOCKED              -> phaseRepo.block(queueId, expected, error, now);
            case RUNNING              -> throw new IllegalArgumentException(
                    "RUNNING requires an external job id, use markRunning");
            case QUEUED               -> throw new IllegalArgumentException("No transition leads to QUEUED");
        };
        return rows == 1;
    }

    @Override
    @Transactional
    public boolean markRunning(UUID queueId, String externalJobId) {
        return phaseRepo.startRunning(queueId, externalJobId, Instant.now()) == 1;
    }

    @Override
    @Transactional
    public boolean deleteIfStatusIn(UUID queueId, Collection<PhaseStatus> statuses) {
        return phaseRepo.deleteByQueueIdAndStatusIn(queueId, statuses) == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public QueueConfig getConfig() {
        return configRepo.findById(QueueConfigEntry.PAUSED_KEY)
                .map(JpaPhaseQueueStore::toConfig)
                .orElseGet(QueueConfig::unpaused);
    }

    @Override
    @Transactional
    public QueueConfig setConfig(boolean paused) {
        QueueConfigEntry entry = configRepo.findById(QueueConfigEntry.PAUSED_KEY)
                .orElseGet(() -> new QueueConfigEntry(QueueConfigEntry.PAUSED_KEY, "false"));
        entry.setConfigValue(Boolean.toString(paused));
        return toConfig(configRepo.saveAndFlush(entry));
    }

    private static QueueConfig toConfig(QueueConfigEntry entry) {
        long version = entry.getVersion() == null ? 0L : entry.getVersion();
        return new QueueConfig(Boolean.parseBoolean(entry.getConfigValue()), entry.getUpdatedAt(), version);
    }
}
