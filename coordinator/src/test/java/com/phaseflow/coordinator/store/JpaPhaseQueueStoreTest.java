package com.phaseflow.coordinator.store;

import com.phaseflow.coordinator.model.PhaseStatus;
import com.phaseflow.coordinator.model.QueueConfig;
import com.phaseflow.coordinator.model.QueueConfigEntry;
import com.phaseflow.coordinator.repository.PhaseRecordRepository;
import com.phaseflow.coordinator.repository.QueueConfigRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static com.phaseflow.coordinator.model.PhaseStatus.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Routing tests for JpaPhaseQueueStore: which conditional update each
 * transition maps to, and how the config row is read and written.
 * The queries themselves run against PostgreSQL in PhaseRecordRepositoryTest.
 */
@ExtendWith(MockitoExtension.class)
class JpaPhaseQueueStoreTest {

    @Mock PhaseRecordRepository phaseRepo;
    @Mock QueueConfigRepository configRepo;

    JpaPhaseQueueStore store;

    @BeforeEach
    void setUp() {
        store = new JpaPhaseQueueStore(phaseRepo, configRepo);
    }

    @Test
    void updateStatus_queuedToReady_usesPromote() {
        UUID id = UUID.randomUUID();
        when(phaseRepo.promoteToReady(eq(id), any())).thenReturn(1);

        assertThat(store.updateStatus(id, QUEUED, READY, null)).isTrue();
    }

    @Test
    void updateStatus_runningToFailed_usesFinishWithError() {
        UUID id = UUID.randomUUID();
        when(phaseRepo.finish(eq(id), eq(FAILED), eq("boom"), any())).thenReturn(1);

        assertThat(store.updateStatus(id, RUNNING, FAILED, "boom")).isTrue();
    }

    @Test
    void updateStatus_runningToCompleted_lostRace_returnsFalse() {
        UUID id = UUID.randomUUID();
        when(phaseRepo.finish(eq(id), eq(COMPLETED), isNull(), any())).thenReturn(0);

        assertThat(store.updateStatus(id, RUNNING, COMPLETED, null)).isFalse();
    }

    @Test
    void updateStatus_readyToBlocked_guardsOnExpectedStatus() {
        UUID id = UUID.randomUUID();
        when(phaseRepo.block(eq(id), eq(READY), eq("Blocked: phase 1 failed: boom"), any())).thenReturn(1);

        assertThat(store.updateStatus(id, READY, BLOCKED, "Blocked: phase 1 failed: boom")).isTrue();
    }

    @Test
    void updateStatus_illegalPair_throwsWithoutTouchingRepository() {
        UUID id = UUID.randomUUID();

        assertThatThrownBy(() -> store.updateStatus(id, COMPLETED, READY, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.updateStatus(id, QUEUED, RUNNING, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.updateStatus(id, READY, RUNNING, null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(phaseRepo);
    }

    @Test
    void deleteIfStatusIn_noRowDeleted_returnsFalse() {
        UUID id = UUID.randomUUID();
        when(phaseRepo.deleteByQueueIdAndStatusIn(id, PhaseStatus.CANCELLABLE)).thenReturn(0);

        assertThat(store.deleteIfStatusIn(id, PhaseStatus.CANCELLABLE)).isFalse();
    }

    @Test
    void getConfig_missingRow_defaultsToUnpaused() {
        when(configRepo.findById(QueueConfigEntry.PAUSED_KEY)).thenReturn(Optional.empty());

        assertThat(store.getConfig().paused()).isFalse();
    }

    @Test
    void setConfig_existingRow_updatesValue() {
        QueueConfigEntry entry = new QueueConfigEntry(QueueConfigEntry.PAUSED_KEY, "false");
        when(configRepo.findById(QueueConfigEntry.PAUSED_KEY)).thenReturn(Optional.of(entry));
        when(configRepo.saveAndFlush(entry)).thenReturn(entry);

        QueueConfig config = store.setConfig(true);

        assertThat(config.paused()).isTrue();
        assertThat(entry.getConfigValue()).isEqualTo("true");
    }

    @Test
    void setConfig_missingRow_createsIt() {
        when(configRepo.findById(QueueConfigEntry.PAUSED_KEY)).thenReturn(Optional.empty());
        when(configRepo.saveAndFlush(any())).thenAnswer(inv -> inv.getArgument(0));

        store.setConfig(true);

        ArgumentCaptor<QueueConfigEntry> saved = ArgumentCaptor.forClass(QueueConfigEntry.class);
        verify(configRepo).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getConfigKey()).isEqualTo(QueueConfigEntry.PAUSED_KEY);
        assertThat(saved.getValue().getConfigValue()).isEqualTo("true");
    }
}
