package com.phaseflow.coordinator.model;

import org.junit.jupiter.api.Test;

import static com.phaseflow.coordinator.model.PhaseStatus.*;
import static org.assertj.core.api.Assertions.assertThat;

class PhaseStatusTest {

    @Test
    void canTransitionTo_followsLifecycle() {
        assertThat(QUEUED.canTransitionTo(READY)).isTrue();
        assertThat(QUEUED.canTransitionTo(BLOCKED)).isTrue();
        assertThat(READY.canTransitionTo(RUNNING)).isTrue();
        assertThat(READY.canTransitionTo(BLOCKED)).isTrue();
        assertThat(RUNNING.canTransitionTo(COMPLETED)).isTrue();
        assertThat(RUNNING.canTransitionTo(FAILED)).isTrue();
    }

    @Test
    void canTransitionTo_rejectsSkipsAndBackwardMoves() {
        assertThat(QUEUED.canTransitionTo(RUNNING)).isFalse();
        assertThat(READY.canTransitionTo(QUEUED)).isFalse();
        assertThat(RUNNING.canTransitionTo(BLOCKED)).isFalse();
        assertThat(RUNNING.canTransitionTo(READY)).isFalse();
    }

    @Test
    void terminalStatuses_haveNoOutgoingTransitions() {
        for (PhaseStatus terminal : new PhaseStatus[] { COMPLETED, FAILED, BLOCKED }) {
            assertThat(terminal.isTerminal()).isTrue();
            for (PhaseStatus next : values()) {
                assertThat(terminal.canTransitionTo(next)).isFalse();
            }
        }
        assertThat(RUNNING.isTerminal()).isFalse();
    }

    @Test
    void isCancellable_onlyWhileNotStarted() {
        assertThat(QUEUED.isCancellable()).isTrue();
        assertThat(READY.isCancellable()).isTrue();
        assertThat(BLOCKED.isCancellable()).isTrue();
        assertThat(RUNNING.isCancellable()).isFalse();
        assertThat(COMPLETED.isCancellable()).isFalse();
        assertThat(FAILED.isCancellable()).isFalse();
    }
}
