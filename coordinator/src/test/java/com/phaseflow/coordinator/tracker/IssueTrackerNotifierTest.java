package com.phaseflow.coordinator.tracker;

import com.phaseflow.coordinator.events.PhaseEvent;
import com.phaseflow.coordinator.events.PhaseEventBroadcaster;
import com.phaseflow.coordinator.model.PhaseRecord;
import com.phaseflow.coordinator.model.PhaseStatus;
import com.phaseflow.coordinator.service.PhaseQueueService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for IssueTrackerNotifier.
 *
 * Comments are posted on the calling thread (direct executor) so each test
 * can verify the client right after publishing.
 */
@ExtendWith(MockitoExtension.class)
class IssueTrackerNotifierTest {

    @Mock PhaseQueueService  queueService;
    @Mock IssueTrackerClient client;

    PhaseEventBroadcaster broadcaster;
    IssueTrackerNotifier  notifier;

    @BeforeEach
    void setUp() {
        broadcaster = new PhaseEventBroadcaster();
        notifier    = new IssueTrackerNotifier(broadcaster, queueService, client, true, Runnable::run);
        notifier.start();
    }

    @Test
    void completedPhase_withSuccessor_mentionsNextPhase() {
        when(queueService.listByParent(42)).thenReturn(List.of(record(1), record(2)));

        broadcaster.publish(event(1, PhaseStatus.COMPLETED, null));

        String comment = postedComment(42);
        assertThat(comment).startsWith("## Phase 1 Completed");
        assertThat(comment).contains("Moving to Phase 2.");
    }

    @Test
    void completedPhase_lastOne_saysAllComplete() {
        when(queueService.listByParent(42)).thenReturn(List.of(record(1), record(2)));

        broadcaster.publish(event(2, PhaseStatus.COMPLETED, null));

        assertThat(postedComment(42)).contains("All phases complete!");
    }

    @Test
    void failedPhase_includesErrorAndBlockedNote() {
        broadcaster.publish(event(2, PhaseStatus.FAILED, "tests failed"));

        String comment = postedComment(42);
        assertThat(comment).startsWith("## Phase 2 Failed");
        assertThat(comment).contains("**Error:** tests failed");
        assertThat(comment).contains("Subsequent phases have been blocked.");
        verifyNoInteractions(queueService);
    }

    @Test
    void otherTransitions_areIgnored() {
        broadcaster.publish(event(2, PhaseStatus.READY, null));
        broadcaster.publish(event(3, PhaseStatus.BLOCKED, "Blocked: phase 2 failed: boom"));
        broadcaster.publish(new PhaseEvent(PhaseEvent.ENQUEUED, UUID.randomUUID(), 42, 1,
                PhaseStatus.READY, null, Instant.now()));

        verifyNoInteractions(client);
    }

    @Test
    void trackerFailure_isSwallowedAndSubscriptionKept() {
        doThrow(new IssueTrackerException("HTTP 401")).when(client).postComment(anyLong(), anyString());

        broadcaster.publish(event(1, PhaseStatus.FAILED, "boom"));
        broadcaster.publish(event(1, PhaseStatus.FAILED, "boom"));

        verify(client, times(2)).postComment(eq(42L), anyString());
        assertThat(broadcaster.subscriberCount()).isEqualTo(1);
    }

    @Test
    void disabled_neverSubscribes() {
        PhaseEventBroadcaster other = new PhaseEventBroadcaster();
        new IssueTrackerNotifier(other, queueService, client, false, Runnable::run).start();

        assertThat(other.subscriberCount()).isZero();
    }

    @Test
    void stop_unsubscribes() {
        notifier.stop();

        assertThat(broadcaster.subscriberCount()).isZero();
    }

    private String postedComment(long issue) {
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(client).postComment(eq(issue), body.capture());
        return body.getValue();
    }

    private static PhaseEvent event(int phaseNumber, PhaseStatus status, String error) {
        return new PhaseEvent(PhaseEvent.STATUS_CHANGED, UUID.randomUUID(), 42, phaseNumber,
                status, error, Instant.now());
    }

    private static PhaseRecord record(int phaseNumber) {
        return new PhaseRecord(42, phaseNumber, phaseNumber == 1 ? null : phaseNumber - 1, "{}",
                PhaseStatus.COMPLETED);
    }
}
