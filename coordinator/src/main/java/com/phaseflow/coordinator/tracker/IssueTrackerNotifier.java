package com.phaseflow.coordinator.tracker;

import com.phaseflow.coordinator.events.PhaseEvent;
import com.phaseflow.coordinator.events.PhaseEventBroadcaster;
import com.phaseflow.coordinator.model.PhaseStatus;
import com.phaseflow.coordinator.service.PhaseQueueService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Comments on the parent issue when one of its phases completes or fails.
 *
 * The parent task id is used as the issue number. Comments are posted from
 * a single background thread so event delivery never waits on the tracker,
 * and a tracker failure is only logged.
 */
@Component
public class IssueTrackerNotifier {

    private static final Logger log = LoggerFactory.getLogger(IssueTrackerNotifier.class);

    private final PhaseEventBroadcaster broadcaster;
    private final PhaseQueueService     queueService;
    private final IssueTrackerClient    client;
    private final boolean               enabled;
    private final Executor              executor;

    private PhaseEventBroadcaster.Subscription subscription;

    @Autowired
    public IssueTrackerNotifier(PhaseEventBroadcaster broadcaster,
                                PhaseQueueService queueService,
                                IssueTrackerClient client,
                                @Value("${phaseflow.issue-tracker.enabled:false}") boolean enabled) {
        this(broadcaster, queueService, client, enabled, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "issue-tracker-notifier");
            t.setDaemon(true);
            return t;
        }));
    }

    IssueTrackerNotifier(PhaseEventBroadcaster broadcaster,
                         PhaseQueueService queueService,
                         IssueTrackerClient client,
                         boolean enabled,
                         Executor executor) {
        this.broadcaster  = broadcaster;
        this.queueService = queueService;
        this.client       = client;
        this.enabled      = enabled;
        this.executor     = executor;
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("Issue tracker notifications disabled");
            return;
        }
        subscription = broadcaster.subscribeAll(this::onEvent);
        log.info("Issue tracker notifications enabled for {}", client.repository());
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
        }
        if (executor instanceof ExecutorService service) {
            service.shutdown();
        }
    }

    void onEvent(PhaseEvent event) {
        if (!PhaseEvent.STATUS_CHANGED.equals(event.type())) {
            return;
        }
        if (event.status() != PhaseStatus.COMPLETED && event.status() != PhaseStatus.FAILED) {
            return;
        }
        executor.execute(() -> comment(event));
    }

    private void comment(PhaseEvent event) {
        try {
            String comment = event.status() == PhaseStatus.COMPLETED
                    ? completionComment(event)
                    : failureComment(event);
            client.postComment(event.parentTaskId(), comment);
        } catch (Exception e) {
            log.warn("Could not comment on issue #{} for phase {}: {}",
                    event.parentTaskId(), event.phaseNumber(), e.getMessage());
        }
    }

    String completionComment(PhaseEvent event) {
        int phase = event.phaseNumber();
        boolean hasNext = queueService.listByParent(event.parentTaskId()).stream()
                .anyMatch(p -> p.getPhaseNumber() == phase + 1);

        return "## Phase " + phase + " Completed ✅\n\n"
                + "**Status:** Completed\n\n"
                + "Phase " + phase + " has completed successfully."
                + (hasNext ? " Moving to Phase " + (phase + 1) + "." : " All phases complete!");
    }

    static String failureComment(PhaseEvent event) {
        int phase = event.phaseNumber();
        String error = event.errorMessage() != null ? event.errorMessage() : "Unknown error";

        return "## Phase " + phase + " Failed ❌\n\n"
                + "**Status:** Failed\n"
                + "**Error:** " + error + "\n\n"
                + "Phase " + phase + " has failed. Subsequent phases have been blocked.";
    }
}
