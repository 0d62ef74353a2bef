package com.phaseflow.coordinator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phaseflow.coordinator.events.PhaseEvent;
import com.phaseflow.coordinator.events.PhaseEventBroadcaster;
import com.phaseflow.coordinator.model.PhaseRecord;
import com.phaseflow.coordinator.model.PhaseStatus;
import com.phaseflow.coordinator.model.QueueConfig;
import com.phaseflow.coordinator.store.PhaseQueueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.phaseflow.coordinator.model.PhaseStatus.*;

/**
 * State machine for queued phases.
 *
 * Validates batches, performs every status transition through the store's
 * compare-and-set operations, promotes successors on completion and blocks
 * dependents on failure. Each change is published to the broadcaster after
 * the surrounding transaction commits.
 *
 * Nothing in here talks to the executor; dispatching belongs to
 * {@link PhaseCoordinator}.
 */
@Service
public class PhaseQueueService {

    private static final Logger log = LoggerFactory.getLogger(PhaseQueueService.class);

    static final String DEFAULT_FAILURE_MESSAGE = "Phase execution failed";

    private final PhaseQueueStore       store;
    private final PhaseEventBroadcaster broadcaster;
    private final ObjectMapper          objectMapper;

    public PhaseQueueService(PhaseQueueStore store,
                             PhaseEventBroadcaster broadcaster,
                             ObjectMapper objectMapper) {
        this.store        = store;
        this.broadcaster  = broadcaster;
        this.objectMapper = objectMapper;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Validate and insert all phases of one parent task atomically.
     *
     * Phase 1 starts READY, every other phase QUEUED. A phase without an
     * explicit dependency depends on the phase right before it.
     *
     * @return the inserted phases ordered by phase number
     * @throws PhaseValidationException if the batch is malformed; nothing is stored
     */
    @Transactional
    public List<PhaseRecord> submitBatch(long parentTaskId, List<NewPhase> phases) {
        List<NewPhase> sorted = validateBatch(parentTaskId, phases);

        List<PhaseRecord> records = new ArrayList<>(sorted.size());
        for (NewPhase phase : sorted) {
            int number = phase.phaseNumber();
            records.add(new PhaseRecord(
                    parentTaskId,
                    number,
                    effectiveDependency(phase),
                    serializePayload(phase),
                    number == 1 ? READY : QUEUED));
        }
        try {
            store.insertBatch(records);
        } catch (DataIntegrityViolationException e) {
            // A concurrent submission for the same parent won the unique (parent, phase) key.
            throw new PhaseValidationException("Parent task " + parentTaskId + " already has queued phases", e);
        }
        records.forEach(r -> broadcaster.publishAfterCommit(PhaseEvent.enqueued(r)));

        log.info("Enqueued {} phases for parent {}", records.size(), parentTaskId);
        return records;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    /**
     * Mark a RUNNING phase COMPLETED and promote its successor QUEUED → READY.
     *
     * The successor is promoted whether or not the queue is paused; the pause
     * flag only gates dispatch, which the coordinator decides.
     *
     * Completing a phase that is already COMPLETED is a no-op.
     *
     * @return the promoted successor, if there is one
     * @throws PhaseTransitionException if the phase is neither RUNNING nor COMPLETED
     */
    @Transactional
    public Optional<PhaseRecord> markPhaseComplete(UUID queueId) {
        PhaseRecord phase = get(queueId);
        if (phase.getStatus() == COMPLETED) {
            log.debug("Phase {} of parent {} already completed, ignoring",
                    phase.getPhaseNumber(), phase.getParentTaskId());
            return Optional.empty();
        }
        if (!store.updateStatus(queueId, RUNNING, COMPLETED, null)) {
            PhaseRecord current = get(queueId);
            if (current.getStatus() == COMPLETED) {
                return Optional.empty();
            }
            log.warn("Rejected completion of phase {} of parent {} in state {}",
                    current.getPhaseNumber(), current.getParentTaskId(), current.getStatus());
            throw PhaseTransitionException.illegal(current, COMPLETED);
        }
        broadcaster.publishAfterCommit(PhaseEvent.statusChanged(phase, COMPLETED, null));
        log.info("Phase {} of parent {} COMPLETED", phase.getPhaseNumber(), phase.getParentTaskId());

        return promoteSuccessor(phase);
    }

    /**
     * Mark a RUNNING phase FAILED and block every phase downstream of it.
     *
     * Failing a phase that is already FAILED is a no-op.
     *
     * @return the phases that were blocked
     * @throws PhaseTransitionException if the phase is neither RUNNING nor FAILED
     */
    @Transactional
    public List<PhaseRecord> markPhaseFailed(UUID queueId, String errorMessage) {
        String reason = (errorMessage == null || errorMessage.isBlank())
                ? DEFAULT_FAILURE_MESSAGE : errorMessage;

        PhaseRecord phase = get(queueId);
        if (phase.getStatus() == FAILED) {
            log.debug("Phase {} of parent {} already failed, ignoring",
                    phase.getPhaseNumber(), phase.getParentTaskId());
            return List.of();
        }
        if (!store.updateStatus(queueId, RUNNING, FAILED, reason)) {
            PhaseRecord current = get(queueId);
            if (current.getStatus() == FAILED) {
                return List.of();
            }
            log.warn("Rejected failure of phase {} of parent {} in state {}",
                    current.getPhaseNumber(), current.getParentTaskId(), current.getStatus());
            throw PhaseTransitionException.illegal(current, FAILED);
        }
        broadcaster.publishAfterCommit(PhaseEvent.statusChanged(phase, FAILED, reason));
        log.error("Phase {} of parent {} FAILED: {}", phase.getPhaseNumber(), phase.getParentTaskId(), reason);

        return blockDependents(phase,
                "Blocked: phase " + phase.getPhaseNumber() + " failed: " + reason);
    }

    /**
     * Apply a terminal result pushed by the executor instead of waiting for the
     * next poll. Goes through the same guarded transitions as polling, so a
     * repeated or late callback is harmless. Dispatch of the promoted successor
     * is left to the coordinator's next tick, which honors the pause flag.
     *
     * @param externalJobId job the result belongs to; null skips the check
     * @throws PhaseTransitionException if the result is for another job, or the
     *                                  phase already ended the other way
     */
    @Transactional
    public ExecutorResult applyExecutorResult(UUID queueId, String externalJobId,
                                              boolean succeeded, String errorMessage) {
        PhaseRecord phase = get(queueId);
        if (externalJobId != null && phase.getExternalJobId() != null
                && !externalJobId.equals(phase.getExternalJobId())) {
            throw new PhaseTransitionException(String.format(
                    "Result for job %s does not match job %s of phase %d of parent %d",
                    externalJobId, phase.getExternalJobId(), phase.getPhaseNumber(), phase.getParentTaskId()));
        }
        PhaseStatus target = succeeded ? COMPLETED : FAILED;
        if (phase.getStatus() == target) {
            log.info("Duplicate {} result for phase {} of parent {}, ignoring",
                    target, phase.getPhaseNumber(), phase.getParentTaskId());
            return ExecutorResult.alreadyApplied();
        }
        if (succeeded) {
            return new ExecutorResult(true, markPhaseComplete(queueId).orElse(null), List.of());
        }
        return new ExecutorResult(true, null, markPhaseFailed(queueId, errorMessage));
    }

    /**
     * READY → RUNNING after the executor accepted the phase.
     *
     * @return false if the phase was no longer READY
     */
    @Transactional
    public boolean markPhaseRunning(UUID queueId, String externalJobId) {
        PhaseRecord phase = get(queueId);
        if (!store.markRunning(queueId, externalJobId)) {
            return false;
        }
        broadcaster.publishAfterCommit(PhaseEvent.statusChanged(phase, RUNNING, null));
        log.info("Phase {} of parent {} RUNNING as job {}",
                phase.getPhaseNumber(), phase.getParentTaskId(), externalJobId);
        return true;
    }

    /**
     * Remove a QUEUED, READY or BLOCKED phase from the queue.
     *
     * Phases that depended on it and are still waiting are blocked, since
     * nothing would ever promote them.
     *
     * @return the removed phase
     * @throws PhaseNotFoundException   if no such phase exists
     * @throws PhaseTransitionException if the phase is RUNNING, COMPLETED or FAILED
     */
    @Transactional
    public PhaseRecord cancel(UUID queueId) {
        PhaseRecord phase = get(queueId);
        if (!phase.getStatus().isCancellable() || !store.deleteIfStatusIn(queueId, CANCELLABLE)) {
            PhaseRecord current = get(queueId);
            log.warn("Rejected cancel of phase {} of parent {} in state {}",
                    current.getPhaseNumber(), current.getParentTaskId(), current.getStatus());
            throw new PhaseTransitionException(String.format(
                    "Phase %d of parent %d is %s; only %s phases can be cancelled",
                    current.getPhaseNumber(), current.getParentTaskId(), current.getStatus(), CANCELLABLE));
        }
        broadcaster.publishAfterCommit(PhaseEvent.cancelled(phase));
        log.info("Phase {} of parent {} cancelled while {}",
                phase.getPhaseNumber(), phase.getParentTaskId(), phase.getStatus());

        blockDependents(phase, "Blocked: phase " + phase.getPhaseNumber() + " was cancelled");
        return phase;
    }

    /**
     * Fail RUNNING phases that were started more than {@code maxAge} ago.
     * The executor never reported on them, so they would otherwise stay
     * RUNNING forever and hold up the rest of their parent task.
     *
     * @return the phases that were failed
     */
    @Transactional
    public List<PhaseRecord> failStalledPhases(Duration maxAge) {
        Instant cutoff = Instant.now().minus(maxAge);
        List<PhaseRecord> failed = new ArrayList<>();
        for (PhaseRecord phase : store.listByStatus(RUNNING)) {
            Instant started = phase.getStartedAt() != null ? phase.getStartedAt() : phase.getUpdatedAt();
            if (!started.isBefore(cutoff)) {
                continue;
            }
            log.warn("Phase {} of parent {} has been RUNNING since {} (job {}), failing it",
                    phase.getPhaseNumber(), phase.getParentTaskId(), started, phase.getExternalJobId());
            try {
                markPhaseFailed(phase.getQueueId(), "Timed out: no result from executor after " + maxAge);
                failed.add(get(phase.getQueueId()));
            } catch (PhaseTransitionException e) {
                // Finished between the listing and the update.
                log.debug("Skipping stalled-phase check for {}: {}", phase.getQueueId(), e.getMessage());
            }
        }
        return failed;
    }

    // ------------------------------------------------------------------
    // Pause / resume
    // ------------------------------------------------------------------

    /** Read fresh from the store on every call. */
    public boolean isPaused() {
        return store.getConfig().paused();
    }

    public QueueConfig getConfig() {
        return store.getConfig();
    }

    @Transactional
    public QueueConfig setPaused(boolean paused) {
        QueueConfig config = store.setConfig(paused);
        log.info("Queue {}", paused ? "paused" : "resumed");
        return config;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /**
     * @throws PhaseNotFoundException if no such phase exists
     */
    public PhaseRecord get(UUID queueId) {
        return store.get(queueId).orElseThrow(() -> new PhaseNotFoundException(queueId));
    }

    public List<PhaseRecord> listAll() {
        return store.listAll();
    }

    public List<PhaseRecord> listByParent(long parentTaskId) {
        return store.listByParent(parentTaskId);
    }

    public List<PhaseRecord> listByStatus(PhaseStatus status) {
        return store.listByStatus(status);
    }

    public boolean hasRunningPhase(long parentTaskId) {
        return store.listByParent(parentTaskId).stream()
                .anyMatch(p -> p.getStatus() == RUNNING);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Optional<PhaseRecord> promoteSuccessor(PhaseRecord completed) {
        for (PhaseRecord next : store.findDependents(completed.getParentTaskId(), completed.getPhaseNumber())) {
            if (next.getStatus() == QUEUED && store.updateStatus(next.getQueueId(), QUEUED, READY, null)) {
                broadcaster.publishAfterCommit(PhaseEvent.statusChanged(next, READY, null));
                log.info("Phase {} of parent {} READY", next.getPhaseNumber(), next.getParentTaskId());
                return store.get(next.getQueueId());
            }
        }
        return Optional.empty();
    }

    /**
     * Walk forward through depends_on_phase links from {@code origin} and block
     * every waiting phase reached. Phases that are already terminal stop the walk.
     */
    private List<PhaseRecord> blockDependents(PhaseRecord origin, String reason) {
        List<PhaseRecord> blocked = new ArrayList<>();
        Deque<Integer> frontier = new ArrayDeque<>();
        frontier.add(origin.getPhaseNumber());

        while (!frontier.isEmpty()) {
            int upstream = frontier.poll();
            for (PhaseRecord dependent : store.findDependents(origin.getParentTaskId(), upstream)) {
                PhaseStatus status = dependent.getStatus();
                if ((status == QUEUED || status == READY)
                        && store.updateStatus(dependent.getQueueId(), status, BLOCKED, reason)) {
                    broadcaster.publishAfterCommit(PhaseEvent.statusChanged(dependent, BLOCKED, reason));
                    blocked.add(store.get(dependent.getQueueId()).orElse(dependent));
                    frontier.add(dependent.getPhaseNumber());
                }
            }
        }
        if (!blocked.isEmpty()) {
            log.info("Blocked {} dependent phase(s) of parent {} after phase {}",
                    blocked.size(), origin.getParentTaskId(), origin.getPhaseNumber());
        }
        return blocked;
    }

    private List<NewPhase> validateBatch(long parentTaskId, List<NewPhase> phases) {
        if (parentTaskId <= 0) {
            throw new PhaseValidationException("parentTaskId must be positive, got " + parentTaskId);
        }
        if (phases == null || phases.isEmpty()) {
            throw new PhaseValidationException("A batch needs at least one phase");
        }

        List<NewPhase> sorted = phases.stream()
                .sorted(Comparator.comparingInt(NewPhase::phaseNumber))
                .toList();
        for (int i = 0; i < sorted.size(); i++) {
            int expected = i + 1;
            int actual   = sorted.get(i).phaseNumber();
            if (actual < 1) {
                throw new PhaseValidationException("Phase numbers start at 1, got " + actual);
            }
            if (actual != expected) {
                throw new PhaseValidationException(actual < expected
                        ? "Duplicate phase number " + actual
                        : "Phase numbers must be dense from 1; phase " + expected + " is missing");
            }
        }

        // Each phase may be the direct predecessor of at most one other phase.
        Map<Integer, Integer> successorOf = new HashMap<>();
        for (NewPhase phase : sorted) {
            int number = phase.phaseNumber();
            if (number == 1) {
                if (phase.dependsOnPhase() != null) {
                    throw new PhaseValidationException("Phase 1 cannot depend on another phase");
                }
                continue;
            }
            int dependency = effectiveDependency(phase);
            if (dependency < 1 || dependency >= number) {
                throw new PhaseValidationException("Phase " + number + " depends on phase "
                        + dependency + ", which is not an earlier phase");
            }
            Integer other = successorOf.putIfAbsent(dependency, number);
            if (other != null) {
                throw new PhaseValidationException("Phases " + other + " and " + number
                        + " both depend on phase " + dependency + "; phases must form a single chain");
            }
        }

        if (store.existsForParent(parentTaskId)) {
            throw new PhaseValidationException("Parent task " + parentTaskId + " already has queued phases");
        }
        return sorted;
    }

    private static Integer effectiveDependency(NewPhase phase) {
        if (phase.phaseNumber() == 1) {
            return null;
        }
        return phase.dependsOnPhase() != null ? phase.dependsOnPhase() : phase.phaseNumber() - 1;
    }

    private String serializePayload(NewPhase phase) {
        try {
            return objectMapper.writeValueAsString(phase.payload());
        } catch (JsonProcessingException e) {
            throw new PhaseValidationException("Payload of phase " + phase.phaseNumber() + " is not serializable", e);
        }
    }
}
