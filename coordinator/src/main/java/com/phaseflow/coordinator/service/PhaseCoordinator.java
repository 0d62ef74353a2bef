package com.phaseflow.coordinator.service;

import com.phaseflow.coordinator.executor.ExecutionClient;
import com.phaseflow.coordinator.executor.ExecutorException;
import com.phaseflow.coordinator.executor.dto.JobStatusResponse;
import com.phaseflow.coordinator.model.PhaseRecord;
import com.phaseflow.coordinator.model.PhaseStatus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Background loop that drives queued phases through the executor.
 *
 * Every tick:
 *   1. Polls the executor's ledger for each RUNNING phase and completes or
 *      fails it through {@link PhaseQueueService}.
 *   2. Fails phases the executor has not reported on for too long (watchdog).
 *   3. Unless the queue is paused, dispatches READY phases that were promoted
 *      by a completed predecessor.
 *
 * Phase 1 of a batch is never picked up here; it is started at submission
 * ({@link #startFirstPhase}) or by an explicit {@link #dispatchNow}.
 *
 * fixedDelay keeps ticks from overlapping: the next one is scheduled only
 * after the previous one returns. The tick lock additionally serializes
 * explicit dispatches with ticks and lets shutdown wait for an in-flight tick.
 *
 * All state lives in the store, so a restarted instance simply picks up the
 * RUNNING phases on its first tick.
 */
@Component
@EnableScheduling
public class PhaseCoordinator {

    private static final Logger log = LoggerFactory.getLogger(PhaseCoordinator.class);

    private final PhaseQueueService queueService;
    private final ExecutionClient   executionClient;
    private final MeterRegistry     meterRegistry;
    private final boolean           enabled;
    private final Duration          maxRunningAge;

    private final ReentrantLock tickLock = new ReentrantLock();
    private volatile boolean stopped;

    public PhaseCoordinator(PhaseQueueService queueService,
                            ExecutionClient executionClient,
                            MeterRegistry meterRegistry,
                            @Value("${phaseflow.coordinator.enabled:true}") boolean enabled,
                            @Value("${phaseflow.coordinator.max-running-age:PT6H}") Duration maxRunningAge) {
        this.queueService    = queueService;
        this.executionClient = executionClient;
        this.meterRegistry   = meterRegistry;
        this.enabled         = enabled;
        this.maxRunningAge   = maxRunningAge;
    }

    // ------------------------------------------------------------------
    // Poll loop
    // ------------------------------------------------------------------

    @Scheduled(fixedDelayString = "${phaseflow.coordinator.poll-interval-ms:10000}",
               initialDelayString = "${phaseflow.coordinator.initial-delay-ms:5000}")
    public void tick() {
        if (!enabled || stopped) {
            return;
        }
        tickLock.lock();
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            if (stopped) {
                return;
            }
            pollRunningPhases();
            expireStalledPhases();
            dispatchReadyPhases();
        } finally {
            sample.stop(meterRegistry.timer("phaseflow.coordinator.tick"));
            tickLock.unlock();
        }
    }

    /**
     * Stop ticking. Blocks until a tick that is already running has finished,
     * so no transition is abandoned halfway.
     */
    @PreDestroy
    public void stop() {
        stopped = true;
        tickLock.lock();
        try {
            log.info("Phase coordinator stopped");
        } finally {
            tickLock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Dispatch entry points outside the loop
    // ------------------------------------------------------------------

    /**
     * Start phase 1 of a freshly submitted batch, unless the queue is paused.
     * An executor error leaves the phase READY for a later explicit dispatch.
     */
    public void startFirstPhase(UUID queueId) {
        if (queueService.isPaused()) {
            log.info("Queue is paused; phase {} stays READY until dispatched", queueId);
            return;
        }
        try {
            dispatchNow(queueId);
        } catch (ExecutorException e) {
            log.warn("Could not start phase {}: {}. It stays READY.", queueId, e.getMessage());
        }
    }

    /**
     * Dispatch a READY phase right away, ignoring the pause flag.
     *
     * @return the phase after it moved to RUNNING
     * @throws PhaseNotFoundException   if no such phase exists
     * @throws PhaseTransitionException if it is not READY or its parent already has a RUNNING phase
     * @throws ExecutorException        if the executor rejects the phase; it stays READY
     */
    public PhaseRecord dispatchNow(UUID queueId) {
        tickLock.lock();
        try {
            PhaseRecord phase = queueService.get(queueId);
            if (phase.getStatus() != PhaseStatus.READY) {
                throw new PhaseTransitionException(String.format(
                        "Phase must be READY to execute (phase %d of parent %d is %s)",
                        phase.getPhaseNumber(), phase.getParentTaskId(), phase.getStatus()));
            }
            if (queueService.hasRunningPhase(phase.getParentTaskId())) {
                throw new PhaseTransitionException(
                        "Parent " + phase.getParentTaskId() + " already has a RUNNING phase");
            }
            if (!dispatch(phase)) {
                throw new PhaseTransitionException(
                        "Phase " + phase.getPhaseNumber() + " changed state while being dispatched");
            }
            return queueService.get(queueId);
        } finally {
            tickLock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Tick steps
    // ------------------------------------------------------------------

    private void pollRunningPhases() {
        List<PhaseRecord> running;
        try {
            running = queueService.listByStatus(PhaseStatus.RUNNING);
        } catch (DataAccessException | TransactionException e) {
            transientError("Could not load RUNNING phases", e);
            return;
        }
        for (PhaseRecord phase : running) {
            withPhaseContext(phase, () -> reconcile(phase));
        }
    }

    private void reconcile(PhaseRecord phase) {
        if (phase.getExternalJobId() == null) {
            log.warn("RUNNING phase {} has no external job id; waiting for the watchdog", phase.getQueueId());
            return;
        }
        try {
            JobStatusResponse status = executionClient.getStatus(phase.getExternalJobId());
            switch (status.status()) {
                case SUCCEEDED -> queueService.markPhaseComplete(phase.getQueueId());
                case FAILED    -> queueService.markPhaseFailed(phase.getQueueId(), status.error());
                default        -> log.debug("Job {} still {}", phase.getExternalJobId(), status.status());
            }
        } catch (ExecutorException | DataAccessException | TransactionException e) {
            transientError("Polling job " + phase.getExternalJobId() + " failed, retrying next tick", e);
        } catch (PhaseTransitionException e) {
            log.warn("Skipping phase {}: {}", phase.getQueueId(), e.getMessage());
        }
    }

    private void expireStalledPhases() {
        if (maxRunningAge.isZero() || maxRunningAge.isNegative()) {
            return;
        }
        try {
            queueService.failStalledPhases(maxRunningAge);
        } catch (DataAccessException | TransactionException e) {
            transientError("Stalled-phase check failed", e);
        }
    }

    /**
     * Dispatch READY phases with a predecessor. The pause flag is read from the
     * store here, on every tick, so a phase left READY during a pause goes out
     * on the first tick after resume.
     */
    private void dispatchReadyPhases() {
        List<PhaseRecord> ready;
        try {
            if (queueService.isPaused()) {
                log.debug("Queue paused, skipping dispatch");
                return;
            }
            ready = queueService.listByStatus(PhaseStatus.READY);
        } catch (DataAccessException | TransactionException e) {
            transientError("Could not load READY phases", e);
            return;
        }
        for (PhaseRecord phase : ready) {
            if (phase.getDependsOnPhase() == null) {
                continue;
            }
            withPhaseContext(phase, () -> {
                try {
                    if (queueService.hasRunningPhase(phase.getParentTaskId())) {
                        log.debug("Parent {} already has a RUNNING phase", phase.getParentTaskId());
                        return;
                    }
                    dispatch(phase);
                } catch (ExecutorException | DataAccessException | TransactionException e) {
                    transientError("Dispatch of phase " + phase.getQueueId() + " failed, retrying next tick", e);
                } catch (PhaseNotFoundException e) {
                    log.warn("Phase {} was cancelled during dispatch", phase.getQueueId());
                }
            });
        }
    }

    /**
     * Hand a READY phase to the executor and record the job id.
     *
     * Nothing is held open across the executor call: the phase was read
     * before it, and the READY → RUNNING update happens after the response.
     *
     * @return false if the phase stopped being READY in the meantime
     */
    private boolean dispatch(PhaseRecord phase) {
        String jobId = executionClient.dispatch(phase);
        if (!queueService.markPhaseRunning(phase.getQueueId(), jobId)) {
            log.warn("Phase {} left READY during dispatch; executor job {} is not tracked",
                    phase.getQueueId(), jobId);
            return false;
        }
        meterRegistry.counter("phaseflow.phase.dispatched").increment();
        return true;
    }

    private void transientError(String message, Exception e) {
        meterRegistry.counter("phaseflow.coordinator.poll.errors").increment();
        log.warn("{}: {}", message, e.getMessage());
    }

    private static void withPhaseContext(PhaseRecord phase, Runnable action) {
        MDC.put("queueId",      phase.getQueueId().toString());
        MDC.put("parentTaskId", String.valueOf(phase.getParentTaskId()));
        try {
            action.run();
        } finally {
            MDC.remove("queueId");
            MDC.remove("parentTaskId");
        }
    }
}
