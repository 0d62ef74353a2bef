package com.phaseflow.coordinator.api;

import com.phaseflow.coordinator.api.dto.*;
import com.phaseflow.coordinator.executor.ExecutorException;
import com.phaseflow.coordinator.model.PhaseRecord;
import com.phaseflow.coordinator.model.QueueConfig;
import com.phaseflow.coordinator.service.ExecutorResult;
import com.phaseflow.coordinator.service.PhaseCoordinator;
import com.phaseflow.coordinator.service.PhaseNotFoundException;
import com.phaseflow.coordinator.service.PhaseQueueService;
import com.phaseflow.coordinator.service.PhaseTransitionException;
import com.phaseflow.coordinator.service.PhaseValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.UUID;

/**
 * REST control plane for the phase queue.
 *
 * GET    /queue                      all phases
 * GET    /queue/{parentTaskId}       phases of one parent, by phase number
 * POST   /queue                      submit a batch of phases for a parent
 * DELETE /queue/{queueId}            cancel a QUEUED, READY or BLOCKED phase
 * POST   /queue/{queueId}/execute    dispatch a READY phase now, even while paused
 * POST   /queue/{queueId}/result     executor pushes a job's terminal result
 * GET    /queue/config               {paused}
 * POST   /queue/config/pause         set {paused}
 * GET    /queue/events               SSE stream of phase events
 */
@RestController
@RequestMapping("/queue")
public class QueueController {

    private final PhaseQueueService       queueService;
    private final PhaseCoordinator        coordinator;
    private final PhaseEventStreamService streamService;

    public QueueController(PhaseQueueService queueService,
                           PhaseCoordinator coordinator,
                           PhaseEventStreamService streamService) {
        this.queueService  = queueService;
        this.coordinator   = coordinator;
        this.streamService = streamService;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @GetMapping
    public PhaseListResponse listAll() {
        return PhaseListResponse.from(queueService.listAll());
    }

    @GetMapping("/{parentTaskId:\\d+}")
    public PhaseListResponse listByParent(@PathVariable long parentTaskId) {
        return PhaseListResponse.from(queueService.listByParent(parentTaskId));
    }

    // ------------------------------------------------------------------
    // Submission and per-phase actions
    // ------------------------------------------------------------------

    /**
     * Submit all phases of a parent task.
     *
     * Example:
     *   curl -X POST http://localhost:8080/queue \
     *     -H "Content-Type: application/json" \
     *     -d '{"parentTaskId":42,"phases":[
     *           {"phaseNumber":1,"payload":{"title":"Schema"}},
     *           {"phaseNumber":2,"payload":{"title":"API"}}]}'
     *
     * HTTP 201: phases created (phase 1 may already be RUNNING)
     * HTTP 400: malformed batch, nothing stored
     */
    @PostMapping
    public ResponseEntity<PhaseListResponse> submit(@RequestBody SubmitBatchRequest req) {
        if (req.parentTaskId() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "parentTaskId is required");
        }
        List<PhaseRecord> created;
        try {
            created = queueService.submitBatch(req.parentTaskId(), req.toNewPhases());
        } catch (PhaseValidationException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        if (req.autoStart()) {
            coordinator.startFirstPhase(created.get(0).getQueueId());
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(PhaseListResponse.from(queueService.listByParent(req.parentTaskId())));
    }

    /**
     * Cancel a phase.
     *
     * HTTP 200: removed
     * HTTP 404: unknown queue id
     * HTTP 409: phase is RUNNING, COMPLETED or FAILED; nothing changed
     */
    @DeleteMapping("/{queueId}")
    public CancelResponse cancel(@PathVariable UUID queueId) {
        try {
            PhaseRecord removed = queueService.cancel(queueId);
            return new CancelResponse(true, "Phase " + removed.getPhaseNumber()
                    + " of parent " + removed.getParentTaskId() + " removed from queue");
        } catch (PhaseNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        } catch (PhaseTransitionException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage(), e);
        }
    }

    /**
     * Dispatch a READY phase immediately, independent of the pause flag.
     *
     * HTTP 200: phase is RUNNING
     * HTTP 404: unknown queue id
     * HTTP 409: phase not READY, or its parent already has a RUNNING phase
     * HTTP 502: executor rejected the job; phase stays READY
     */
    @PostMapping("/{queueId}/execute")
    public PhaseResponse execute(@PathVariable UUID queueId) {
        try {
            return PhaseResponse.from(coordinator.dispatchNow(queueId));
        } catch (PhaseNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        } catch (PhaseTransitionException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage(), e);
        } catch (ExecutorException e) {
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, e.getMessage(), e);
        }
    }

    /**
     * Completion callback from the executor, an alternative to waiting for the
     * next poll. Repeated callbacks for the same result are answered with
     * phaseUpdated=false.
     *
     * Example:
     *   curl -X POST http://localhost:8080/queue/{queueId}/result \
     *     -H "Content-Type: application/json" \
     *     -d '{"status":"failed","jobId":"job-17","error":"tests failed"}'
     *
     * HTTP 200: result applied, or already applied
     * HTTP 400: status is not "completed" or "failed"
     * HTTP 404: unknown queue id
     * HTTP 409: phase is not RUNNING, ended the other way, or belongs to another job
     */
    @PostMapping("/{queueId}/result")
    public ExecutorResultResponse result(@PathVariable UUID queueId, @RequestBody ExecutorResultRequest req) {
        if (!req.isCompleted() && !req.isFailed()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "status must be \"completed\" or \"failed\"");
        }
        try {
            ExecutorResult result = queueService.applyExecutorResult(
                    queueId, req.jobId(), req.isCompleted(), req.error());
            return ExecutorResultResponse.from(result);
        } catch (PhaseNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        } catch (PhaseTransitionException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Pause / resume
    // ------------------------------------------------------------------

    @GetMapping("/config")
    public QueueConfigResponse getConfig() {
        return new QueueConfigResponse(queueService.isPaused());
    }

    @PostMapping("/config/pause")
    public QueueConfigResponse setPaused(@RequestBody SetPausedRequest req) {
        if (req.paused() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "paused is required");
        }
        QueueConfig config = queueService.setPaused(req.paused());
        return new QueueConfigResponse(config.paused());
    }

    // ------------------------------------------------------------------
    // Live updates
    // ------------------------------------------------------------------

    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@RequestParam(required = false) Long parentTaskId) {
        return streamService.createEmitter(parentTaskId);
    }
}
