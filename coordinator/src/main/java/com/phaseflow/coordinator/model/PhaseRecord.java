package com.phaseflow.coordinator.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.UUID;

/**
 * One phase of a multi-phase parent task.
 *
 * Rows are inserted in one batch per parent task and afterwards only change
 * through conditional UPDATEs in {@code PhaseRecordRepository}, so the
 * setters below are used by the in-process store implementations only.
 *
 * DB table: phase_queue  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "phase_queue")
public class PhaseRecord implements Persistable<UUID> {

    // Assigned at submission so the whole batch is known before it is saved.
    @Id
    @Column(name = "queue_id")
    private UUID queueId;

    @Column(name = "parent_task_id", nullable = false, updatable = false)
    private long parentTaskId;

    @Column(name = "phase_number", nullable = false, updatable = false)
    private int phaseNumber;

    // Job id returned by the executor once the phase is dispatched.
    @Column(name = "external_job_id")
    private String externalJobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PhaseStatus status;

    // Always a lower phase_number of the same parent; null for phase 1.
    @Column(name = "depends_on_phase", updatable = false)
    private Integer dependsOnPhase;

    // Opaque JSON object handed to the executor as-is.
    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload = "{}";

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "ready_at")
    private Instant readyAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Transient
    private boolean isNew = true;

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected PhaseRecord() {}   // required by JPA

    public PhaseRecord(long parentTaskId, int phaseNumber, Integer dependsOnPhase,
                       String payload, PhaseStatus status) {
        this.queueId        = UUID.randomUUID();
        this.parentTaskId   = parentTaskId;
        this.phaseNumber    = phaseNumber;
        this.dependsOnPhase = dependsOnPhase;
        this.payload        = payload;
        this.status         = status;
        if (status == PhaseStatus.READY) {
            this.readyAt = this.createdAt;
        }
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    @Override
    public UUID getId()               { return queueId; }

    @Override
    public boolean isNew()            { return isNew; }

    public UUID        getQueueId()        { return queueId; }
    public long        getParentTaskId()   { return parentTaskId; }
    public int         getPhaseNumber()    { return phaseNumber; }
    public String      getExternalJobId()  { return externalJobId; }
    public PhaseStatus getStatus()         { return status; }
    public Integer     getDependsOnPhase() { return dependsOnPhase; }
    public String      getPayload()        { return payload; }
    public Instant     getCreatedAt()      { return createdAt; }
    public Instant     getUpdatedAt()      { return updatedAt; }
    public Instant     getReadyAt()        { return readyAt; }
    public Instant     getStartedAt()      { return startedAt; }
    public Instant     getFinishedAt()     { return finishedAt; }
    public String      getErrorMessage()   { return errorMessage; }

    public void setStatus(PhaseStatus status)            { this.status = status; }
    public void setExternalJobId(String externalJobId)   { this.externalJobId = externalJobId; }
    public void setErrorMessage(String errorMessage)     { this.errorMessage = errorMessage; }
    public void setUpdatedAt(Instant t)                  { this.updatedAt = t; }
    public void setReadyAt(Instant t)                    { this.readyAt = t; }
    public void setStartedAt(Instant t)                  { this.startedAt = t; }
    public void setFinishedAt(Instant t)                 { this.finishedAt = t; }

    @Override
    public String toString() {
        return "PhaseRecord{" + queueId + " parent=" + parentTaskId
                + " phase=" + phaseNumber + " status=" + status + "}";
    }
}
