package com.phaseflow.coordinator.repository;

import com.phaseflow.coordinator.model.PhaseRecord;
import com.phaseflow.coordinator.model.PhaseStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Queries and conditional updates for the phase_queue table.
 *
 * Every UPDATE/DELETE below is guarded by the row's current status and
 * returns the number of rows it touched. A result of 0 means another tick
 * (or an API call) got there first; callers treat that as "no transition",
 * never as an error in itself.
 *
 * clearAutomatically evicts the persistence context after each bulk update
 * so a following findById sees the new row state.
 */
public interface PhaseRecordRepository extends JpaRepository<PhaseRecord, UUID> {

    List<PhaseRecord> findByParentTaskIdOrderByPhaseNumberAsc(long parentTaskId);

    List<PhaseRecord> findAllByOrderByParentTaskIdAscPhaseNumberAsc();

    List<PhaseRecord> findByStatusOrderByParentTaskIdAscPhaseNumberAsc(PhaseStatus status);

    /** Phases whose depends_on_phase points at the given phase. */
    List<PhaseRecord> findByParentTaskIdAndDependsOnPhaseOrderByPhaseNumberAsc(long parentTaskId,
                                                                              int dependsOnPhase);

    boolean existsByParentTaskId(long parentTaskId);

    /** QUEUED → READY. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE PhaseRecord p
            SET p.status = com.phaseflow.coordinator.model.PhaseStatus.READY,
                p.readyAt = :now, p.updatedAt = :now
            WHERE p.queueId = :queueId
              AND p.status = com.phaseflow.coordinator.model.PhaseStatus.QUEUED
            """)
    int promoteToReady(@Param("queueId") UUID queueId, @Param("now") Instant now);

    /** READY → RUNNING, recording the executor's job id. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE PhaseRecord p
            SET p.status = com.phaseflow.coordinator.model.PhaseStatus.RUNNING,
                p.externalJobId = :jobId, p.startedAt = :now, p.updatedAt = :now
            WHERE p.queueId = :queueId
              AND p.status = com.phaseflow.coordinator.model.PhaseStatus.READY
            """)
    int startRunning(@Param("queueId") UUID queueId,
                     @Param("jobId") String jobId,
                     @Param("now") Instant now);

    /** RUNNING → COMPLETED or FAILED. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE PhaseRecord p
            SET p.status = :next, p.errorMessage = :error,
                p.finishedAt = :now, p.updatedAt = :now
            WHERE p.queueId = :queueId
              AND p.status = com.phaseflow.coordinator.model.PhaseStatus.RUNNING
            """)
    int finish(@Param("queueId") UUID queueId,
               @Param("next") PhaseStatus next,
               @Param("error") String error,
               @Param("now") Instant now);

    /** QUEUED or READY → BLOCKED, guarded by the status the caller last saw. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE PhaseRecord p
            SET p.status = com.phaseflow.coordinator.model.PhaseStatus.BLOCKED,
                p.errorMessage = :error, p.updatedAt = :now
            WHERE p.queueId = :queueId AND p.status = :expected
            """)
    int block(@Param("queueId") UUID queueId,
              @Param("expected") PhaseStatus expected,
              @Param("error") String error,
              @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM PhaseRecord p WHERE p.queueId = :queueId AND p.status IN :statuses")
    int deleteByQueueIdAndStatusIn(@Param("queueId") UUID queueId,
                                   @Param("statuses") Collection<PhaseStatus> statuses);
}
