package com.phaseflow.coordinator.api.dto;

/**
 * Request body for POST /queue/{queueId}/result, sent by the executor when a job ends.
 *
 * Required: status ("completed" or "failed")
 * Optional: jobId (checked against the phase's job when present), error
 */
public record ExecutorResultRequest(String status, String jobId, String error) {

    public boolean isCompleted() {
        return "completed".equalsIgnoreCase(status);
    }

    public boolean isFailed() {
        return "failed".equalsIgnoreCase(status);
    }
}
