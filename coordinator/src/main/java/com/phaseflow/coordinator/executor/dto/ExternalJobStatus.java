package com.phaseflow.coordinator.executor.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Job states reported by the execution service's status ledger.
 */
public enum ExternalJobStatus {
    @JsonProperty("pending")   PENDING,
    @JsonProperty("running")   RUNNING,
    @JsonProperty("succeeded") SUCCEEDED,
    @JsonProperty("failed")    FAILED
}
