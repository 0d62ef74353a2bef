package com.phaseflow.coordinator.executor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from POST /jobs on the execution service.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DispatchResponse(String job_id) {}
