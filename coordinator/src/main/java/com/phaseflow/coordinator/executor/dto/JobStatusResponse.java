package com.phaseflow.coordinator.executor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from GET /jobs/{job_id} on the execution service.
 *
 * @param error failure reason, only set when status = failed
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobStatusResponse(
        String            job_id,
        ExternalJobStatus status,
        String            error
) {}
