package com.phaseflow.coordinator.api.dto;

import com.phaseflow.coordinator.model.PhaseRecord;

import java.util.List;

/**
 * Response body for GET /queue and GET /queue/{parentTaskId}.
 */
public record PhaseListResponse(List<PhaseResponse> phases, int total) {

    public static PhaseListResponse from(List<PhaseRecord> records) {
        List<PhaseResponse> phases = records.stream().map(PhaseResponse::from).toList();
        return new PhaseListResponse(phases, phases.size());
    }
}
