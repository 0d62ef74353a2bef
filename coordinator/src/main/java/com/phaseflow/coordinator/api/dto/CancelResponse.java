package com.phaseflow.coordinator.api.dto;

/**
 * Response body for DELETE /queue/{queueId}.
 */
public record CancelResponse(boolean success, String message) {}
