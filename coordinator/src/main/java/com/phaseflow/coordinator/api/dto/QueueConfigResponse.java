package com.phaseflow.coordinator.api.dto;

/**
 * Response body for GET /queue/config and POST /queue/config/pause.
 */
public record QueueConfigResponse(boolean paused) {}
