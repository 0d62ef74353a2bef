package com.phaseflow.coordinator.api.dto;

/**
 * Request body for POST /queue/config/pause.
 * true pauses automatic dispatch, false resumes it.
 */
public record SetPausedRequest(Boolean paused) {}
