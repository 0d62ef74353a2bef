package com.phaseflow.coordinator.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phaseflow.coordinator.executor.dto.DispatchResponse;
import com.phaseflow.coordinator.executor.dto.JobStatusResponse;
import com.phaseflow.coordinator.model.PhaseRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * HTTP client for the execution service that runs a phase's actual work.
 *
 * Two endpoints:
 *   POST /jobs            submit a phase payload, returns {job_id}
 *   GET  /jobs/{job_id}   status ledger lookup, returns {status, error}
 *
 * The payload is forwarded verbatim; nothing here looks inside it.
 * Calls block, which is fine on the coordinator's scheduler thread.
 */
@Component
public class ExecutionClient {

    private static final Logger log = LoggerFactory.getLogger(ExecutionClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     requestTimeout;

    public ExecutionClient(
            @Value("${phaseflow.executor.base-url}") String baseUrl,
            @Value("${phaseflow.executor.request-timeout-seconds:30}") int requestTimeoutSeconds,
            ObjectMapper objectMapper) {
        this.baseUrl        = baseUrl;
        this.requestTimeout = Duration.ofSeconds(requestTimeoutSeconds);
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Job lifecycle
    // ------------------------------------------------------------------

    /**
     * Submit a phase to the executor.
     *
     * @return the executor's job id for later status lookups
     * @throws ExecutorException if the executor rejects the job or is unreachable
     */
    public String dispatch(PhaseRecord phase) {
        log.info("Dispatching phase {} of parent {} ({})",
                phase.getPhaseNumber(), phase.getParentTaskId(), phase.getQueueId());
        String body = toJson(dispatchBody(phase));
        String respBody = send(HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + "/jobs"))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body)),
                "dispatch of phase " + phase.getQueueId());
        try {
            DispatchResponse resp = json.readValue(respBody, DispatchResponse.class);
            if (resp.job_id() == null || resp.job_id().isBlank()) {
                throw new ExecutorException("Executor returned no job_id for phase " + phase.getQueueId());
            }
            return resp.job_id();
        } catch (JsonProcessingException e) {
            throw new ExecutorException("Failed to parse dispatch response", e);
        }
    }

    /**
     * Look up a job in the executor's status ledger.
     *
     * @throws ExecutorException if the lookup fails or the response is unreadable
     */
    public JobStatusResponse getStatus(String jobId) {
        String path = "/jobs/" + URLEncoder.encode(jobId, StandardCharsets.UTF_8);
        String respBody = send(HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + path))
                        .GET(),
                "status lookup for job " + jobId);
        try {
            JobStatusResponse resp = json.readValue(respBody, JobStatusResponse.class);
            if (resp.status() == null) {
                throw new ExecutorException("Executor returned no status for job " + jobId);
            }
            return resp;
        } catch (JsonProcessingException e) {
            throw new ExecutorException("Failed to parse status response for job " + jobId, e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private ObjectNode dispatchBody(PhaseRecord phase) {
        ObjectNode body = json.createObjectNode();
        body.put("queue_id",       phase.getQueueId().toString());
        body.put("parent_task_id", phase.getParentTaskId());
        body.put("phase_number",   phase.getPhaseNumber());
        body.set("payload",        readPayload(phase));
        return body;
    }

    private JsonNode readPayload(PhaseRecord phase) {
        try {
            return json.readTree(phase.getPayload());
        } catch (JsonProcessingException e) {
            throw new ExecutorException("Stored payload of phase " + phase.getQueueId() + " is not JSON", e);
        }
    }

    /** Send with the configured timeout; returns the 2xx response body. */
    private String send(HttpRequest.Builder builder, String opName) {
        try {
            HttpRequest req = builder
                    .timeout(requestTimeout)
                    .header("Accept", "application/json")
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ExecutorException(
                        opName + " failed — HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (ExecutorException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutorException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new ExecutorException(opName + " failed", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ExecutorException("JSON serialization failed", e);
        }
    }
}
