package com.phaseflow.coordinator.tracker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Minimal client for a GitHub-style issue API. Only comment creation is needed.
 */
@Component
public class IssueTrackerClient {

    private static final Logger log = LoggerFactory.getLogger(IssueTrackerClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       repository;
    private final String       token;

    public IssueTrackerClient(
            @Value("${phaseflow.issue-tracker.base-url:https://api.github.com}") String baseUrl,
            @Value("${phaseflow.issue-tracker.repository:}") String repository,
            @Value("${phaseflow.issue-tracker.token:}") String token,
            ObjectMapper objectMapper) {
        this.baseUrl    = baseUrl;
        this.repository = repository;
        this.token      = token;
        this.json       = objectMapper;
        this.http       = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public String repository() {
        return repository;
    }

    /**
     * Post a markdown comment on an issue.
     *
     * @throws IssueTrackerException on a non-2xx response or transport failure
     */
    public void postComment(long issueNumber, String markdown) {
        if (repository == null || repository.isBlank()) {
            throw new IssueTrackerException("phaseflow.issue-tracker.repository is not set");
        }
        String path = "/repos/" + repository + "/issues/" + issueNumber + "/comments";
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(Duration.ofSeconds(30))
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/vnd.github+json")
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(Map.of("body", markdown))));
            if (token != null && !token.isBlank()) {
                builder.header("Authorization", "Bearer " + token);
            }
            HttpResponse<String> resp = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new IssueTrackerException("Comment on issue #" + issueNumber
                        + " failed — HTTP " + resp.statusCode() + ": " + resp.body());
            }
            log.info("Posted comment on issue #{}", issueNumber);
        } catch (IssueTrackerException e) {
            throw e;
        } catch (JsonProcessingException e) {
            throw new IssueTrackerException("JSON serialization failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IssueTrackerException("Comment on issue #" + issueNumber + " interrupted", e);
        } catch (Exception e) {
            throw new IssueTrackerException("Comment on issue #" + issueNumber + " failed", e);
        }
    }
}
