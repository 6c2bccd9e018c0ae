package com.swarmprobe.core.reporting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.swarmprobe.core.config.SwarmProbeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * GitHub REST v3 issue tracker.
 *
 * <p>Uses {@code GET /repos/{owner}/{repo}/issues}, {@code POST /repos/{owner}/{repo}/issues}
 * and {@code POST /repos/{owner}/{repo}/issues/{number}/comments}, authenticated with a
 * bearer token.
 */
public class GitHubIssueTracker implements IssueTracker {

    private static final Logger log = LoggerFactory.getLogger(GitHubIssueTracker.class);

    private static final Duration TIMEOUT = Duration.ofSeconds(15);

    private final String apiUrl;
    private final String owner;
    private final String repo;
    private final String token;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GitHubIssueTracker(SwarmProbeProperties.Tracker tracker, ObjectMapper objectMapper) {
        this(tracker.getApiUrl(), tracker.getOwner(), tracker.getRepo(), tracker.resolveToken(), objectMapper);
    }

    public GitHubIssueTracker(String apiUrl, String owner, String repo, String token, ObjectMapper objectMapper) {
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.owner = owner;
        this.repo = repo;
        this.token = token;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @Override
    public List<TrackedIssue> listOpenIssues(String label) {
        var path = "/issues?state=open&per_page=100&labels=" + URLEncoder.encode(label, StandardCharsets.UTF_8);
        var array = send(request(path).GET().build(), 200);

        var issues = new ArrayList<TrackedIssue>();
        for (JsonNode item : array) {
            if (item.has("pull_request")) {
                continue;
            }
            var labels = new ArrayList<String>();
            for (JsonNode l : item.path("labels")) {
                labels.add(l.path("name").asText());
            }
            issues.add(new TrackedIssue(item.path("number").asText(), item.path("title").asText(""),
                    labels, item.path("html_url").asText("")));
        }
        log.debug("Listed {} open issues labelled '{}'", issues.size(), label);
        return issues;
    }

    @Override
    public TrackedIssue createIssue(String title, String body, List<String> labels) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("title", title);
        payload.put("body", body);
        var labelArray = payload.putArray("labels");
        labels.forEach(labelArray::add);

        var created = send(request("/issues").POST(json(payload)).build(), 201);
        var issue = new TrackedIssue(created.path("number").asText(), created.path("title").asText(title),
                labels, created.path("html_url").asText(""));
        log.info("Created issue #{} {}", issue.reference(), issue.url());
        return issue;
    }

    @Override
    public void addComment(String reference, String body) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("body", body);
        send(request("/issues/" + reference + "/comments").POST(json(payload)).build(), 201);
        log.debug("Commented on issue #{}", reference);
    }

    @Override
    public boolean reachable() {
        try {
            send(request("").GET().build(), 200);
            return true;
        } catch (TrackerException e) {
            log.warn("Tracker probe failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String describe() {
        return "github:" + owner + "/" + repo;
    }

    private HttpRequest.Builder request(String path) {
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(apiUrl + "/repos/" + owner + "/" + repo + path))
                .timeout(TIMEOUT)
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", "2022-11-28");
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder;
    }

    private HttpRequest.BodyPublisher json(ObjectNode payload) {
        try {
            return HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new TrackerException("Failed to serialize tracker payload", e);
        }
    }

    private JsonNode send(HttpRequest request, int expectedStatus) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TrackerException(request.method() + " " + request.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrackerException(request.method() + " " + request.uri() + " interrupted", e);
        }
        if (response.statusCode() != expectedStatus) {
            throw new TrackerException("%s %s returned HTTP %d".formatted(
                    request.method(), request.uri().getPath(), response.statusCode()), response.statusCode());
        }
        try {
            var body = response.body();
            return body == null || body.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TrackerException("Tracker returned invalid JSON", e);
        }
    }
}
