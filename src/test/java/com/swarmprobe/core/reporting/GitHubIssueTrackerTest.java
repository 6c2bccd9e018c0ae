package com.swarmprobe.core.reporting;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swarmprobe.core.support.StubHttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link GitHubIssueTracker}.
 */
class GitHubIssueTrackerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private StubHttpServer server;
    private GitHubIssueTracker tracker;

    @BeforeEach
    void setUp() {
        server = new StubHttpServer();
        tracker = new GitHubIssueTracker(server.baseUrl() + "/", "acme", "world", "ghp_test", mapper);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void listsOpenIssuesSkippingPullRequests() {
        server.respond("GET", "/repos/acme/world/issues", 200, """
                [{"number":12,"title":"[Resident-Agent][Sync] Drift","labels":[{"name":"resident-agent"},{"name":"sync"}],
                  "html_url":"https://github.com/acme/world/issues/12"},
                 {"number":13,"title":"Bump deps","labels":[],"pull_request":{}}]
                """);

        var issues = tracker.listOpenIssues("resident-agent");

        assertEquals(List.of(new TrackedIssue("12", "[Resident-Agent][Sync] Drift",
                List.of("resident-agent", "sync"), "https://github.com/acme/world/issues/12")), issues);
        var request = server.lastRequest();
        assertEquals("state=open&per_page=100&labels=resident-agent", request.query());
        assertEquals("Bearer ghp_test", request.header("Authorization"));
        assertEquals("application/vnd.github+json", request.header("Accept"));
    }

    @Test
    void createsIssueWithLabels() throws Exception {
        server.respond("POST", "/repos/acme/world/issues", 201,
                "{\"number\":14,\"title\":\"T\",\"html_url\":\"https://github.com/acme/world/issues/14\"}");

        var created = tracker.createIssue("T", "body", List.of("resident-agent", "chat", "minor"));

        assertEquals("14", created.reference());
        var payload = mapper.readTree(server.lastRequest().body());
        assertEquals("T", payload.path("title").asText());
        assertEquals("body", payload.path("body").asText());
        assertEquals(3, payload.path("labels").size());
        assertEquals("chat", payload.path("labels").get(1).asText());
    }

    @Test
    void unexpectedStatusThrowsWithStatus() {
        server.respond("POST", "/repos/acme/world/issues/14/comments", 403, "{\"message\":\"Forbidden\"}");

        var e = assertThrows(TrackerException.class, () -> tracker.addComment("14", "again"));
        assertEquals(403, e.getHttpStatus());
    }

    @Test
    void commentPostsBody() throws Exception {
        server.respond("POST", "/repos/acme/world/issues/14/comments", 201, "{\"id\":1}");

        tracker.addComment("14", "seen again");

        assertEquals("seen again", mapper.readTree(server.lastRequest().body()).path("body").asText());
    }

    @Test
    void reachableProbesRepository() {
        assertFalse(tracker.reachable());
        server.respond("GET", "/repos/acme/world", 200, "{\"full_name\":\"acme/world\"}");
        assertTrue(tracker.reachable());
        assertEquals("github:acme/world", tracker.describe());
    }
}
