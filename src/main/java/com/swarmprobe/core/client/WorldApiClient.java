package com.swarmprobe.core.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.swarmprobe.core.config.SwarmProbeProperties;
import com.swarmprobe.core.model.ErrorClass;
import com.swarmprobe.core.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the world server's action API ({@code /aic/v0.1}).
 *
 * <p>Every endpoint is a JSON POST answered with an envelope, either
 * {@code {"status":"ok","data":{...}}} or
 * {@code {"status":"error","error":{"code","message","retryable"}}}.
 * Authenticated calls carry the session token as a bearer header and repeat the
 * agent and room ids in the body.
 */
public class WorldApiClient implements WorldApi {

    private static final Logger log = LoggerFactory.getLogger(WorldApiClient.class);

    private final SwarmProbeProperties.Target target;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public WorldApiClient(SwarmProbeProperties.Target target, ObjectMapper objectMapper) {
        this.target = target;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(target.getConnectTimeoutSeconds()))
                .build();
    }

    @Override
    public Session register(String name, String roomId) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("name", name);
        body.put("roomId", roomId);

        var data = post(REGISTER, null, body);
        var agentId = data.path("agentId").asText("");
        var token = data.path("sessionToken").asText("");
        if (agentId.isEmpty() || token.isEmpty()) {
            throw new WorldApiException(REGISTER, ErrorClass.SERVER, 200, "bad_response",
                    "register response missing agentId or sessionToken", false);
        }
        log.debug("Registered '{}' as {}", name, agentId);
        return new Session(agentId, token, data.path("roomId").asText(roomId));
    }

    @Override
    public void unregister(Session session) {
        post(UNREGISTER, session, authBody(session));
    }

    @Override
    public Observation observe(Session session, int radius) {
        ObjectNode body = authBody(session);
        body.put("radius", radius);
        body.put("detail", "full");

        var data = post(OBSERVE, session, body);
        var self = data.path("self");
        var selfPos = self.has("pos") ? toPosition(self.path("pos")) : toPosition(self);

        var nearby = new ArrayList<ObservedEntity>();
        for (JsonNode item : data.path("nearby")) {
            var entity = item.path("entity");
            nearby.add(new ObservedEntity(
                    entity.path("id").asText(),
                    entity.path("kind").asText(""),
                    toPosition(entity.path("pos")),
                    item.path("distance").asDouble(),
                    affordances(item.path("affords"))));
        }

        var facilities = new ArrayList<ObservedFacility>();
        for (JsonNode item : data.path("facilities")) {
            facilities.add(new ObservedFacility(
                    item.path("id").asText(),
                    item.path("type").asText(""),
                    toPosition(item.path("position")),
                    item.path("distance").asDouble(),
                    affordances(item.path("affords"))));
        }

        var mapSize = data.path("mapMetadata").path("mapSize");
        int tileSize = mapSize.path("tileSize").asInt(target.getTileSizePx());
        return new Observation(selfPos, nearby, facilities,
                data.path("serverTsMs").asLong(0),
                mapSize.path("width").asInt(0) * tileSize,
                mapSize.path("height").asInt(0) * tileSize);
    }

    @Override
    public void moveTo(Session session, String txId, int tileX, int tileY) {
        ObjectNode body = authBody(session);
        body.put("txId", txId);
        ObjectNode dest = body.putObject("dest");
        dest.put("tx", tileX);
        dest.put("ty", tileY);
        post(MOVE_TO, session, body);
    }

    @Override
    public void chatSend(Session session, String txId, String channel, String message) {
        ObjectNode body = authBody(session);
        body.put("txId", txId);
        body.put("channel", channel);
        body.put("message", message);
        post(CHAT_SEND, session, body);
    }

    @Override
    public List<ChatMessage> chatObserve(Session session, int windowSec, String channel) {
        ObjectNode body = authBody(session);
        body.put("windowSec", windowSec);
        if (channel != null) {
            body.put("channel", channel);
        }

        var data = post(CHAT_OBSERVE, session, body);
        var messages = new ArrayList<ChatMessage>();
        for (JsonNode m : data.path("messages")) {
            messages.add(new ChatMessage(
                    m.path("fromEntityId").asText(""),
                    m.path("fromName").asText(""),
                    m.path("message").asText(""),
                    m.path("channel").asText(""),
                    m.path("tsMs").asLong(0)));
        }
        return messages;
    }

    @Override
    public InteractOutcome interact(Session session, String txId, String targetId, String action) {
        ObjectNode body = authBody(session);
        body.put("txId", txId);
        body.put("targetId", targetId);
        body.put("action", action);

        var outcome = post(INTERACT, session, body).path("outcome");
        return new InteractOutcome(outcome.path("type").asText("ok"), outcome.path("message").asText(""));
    }

    @Override
    public EventBatch pollEvents(Session session, String sinceCursor, int limit) {
        ObjectNode body = authBody(session);
        if (sinceCursor != null) {
            body.put("sinceCursor", sinceCursor);
        }
        body.put("limit", limit);

        var data = post(POLL_EVENTS, session, body);
        var types = new ArrayList<String>();
        for (JsonNode event : data.path("events")) {
            types.add(event.path("type").asText("unknown"));
        }
        var next = data.path("nextCursor");
        return new EventBatch(types, next.isMissingNode() || next.isNull() ? sinceCursor : next.asText());
    }

    @Override
    public void updateProfile(Session session, String txId, Map<String, String> profile) {
        ObjectNode body = authBody(session);
        body.put("txId", txId);
        profile.forEach(body::put);
        post(PROFILE_UPDATE, session, body);
    }

    @Override
    public List<SkillInfo> listSkills(Session session) {
        var data = post(SKILL_LIST, session, authBody(session));
        var skills = new ArrayList<SkillInfo>();
        for (JsonNode s : data.path("skills")) {
            var actions = new ArrayList<String>();
            for (JsonNode a : s.path("actions")) {
                actions.add(a.path("id").asText());
            }
            skills.add(new SkillInfo(s.path("id").asText(), s.path("name").asText(""),
                    s.path("category").asText(""), actions));
        }
        return skills;
    }

    @Override
    public void installSkill(Session session, String txId, String skillId) {
        ObjectNode body = authBody(session);
        body.put("txId", txId);
        body.put("skillId", skillId);
        post(SKILL_INSTALL, session, body);
    }

    @Override
    public JsonNode invokeSkill(Session session, String txId, String skillId, String actionId,
                                Map<String, Object> params) {
        ObjectNode body = authBody(session);
        body.put("txId", txId);
        body.put("skillId", skillId);
        body.put("actionId", actionId);
        body.set("params", objectMapper.valueToTree(params));
        return post(SKILL_INVOKE, session, body);
    }

    @Override
    public boolean healthy() {
        try {
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(target.getBaseUrl() + "/health"))
                    .timeout(Duration.ofSeconds(target.getRequestTimeoutSeconds()))
                    .GET()
                    .build();
            var response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            return response.statusCode() < 400;
        } catch (IOException e) {
            log.warn("Health probe of {} failed: {}", target.getBaseUrl(), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private ObjectNode authBody(Session session) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("agentId", session.agentId());
        body.put("roomId", session.roomId());
        return body;
    }

    /**
     * Posts to an endpoint and unwraps the envelope, returning {@code data}.
     */
    JsonNode post(String endpoint, Session session, ObjectNode body) {
        HttpResponse<String> response;
        try {
            var builder = HttpRequest.newBuilder()
                    .uri(URI.create(target.getBaseUrl() + target.getApiPrefix() + "/" + endpoint))
                    .timeout(Duration.ofSeconds(target.getRequestTimeoutSeconds()))
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
            if (session != null) {
                builder.header("Authorization", "Bearer " + session.sessionToken());
            }
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new WorldApiException(endpoint, "POST " + endpoint + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorldApiException(endpoint, "POST " + endpoint + " interrupted", e);
        }

        int status = response.statusCode();
        JsonNode envelope = parse(endpoint, status, response.body());

        if (status >= 400 || !"ok".equals(envelope.path("status").asText())) {
            var error = envelope.path("error");
            var errorClass = status >= 400 ? WorldApiException.classify(status) : ErrorClass.CLIENT;
            throw new WorldApiException(endpoint, errorClass, status,
                    error.path("code").asText(null),
                    "POST %s failed (HTTP %d): %s".formatted(endpoint, status,
                            error.path("message").asText(truncate(response.body()))),
                    error.path("retryable").asBoolean(false));
        }
        return envelope.path("data");
    }

    private JsonNode parse(String endpoint, int status, String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            if (status >= 400) {
                return objectMapper.createObjectNode();
            }
            throw new WorldApiException(endpoint, WorldApiException.classify(status), status,
                    "bad_response", "POST " + endpoint + " returned invalid JSON", false);
        }
    }

    private static Position toPosition(JsonNode node) {
        return new Position(node.path("x").asDouble(), node.path("y").asDouble());
    }

    private static List<String> affordances(JsonNode affords) {
        var actions = new ArrayList<String>();
        for (JsonNode a : affords) {
            actions.add(a.isTextual() ? a.asText() : a.path("action").asText());
        }
        return actions;
    }

    private static String truncate(String text) {
        if (text == null) return "";
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
