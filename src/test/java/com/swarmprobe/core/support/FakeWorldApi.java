package com.swarmprobe.core.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.swarmprobe.core.client.ChatMessage;
import com.swarmprobe.core.client.EventBatch;
import com.swarmprobe.core.client.InteractOutcome;
import com.swarmprobe.core.client.Observation;
import com.swarmprobe.core.client.Session;
import com.swarmprobe.core.client.SkillInfo;
import com.swarmprobe.core.client.WorldApi;
import com.swarmprobe.core.client.WorldApiException;
import com.swarmprobe.core.model.Position;

import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * In-memory {@link WorldApi} that counts calls and fails on demand.
 */
public class FakeWorldApi implements WorldApi {

    private final AtomicInteger nextAgent = new AtomicInteger();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final Map<String, Integer> stickyFailures = new ConcurrentHashMap<>();
    private final Map<String, Queue<Integer>> oneShotFailures = new ConcurrentHashMap<>();

    private volatile boolean healthy = true;
    private volatile Function<Session, Observation> observer =
            session -> new Observation(Position.ORIGIN, List.of(), List.of(), 0, 2048, 2048);

    public void setHealthy(boolean healthy) {
        this.healthy = healthy;
    }

    public void setObserver(Function<Session, Observation> observer) {
        this.observer = observer;
    }

    /** Every call to {@code endpoint} fails with {@code status} from now on. */
    public void failAlways(String endpoint, int status) {
        stickyFailures.put(endpoint, status);
    }

    /** The next call to {@code endpoint} fails with {@code status}. */
    public void failNext(String endpoint, int status) {
        oneShotFailures.computeIfAbsent(endpoint, k -> new ConcurrentLinkedQueue<>()).add(status);
    }

    public int calls(String endpoint) {
        var count = calls.get(endpoint);
        return count == null ? 0 : count.get();
    }

    public int totalCalls() {
        return calls.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    private void enter(String endpoint) {
        calls.computeIfAbsent(endpoint, k -> new AtomicInteger()).incrementAndGet();
        Integer status = null;
        var queued = oneShotFailures.get(endpoint);
        if (queued != null) {
            status = queued.poll();
        }
        if (status == null) {
            status = stickyFailures.get(endpoint);
        }
        if (status != null) {
            throw new WorldApiException(endpoint, WorldApiException.classify(status), status,
                    status == 401 ? "unauthorized" : "failed", endpoint + " failed with " + status, false);
        }
    }

    @Override
    public Session register(String name, String roomId) {
        enter(REGISTER);
        int n = nextAgent.incrementAndGet();
        return new Session("agent-" + n, "token-" + n, roomId);
    }

    @Override
    public void unregister(Session session) {
        enter(UNREGISTER);
    }

    @Override
    public Observation observe(Session session, int radius) {
        enter(OBSERVE);
        return observer.apply(session);
    }

    @Override
    public void moveTo(Session session, String txId, int tileX, int tileY) {
        enter(MOVE_TO);
    }

    @Override
    public void chatSend(Session session, String txId, String channel, String message) {
        enter(CHAT_SEND);
    }

    @Override
    public List<ChatMessage> chatObserve(Session session, int windowSec, String channel) {
        enter(CHAT_OBSERVE);
        return List.of();
    }

    @Override
    public InteractOutcome interact(Session session, String txId, String targetId, String action) {
        enter(INTERACT);
        return new InteractOutcome("ok", "");
    }

    @Override
    public EventBatch pollEvents(Session session, String sinceCursor, int limit) {
        enter(POLL_EVENTS);
        return new EventBatch(List.of(), "c-" + calls(POLL_EVENTS));
    }

    @Override
    public void updateProfile(Session session, String txId, Map<String, String> profile) {
        enter(PROFILE_UPDATE);
    }

    @Override
    public List<SkillInfo> listSkills(Session session) {
        enter(SKILL_LIST);
        return List.of();
    }

    @Override
    public void installSkill(Session session, String txId, String skillId) {
        enter(SKILL_INSTALL);
    }

    @Override
    public JsonNode invokeSkill(Session session, String txId, String skillId, String actionId,
                                Map<String, Object> params) {
        enter(SKILL_INVOKE);
        return JsonNodeFactory.instance.objectNode();
    }

    @Override
    public boolean healthy() {
        return healthy;
    }
}
