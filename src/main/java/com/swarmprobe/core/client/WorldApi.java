package com.swarmprobe.core.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Action API of the world server under test.
 * <p>
 * Every method throws {@link WorldApiException} on a transport failure, a non-2xx status,
 * or an error envelope. Mutating calls take a fresh transaction id from the caller.
 */
public interface WorldApi {

    String REGISTER = "register";
    String UNREGISTER = "unregister";
    String OBSERVE = "observe";
    String MOVE_TO = "moveTo";
    String CHAT_SEND = "chatSend";
    String CHAT_OBSERVE = "chatObserve";
    String INTERACT = "interact";
    String POLL_EVENTS = "pollEvents";
    String PROFILE_UPDATE = "profile/update";
    String SKILL_LIST = "skill/list";
    String SKILL_INSTALL = "skill/install";
    String SKILL_INVOKE = "skill/invoke";

    /** All endpoints the swarm is expected to exercise. */
    List<String> ENDPOINTS = List.of(REGISTER, UNREGISTER, OBSERVE, MOVE_TO, CHAT_SEND, CHAT_OBSERVE,
            INTERACT, POLL_EVENTS, PROFILE_UPDATE, SKILL_LIST, SKILL_INSTALL, SKILL_INVOKE);

    Session register(String name, String roomId);

    void unregister(Session session);

    Observation observe(Session session, int radius);

    void moveTo(Session session, String txId, int tileX, int tileY);

    void chatSend(Session session, String txId, String channel, String message);

    List<ChatMessage> chatObserve(Session session, int windowSec, String channel);

    InteractOutcome interact(Session session, String txId, String targetId, String action);

    EventBatch pollEvents(Session session, String sinceCursor, int limit);

    void updateProfile(Session session, String txId, Map<String, String> profile);

    List<SkillInfo> listSkills(Session session);

    void installSkill(Session session, String txId, String skillId);

    JsonNode invokeSkill(Session session, String txId, String skillId, String actionId, Map<String, Object> params);

    /**
     * Probes the unauthenticated health endpoint. Never throws.
     */
    boolean healthy();
}
