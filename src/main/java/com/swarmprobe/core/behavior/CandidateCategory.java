package com.swarmprobe.core.behavior;

import com.swarmprobe.core.client.WorldApi;

/**
 * Coarse action category. Mission steps may target a whole category, and error backoff
 * maps a category back to the endpoint it calls.
 */
public enum CandidateCategory {
    OBSERVE("observe", WorldApi.OBSERVE),
    POLL("poll", WorldApi.POLL_EVENTS),
    CHAT_OBSERVE("chat_observe", WorldApi.CHAT_OBSERVE),
    INTERACT("interact", WorldApi.INTERACT),
    NAVIGATE("navigate", WorldApi.MOVE_TO),
    CHAT("chat", WorldApi.CHAT_SEND),
    PROFILE("profile", WorldApi.PROFILE_UPDATE),
    SKILL("skill", "skill/"),
    WANDER("wander", WorldApi.MOVE_TO);

    private final String key;
    private final String endpoint;

    CandidateCategory(String key, String endpoint) {
        this.key = key;
        this.endpoint = endpoint;
    }

    public String key() {
        return key;
    }

    /** True when calls to {@code endpointName} are made by actions of this category. */
    public boolean callsEndpoint(String endpointName) {
        return endpoint.endsWith("/") ? endpointName.startsWith(endpoint) : endpoint.equals(endpointName);
    }

    public static CandidateCategory fromKey(String key) {
        for (CandidateCategory c : values()) {
            if (c.key.equals(key)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown candidate category: " + key);
    }
}
