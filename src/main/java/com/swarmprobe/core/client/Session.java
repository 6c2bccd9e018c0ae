package com.swarmprobe.core.client;

/**
 * Credential issued by the target on registration.
 *
 * @param agentId      server-assigned identity
 * @param sessionToken bearer token for authenticated calls
 * @param roomId       room the member joined
 */
public record Session(String agentId, String sessionToken, String roomId) {

    @Override
    public String toString() {
        return "Session[agentId=" + agentId + ", roomId=" + roomId + "]";
    }
}
