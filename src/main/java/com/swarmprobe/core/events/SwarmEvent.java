package com.swarmprobe.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while the swarm runs, consumed by the CLI progress output.
 *
 * @param eventType event type, e.g. "member.retired", "issue.created", "escalation.advanced"
 * @param sessionId run session this event belongs to (nullable for member events)
 * @param memberId  member the event relates to (nullable for swarm-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record SwarmEvent(
    String eventType,
    String sessionId,
    String memberId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public SwarmEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static SwarmEvent swarm(String eventType, String sessionId, Map<String, Object> payload, Instant timestamp) {
        return new SwarmEvent(eventType, sessionId, null, payload, timestamp);
    }
}
