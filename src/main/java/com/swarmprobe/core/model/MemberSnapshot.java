package com.swarmprobe.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only value copy of one member's state, taken by the orchestrator once per cycle.
 * Detectors only ever see snapshots, never live members.
 */
public record MemberSnapshot(
    String memberId,
    boolean hasCredential,
    MemberRole role,
    MemberPhase phase,
    Position position,
    long cycleCount,
    int totalErrors,
    int consecutiveAuthFailures,
    List<ApiCallRecord> apiCalls,
    List<InteractionRecord> interactions,
    List<String> actionLabels,
    Map<String, EntityTrack> entityTracks,
    Map<String, FacilityObservation> facilities,
    List<ChatObservation> chat,
    Instant chatWindowStart,
    Instant lastChatObserveAt,
    Instant lastObserveAt,
    Position lastObservePosition,
    int lastObservedEntityCount,
    Set<String> lastObservedFacilityIds,
    Instant lastPollSuccessAt,
    Instant previousPollSuccessAt,
    String eventCursor,
    Set<String> installedSkills,
    Set<String> endpointsCalled,
    Map<String, Integer> opportunityCounts,
    Instant inRangeSince,
    Instant lastInteractionAt,
    Instant lastSuccessfulActionAt,
    long starvedCycles,
    int missionIndex,
    int stepIndex,
    ErrorDetail lastError,
    Instant capturedAt
) {

    public MemberSnapshot {
        apiCalls = List.copyOf(apiCalls);
        interactions = List.copyOf(interactions);
        actionLabels = List.copyOf(actionLabels);
        entityTracks = Map.copyOf(entityTracks);
        facilities = Map.copyOf(facilities);
        chat = List.copyOf(chat);
        lastObservedFacilityIds = Set.copyOf(lastObservedFacilityIds);
        installedSkills = Set.copyOf(installedSkills);
        endpointsCalled = Set.copyOf(endpointsCalled);
        opportunityCounts = Map.copyOf(opportunityCounts);
    }

    public boolean isRegistered() {
        return !memberId.isEmpty() && hasCredential;
    }

    public boolean isRetired() {
        return phase == MemberPhase.RETIRED;
    }

    public String lastActionLabel() {
        return actionLabels.isEmpty() ? "none" : actionLabels.get(actionLabels.size() - 1);
    }

    /**
     * Failure rate over the most recent {@code window} calls, or 0 when no calls were made.
     */
    public double recentFailureRate(int window) {
        int from = Math.max(0, apiCalls.size() - window);
        var recent = apiCalls.subList(from, apiCalls.size());
        if (recent.isEmpty()) {
            return 0.0;
        }
        long failures = recent.stream().filter(c -> !c.success()).count();
        return (double) failures / recent.size();
    }

    /** Display name for logs and evidence: member id, or the role when unregistered. */
    public String displayId() {
        return memberId.isEmpty() ? "(unregistered " + role.key() + ")" : memberId;
    }
}
