package com.swarmprobe.core.swarm;

import com.swarmprobe.core.behavior.MissionCursor;
import com.swarmprobe.core.behavior.RoleProfile;
import com.swarmprobe.core.client.ChatMessage;
import com.swarmprobe.core.client.EventBatch;
import com.swarmprobe.core.client.Observation;
import com.swarmprobe.core.client.ObservedEntity;
import com.swarmprobe.core.client.ObservedFacility;
import com.swarmprobe.core.client.Session;
import com.swarmprobe.core.client.SkillInfo;
import com.swarmprobe.core.client.WorldApi;
import com.swarmprobe.core.model.ApiCallRecord;
import com.swarmprobe.core.model.ChatObservation;
import com.swarmprobe.core.model.EntitySighting;
import com.swarmprobe.core.model.EntityTrack;
import com.swarmprobe.core.model.ErrorDetail;
import com.swarmprobe.core.model.FacilityObservation;
import com.swarmprobe.core.model.InteractionRecord;
import com.swarmprobe.core.model.MemberPhase;
import com.swarmprobe.core.model.MemberRole;
import com.swarmprobe.core.model.MemberSnapshot;
import com.swarmprobe.core.model.Position;
import com.swarmprobe.core.util.RingBuffer;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state owned by one member. Every method locks the instance briefly; callers
 * never hold the lock across a network call.
 * <p>
 * Identity and credential change together: both are set by {@link #assignSession} and both
 * cleared by {@link #clearSession}, so a snapshot never shows one without the other.
 */
final class MemberState {

    private final MemberSettings settings;

    private Session session;
    private MemberRole role;
    private MemberPhase phase = MemberPhase.UNREGISTERED;
    private Position position = Position.ORIGIN;
    private long cycleCount;
    private int totalErrors;
    private int consecutiveAuthFailures;

    private final RingBuffer<ApiCallRecord> apiCalls;
    private final RingBuffer<InteractionRecord> interactions;
    private final RingBuffer<String> actionLabels;
    private final LinkedHashMap<String, EntityTrack> entityTracks;
    private final LinkedHashMap<String, FacilityObservation> facilities;
    private final RingBuffer<ChatObservation> chat;

    private Instant chatWindowStart;
    private Instant lastChatObserveAt;
    private Instant lastObserveAt;
    private Position lastObservePosition;
    private int lastObservedEntityCount;
    private Set<String> lastObservedFacilityIds = Set.of();
    private Instant lastPollSuccessAt;
    private Instant previousPollSuccessAt;
    private String eventCursor;
    private final Set<String> installedSkills = new HashSet<>();
    private List<SkillInfo> knownSkills = List.of();
    private final Set<String> endpointsCalled = new LinkedHashSet<>();
    private final Map<String, Integer> opportunityCounts = new HashMap<>();
    private Instant inRangeSince;
    private Instant lastInteractionAt;
    private Instant lastSuccessfulActionAt;
    private long starvedCycles;
    private MissionCursor missionCursor = MissionCursor.START;
    private ErrorDetail lastError;

    private int cyclesSinceObserve = Integer.MAX_VALUE / 2;
    private int cyclesSincePoll;
    private boolean authFailureThisCycle;

    MemberState(MemberRole role, MemberSettings settings) {
        this.role = role;
        this.settings = settings;
        this.apiCalls = new RingBuffer<>(settings.historyCapacity());
        this.interactions = new RingBuffer<>(settings.historyCapacity());
        this.actionLabels = new RingBuffer<>(settings.labelHistoryCapacity());
        this.chat = new RingBuffer<>(settings.chatCapacity());
        this.entityTracks = boundedMap(settings.trackedEntities());
        this.facilities = boundedMap(settings.trackedFacilities());
    }

    private static <V> LinkedHashMap<String, V> boundedMap(int capacity) {
        return new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, V> eldest) {
                return size() > capacity;
            }
        };
    }

    // -- lifecycle --

    synchronized void assignSession(Session newSession) {
        this.session = newSession;
        this.phase = MemberPhase.ACTIVE;
    }

    synchronized void clearSession(MemberPhase nextPhase) {
        this.session = null;
        this.phase = nextPhase;
    }

    synchronized Session session() {
        return session;
    }

    synchronized MemberPhase phase() {
        return phase;
    }

    synchronized void setPhase(MemberPhase next) {
        this.phase = next;
    }

    synchronized MemberRole role() {
        return role;
    }

    synchronized boolean changeRole(MemberRole next) {
        if (role == next) {
            return false;
        }
        role = next;
        missionCursor = MissionCursor.START;
        return true;
    }

    synchronized Position position() {
        return position;
    }

    /**
     * Clears what the member knew about the world before re-registering. Call and label
     * histories are kept so detectors still see what led up to the auth failure.
     */
    synchronized void resetForReregistration() {
        entityTracks.clear();
        facilities.clear();
        chat.clear();
        chatWindowStart = null;
        lastChatObserveAt = null;
        lastObservedFacilityIds = Set.of();
        lastObservedEntityCount = 0;
        lastPollSuccessAt = null;
        previousPollSuccessAt = null;
        eventCursor = null;
        installedSkills.clear();
        inRangeSince = null;
        cyclesSinceObserve = Integer.MAX_VALUE / 2;
        cyclesSincePoll = 0;
    }

    // -- cycle bookkeeping --

    synchronized void beginCycle() {
        authFailureThisCycle = false;
    }

    /**
     * Counts an auth failure at most once per cycle.
     *
     * @return the updated consecutive-failure count
     */
    synchronized int recordAuthFailure() {
        if (!authFailureThisCycle) {
            authFailureThisCycle = true;
            consecutiveAuthFailures++;
        }
        return consecutiveAuthFailures;
    }

    /** Counts a failed re-registration round regardless of earlier failures this cycle. */
    synchronized int recordFailedReregistration() {
        return ++consecutiveAuthFailures;
    }

    synchronized int consecutiveAuthFailures() {
        return consecutiveAuthFailures;
    }

    synchronized boolean observationDue() {
        return cyclesSinceObserve >= settings.observeWindowCycles();
    }

    synchronized boolean pollDue() {
        return cyclesSincePoll >= settings.pollWindowCycles();
    }

    synchronized void completeCycle(String label, RoleProfile profile) {
        actionLabels.add(label);
        cycleCount++;
        cyclesSinceObserve++;
        cyclesSincePoll++;
        if (lastObserveAt != null && lastObservedEntityCount == 0 && lastObservedFacilityIds.isEmpty()) {
            starvedCycles++;
        } else {
            starvedCycles = 0;
        }
        missionCursor = missionCursor.advance(profile);
    }

    synchronized MissionCursor missionCursor() {
        return missionCursor;
    }

    synchronized List<String> recentLabels(int window) {
        return actionLabels.tail(window);
    }

    synchronized void countOpportunities(Collection<String> keys) {
        for (String key : keys) {
            opportunityCounts.merge(key, 1, Integer::sum);
        }
    }

    /**
     * Endpoints that failed in the recent call window, once the member has accumulated more
     * errors than the suppression threshold; empty otherwise.
     */
    synchronized Set<String> failingEndpoints() {
        if (totalErrors <= settings.errorSuppressionThreshold()) {
            return Set.of();
        }
        var failing = new HashSet<String>();
        for (ApiCallRecord call : apiCalls.tail(10)) {
            if (!call.success()) {
                failing.add(call.endpoint());
            }
        }
        return failing;
    }

    // -- call recording --

    synchronized void recordCall(ApiCallRecord call) {
        apiCalls.add(call);
        endpointsCalled.add(call.endpoint());
        if (call.success()) {
            lastSuccessfulActionAt = call.timestamp();
            if (session != null && !WorldApi.UNREGISTER.equals(call.endpoint())) {
                consecutiveAuthFailures = 0;
            }
        }
    }

    synchronized void recordError(ErrorDetail detail) {
        totalErrors++;
        lastError = detail;
    }

    synchronized void applyObservation(Observation observation, Instant now) {
        position = observation.self();
        for (ObservedEntity entity : observation.nearby()) {
            var sighting = new EntitySighting(entity.id(), entity.position(), now);
            var track = entityTracks.get(entity.id());
            entityTracks.put(entity.id(), track == null
                    ? new EntityTrack(entity.id(), sighting, null)
                    : track.advance(sighting));
        }
        var ids = new LinkedHashSet<String>();
        boolean inRange = false;
        for (ObservedFacility f : observation.facilities()) {
            facilities.put(f.id(), new FacilityObservation(f.id(), f.type(), f.affordances(),
                    f.distance(), f.position(), now));
            ids.add(f.id());
            if (!f.affordances().isEmpty() && position.distanceTo(f.position()) <= settings.interactRangePx()) {
                inRange = true;
            }
        }
        lastObservedFacilityIds = Set.copyOf(ids);
        lastObservedEntityCount = observation.nearby().size();
        lastObserveAt = now;
        lastObservePosition = position;
        cyclesSinceObserve = 0;
        if (!inRange) {
            inRangeSince = null;
        } else if (inRangeSince == null) {
            inRangeSince = now;
        }
    }

    synchronized void applyChat(List<ChatMessage> messages, Instant now) {
        chat.clear();
        for (ChatMessage m : messages) {
            var sender = m.fromEntityId().isEmpty() ? m.fromName() : m.fromEntityId();
            chat.add(new ChatObservation(sender, m.message(), m.channel(), Instant.ofEpochMilli(m.tsMs())));
        }
        chatWindowStart = now.minusSeconds(settings.chatWindowSec());
        lastChatObserveAt = now;
    }

    synchronized void applyPoll(EventBatch batch, Instant now) {
        previousPollSuccessAt = lastPollSuccessAt;
        lastPollSuccessAt = now;
        eventCursor = batch.nextCursor();
        cyclesSincePoll = 0;
    }

    synchronized String eventCursor() {
        return eventCursor;
    }

    synchronized void recordInteraction(InteractionRecord record) {
        interactions.add(record);
        lastInteractionAt = record.timestamp();
    }

    synchronized void setKnownSkills(List<SkillInfo> skills) {
        knownSkills = List.copyOf(skills);
    }

    synchronized List<SkillInfo> knownSkills() {
        return knownSkills;
    }

    synchronized void skillInstalled(String skillId) {
        installedSkills.add(skillId);
    }

    synchronized MemberSnapshot snapshot(Instant capturedAt) {
        boolean registered = session != null;
        return new MemberSnapshot(
                registered ? session.agentId() : "",
                registered,
                role,
                phase,
                position,
                cycleCount,
                totalErrors,
                consecutiveAuthFailures,
                apiCalls.toList(),
                interactions.toList(),
                actionLabels.toList(),
                entityTracks,
                facilities,
                chat.toList(),
                chatWindowStart,
                lastChatObserveAt,
                lastObserveAt,
                lastObservePosition,
                lastObservedEntityCount,
                lastObservedFacilityIds,
                lastPollSuccessAt,
                previousPollSuccessAt,
                eventCursor,
                installedSkills,
                endpointsCalled,
                opportunityCounts,
                inRangeSince,
                lastInteractionAt,
                lastSuccessfulActionAt,
                starvedCycles,
                missionCursor.missionIndex(),
                missionCursor.stepIndex(),
                lastError,
                capturedAt);
    }
}
