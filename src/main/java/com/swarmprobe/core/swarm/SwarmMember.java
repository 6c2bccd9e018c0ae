package com.swarmprobe.core.swarm;

import com.swarmprobe.core.behavior.ActionCandidate;
import com.swarmprobe.core.behavior.BehaviorSettings;
import com.swarmprobe.core.behavior.CandidateLabels;
import com.swarmprobe.core.behavior.MemberActions;
import com.swarmprobe.core.behavior.RoleProfile;
import com.swarmprobe.core.behavior.SelectionContext;
import com.swarmprobe.core.client.Session;
import com.swarmprobe.core.client.WorldApi;
import com.swarmprobe.core.client.WorldApiException;
import com.swarmprobe.core.events.SwarmEvent;
import com.swarmprobe.core.logging.MdcContext;
import com.swarmprobe.core.model.ApiCallRecord;
import com.swarmprobe.core.model.ErrorClass;
import com.swarmprobe.core.model.ErrorDetail;
import com.swarmprobe.core.model.InteractionRecord;
import com.swarmprobe.core.model.MemberPhase;
import com.swarmprobe.core.model.MemberRole;
import com.swarmprobe.core.model.MemberSnapshot;
import com.swarmprobe.core.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.function.Supplier;

/**
 * One simulated client of the target service.
 * <p>
 * A member owns its state and runs {@link #runCycle()} in its own loop: make sure it is
 * registered, pick one action by weighted roulette, execute it and record what happened.
 * HTTP 401 sends it through re-registration; once consecutive auth failures exceed the
 * ceiling it retires and makes no further calls.
 */
public class SwarmMember implements MemberActions {

    private static final Logger log = LoggerFactory.getLogger(SwarmMember.class);

    private static final Set<Integer> UNREGISTER_TOLERATED = Set.of(401, 403, 404);

    private final MemberToolkit kit;
    private final MemberState state;
    private final Random random;
    private final String name;

    private volatile boolean stopRequested;

    public SwarmMember(MemberRole role, MemberToolkit kit, Random random) {
        this.kit = kit;
        this.random = random;
        this.state = new MemberState(role, kit.settings());
        this.name = "Resident_%s_%06x".formatted(role.key(), random.nextInt(0x1000000));
    }

    public String name() {
        return name;
    }

    public MemberRole role() {
        return state.role();
    }

    public boolean isRetired() {
        return state.phase() == MemberPhase.RETIRED;
    }

    public boolean isRegistered() {
        return state.session() != null;
    }

    public MemberSnapshot snapshot() {
        return state.snapshot(kit.clock().instant());
    }

    /**
     * Registers with the target. Failures are recorded and leave the member unregistered.
     *
     * @return true when the member now holds a credential
     */
    public boolean register() {
        if (isRetired()) {
            return false;
        }
        try {
            var session = call(WorldApi.REGISTER, () -> kit.api().register(name, kit.settings().roomId()));
            state.assignSession(session);
            log.info("Registered {} as {}", name, session.agentId());
            publish("member.registered", session.agentId(), Map.of("role", state.role().key()));
            return true;
        } catch (WorldApiException e) {
            log.warn("Registration of {} failed: {}", name, e.getMessage());
            return false;
        }
    }

    /**
     * Runs one decision cycle. Never throws for target failures; they are folded into the
     * returned outcome and the member's history.
     */
    public CycleOutcome runCycle() {
        if (isRetired() || stopRequested) {
            return CycleOutcome.idle();
        }
        var override = kit.shared().getRoleOverride();
        if (override != null && state.changeRole(override)) {
            log.info("{} switched to role {}", name, override.key());
        }
        if (!isRegistered() && !register()) {
            return new CycleOutcome(CycleOutcome.NONE, snapshotError());
        }

        var session = state.session();
        MdcContext.setMember(session.agentId(), state.role().key());
        state.beginCycle();
        var profile = kit.catalog().profile(state.role());
        String label = CycleOutcome.NONE;
        try {
            if (state.observationDue()) {
                label = CandidateLabels.OBSERVE;
                observe();
            } else if (state.pollDue()) {
                label = CandidateLabels.POLL_EVENTS;
                pollEvents();
            } else {
                var chosen = choose(profile);
                if (chosen != null) {
                    label = chosen.label();
                    kit.metrics().recordAction(chosen.category().key());
                    chosen.operation().run();
                }
            }
            return CycleOutcome.ok(label);
        } catch (WorldApiException e) {
            if (e.isAuthFailure()) {
                handleAuthFailure();
            } else {
                log.debug("{} failed: {}", label, e.getMessage());
            }
            return new CycleOutcome(label, e.toDetail(kit.clock().instant()));
        } finally {
            state.completeCycle(label, profile);
        }
    }

    /**
     * Loops until {@link #stop()} or retirement, sleeping the shared cycle delay between cycles.
     */
    public void runLoop() {
        try {
            while (!stopRequested && !isRetired()) {
                try {
                    runCycle();
                } catch (RuntimeException e) {
                    log.error("Unexpected failure in member {} cycle", name, e);
                }
                kit.sleeper().sleep(kit.shared().getCycleDelayMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            MdcContext.clear();
        }
    }

    public void stop() {
        stopRequested = true;
    }

    /**
     * Stops the loop and unregisters best-effort, clearing the credential either way.
     */
    public void stopGracefully() {
        stop();
        var session = state.session();
        if (session == null) {
            return;
        }
        try {
            call(WorldApi.UNREGISTER, () -> {
                kit.api().unregister(session);
                return null;
            });
        } catch (WorldApiException e) {
            log.debug("Unregister of {} failed during shutdown: {}", session.agentId(), e.getMessage());
        } finally {
            if (!isRetired()) {
                state.clearSession(MemberPhase.UNREGISTERED);
            }
        }
    }

    // -- selection --

    private ActionCandidate choose(RoleProfile profile) {
        var member = snapshot();
        var cursor = state.missionCursor();
        boolean starving = member.lastObserveAt() != null
                && member.lastObservedEntityCount() == 0
                && member.lastObservedFacilityIds().isEmpty();
        var context = new SelectionContext(
                profile,
                state.recentLabels(kit.settings().noveltyWindow()),
                cursor.currentStep(profile),
                starving,
                state.failingEndpoints(),
                kit.shared().isHighEntropy());

        var candidates = kit.candidateBuilder().build(member, state.knownSkills(), context, this, random);
        var keys = new LinkedHashSet<String>();
        for (ActionCandidate c : candidates) {
            if (c.preferenceKey() != null) {
                keys.add(c.preferenceKey());
            }
        }
        state.countOpportunities(keys);
        return kit.selector().select(candidates, random).orElse(null);
    }

    // -- auth failure handling --

    private void handleAuthFailure() {
        int failures = state.recordAuthFailure();
        if (failures > kit.settings().authFailureCeiling()) {
            retire(failures);
            return;
        }
        reregister();
    }

    private void retire(int failures) {
        var session = state.session();
        state.clearSession(MemberPhase.RETIRED);
        stopRequested = true;
        log.warn("{} retired after {} consecutive auth failures", name, failures);
        kit.metrics().recordMemberRetired(state.role().key());
        publish("member.retired", session != null ? session.agentId() : null, Map.of("authFailures", failures));
    }

    private void reregister() {
        var old = state.session();
        state.setPhase(MemberPhase.REREGISTERING);
        if (old != null) {
            try {
                call(WorldApi.UNREGISTER, () -> {
                    kit.api().unregister(old);
                    return null;
                });
            } catch (WorldApiException e) {
                if (e.getHttpStatus() == null || !UNREGISTER_TOLERATED.contains(e.getHttpStatus())) {
                    log.warn("Unregister of {} before re-registration failed: {}", old.agentId(), e.getMessage());
                }
            }
        }
        state.clearSession(MemberPhase.REREGISTERING);

        var settings = kit.settings();
        try {
            kit.sleeper().sleep(settings.reregisterDelayMs());
            for (int attempt = 1; attempt <= settings.reregisterAttempts(); attempt++) {
                try {
                    var session = call(WorldApi.REGISTER, () -> kit.api().register(name, settings.roomId()));
                    state.resetForReregistration();
                    state.assignSession(session);
                    kit.metrics().recordReregistration(true);
                    log.info("{} re-registered as {} (attempt {})", name, session.agentId(), attempt);
                    publish("member.reregistered", session.agentId(), Map.of("attempt", attempt));
                    initialObservation();
                    return;
                } catch (WorldApiException e) {
                    log.warn("{} re-registration attempt {} failed: {}", name, attempt, e.getMessage());
                    kit.sleeper().sleep(settings.reregisterBackoffMs() * attempt);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            state.setPhase(MemberPhase.UNREGISTERED);
            return;
        }

        kit.metrics().recordReregistration(false);
        int failures = state.recordFailedReregistration();
        if (failures > settings.authFailureCeiling()) {
            retire(failures);
        } else {
            state.setPhase(MemberPhase.UNREGISTERED);
        }
    }

    private void initialObservation() {
        try {
            observe();
        } catch (WorldApiException e) {
            log.debug("Initial observation after re-registration failed: {}", e.getMessage());
        }
    }

    // -- MemberActions --

    @Override
    public void observe() {
        var session = requireSession();
        var observation = call(WorldApi.OBSERVE, () -> kit.api().observe(session, kit.settings().observeRadius()));
        state.applyObservation(observation, kit.clock().instant());
    }

    @Override
    public void pollEvents() {
        var session = requireSession();
        var batch = call(WorldApi.POLL_EVENTS,
                () -> kit.api().pollEvents(session, state.eventCursor(), kit.settings().pollLimit()));
        state.applyPoll(batch, kit.clock().instant());
    }

    @Override
    public void observeChat() {
        var session = requireSession();
        var messages = call(WorldApi.CHAT_OBSERVE,
                () -> kit.api().chatObserve(session, kit.settings().chatWindowSec(), null));
        state.applyChat(messages, kit.clock().instant());
    }

    @Override
    public void interact(String targetId, String action) {
        var session = requireSession();
        try {
            var outcome = call(WorldApi.INTERACT,
                    () -> kit.api().interact(session, kit.txIds().next(), targetId, action));
            state.recordInteraction(new InteractionRecord(targetId, action, outcome.type(), kit.clock().instant()));
        } catch (WorldApiException e) {
            var code = e.getCode() != null ? e.getCode() : "error";
            state.recordInteraction(new InteractionRecord(targetId, action, code, kit.clock().instant()));
            throw e;
        }
    }

    @Override
    public void moveToward(Position target) {
        var geometry = behaviorGeometry();
        moveToTile(geometry.toTileX(target.x()), geometry.toTileY(target.y()));
    }

    @Override
    public void moveToTile(int tileX, int tileY) {
        var session = requireSession();
        call(WorldApi.MOVE_TO, () -> {
            kit.api().moveTo(session, kit.txIds().next(), tileX, tileY);
            return null;
        });
    }

    @Override
    public void chat(String channel, String message) {
        var session = requireSession();
        call(WorldApi.CHAT_SEND, () -> {
            kit.api().chatSend(session, kit.txIds().next(), channel, message);
            return null;
        });
    }

    @Override
    public void updateProfile(Map<String, String> profile) {
        var session = requireSession();
        call(WorldApi.PROFILE_UPDATE, () -> {
            kit.api().updateProfile(session, kit.txIds().next(), profile);
            return null;
        });
    }

    @Override
    public void listSkills() {
        var session = requireSession();
        state.setKnownSkills(call(WorldApi.SKILL_LIST, () -> kit.api().listSkills(session)));
    }

    @Override
    public void installSkill(String skillId) {
        var session = requireSession();
        call(WorldApi.SKILL_INSTALL, () -> {
            kit.api().installSkill(session, kit.txIds().next(), skillId);
            return null;
        });
        state.skillInstalled(skillId);
    }

    @Override
    public void invokeSkill(String skillId, String actionId) {
        var session = requireSession();
        call(WorldApi.SKILL_INVOKE,
                () -> kit.api().invokeSkill(session, kit.txIds().next(), skillId, actionId, Map.of()));
    }

    // -- plumbing --

    private BehaviorSettings behaviorGeometry() {
        return kit.candidateBuilder().settings();
    }

    private Session requireSession() {
        var session = state.session();
        if (session == null) {
            throw new WorldApiException("local", ErrorClass.CLIENT, null, "not_registered",
                    name + " has no session", false);
        }
        return session;
    }

    /**
     * Times a call and records it in the member's history and metrics.
     */
    private <T> T call(String endpoint, Supplier<T> operation) {
        long start = System.nanoTime();
        try {
            T result = operation.get();
            long ms = (System.nanoTime() - start) / 1_000_000;
            state.recordCall(ApiCallRecord.ok(endpoint, kit.clock().instant(), ms));
            kit.metrics().recordApiCall(endpoint, true, ms);
            return result;
        } catch (WorldApiException e) {
            long ms = (System.nanoTime() - start) / 1_000_000;
            Instant now = kit.clock().instant();
            state.recordCall(new ApiCallRecord(endpoint, now, false, ms,
                    e.getErrorClass(), e.getHttpStatus(), e.getCode()));
            state.recordError(e.toDetail(now));
            kit.metrics().recordApiCall(endpoint, false, ms);
            throw e;
        }
    }

    private ErrorDetail snapshotError() {
        return snapshot().lastError();
    }

    private void publish(String type, String memberId, Map<String, Object> payload) {
        kit.eventBus().publish(new SwarmEvent(type, null, memberId, payload, kit.clock().instant()));
    }
}
