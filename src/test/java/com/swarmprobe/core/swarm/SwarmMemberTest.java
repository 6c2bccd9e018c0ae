package com.swarmprobe.core.swarm;

import com.swarmprobe.core.client.WorldApi;
import com.swarmprobe.core.events.EventBus;
import com.swarmprobe.core.events.SwarmEvent;
import com.swarmprobe.core.metrics.SwarmProbeMetrics;
import com.swarmprobe.core.model.MemberPhase;
import com.swarmprobe.core.model.MemberRole;
import com.swarmprobe.core.model.MemberSnapshot;
import com.swarmprobe.core.support.FakeWorldApi;
import com.swarmprobe.core.support.MutableClock;
import com.swarmprobe.core.support.Toolkits;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SwarmMember}.
 */
class SwarmMemberTest {

    private FakeWorldApi api;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private List<SwarmEvent> events;
    private SwarmMember member;

    @BeforeEach
    void setUp() {
        api = new FakeWorldApi();
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);
        var kit = Toolkits.create(api, new MutableClock(Instant.parse("2026-01-01T00:00:00Z")), eventBus,
                new SwarmProbeMetrics(registry), Toolkits.properties());
        member = new SwarmMember(MemberRole.EXPLORER, kit, new Random(1));
    }

    private static void assertIdentityMatchesCredential(MemberSnapshot snapshot) {
        assertEquals(snapshot.memberId().isEmpty(), !snapshot.hasCredential(),
                "identity and credential must be set or cleared together");
    }

    // -- registration ----------------------------------------------------

    @Nested
    @DisplayName("registration")
    class Registration {

        @Test
        @DisplayName("name carries the role and a random suffix")
        void nameFormat() {
            assertTrue(member.name().matches("Resident_explorer_[0-9a-f]{6}"), member.name());
        }

        @Test
        @DisplayName("identity and credential appear together")
        void identityWithCredential() {
            assertIdentityMatchesCredential(member.snapshot());
            assertFalse(member.isRegistered());

            assertTrue(member.register());

            var snapshot = member.snapshot();
            assertEquals("agent-1", snapshot.memberId());
            assertTrue(snapshot.hasCredential());
            assertEquals(MemberPhase.ACTIVE, snapshot.phase());
            assertTrue(events.stream().anyMatch(e -> e.eventType().equals("member.registered")));
        }

        @Test
        @DisplayName("failed registration leaves the member unregistered")
        void failedRegistration() {
            api.failNext(WorldApi.REGISTER, 503);

            assertFalse(member.register());

            var snapshot = member.snapshot();
            assertIdentityMatchesCredential(snapshot);
            assertEquals(1, snapshot.totalErrors());
        }

        @Test
        @DisplayName("a cycle registers an unregistered member first")
        void cycleRegistersFirst() {
            var outcome = member.runCycle();

            assertTrue(member.isRegistered());
            assertEquals("observe", outcome.label());
            assertEquals(1, api.calls(WorldApi.OBSERVE));
        }
    }

    // -- cycles ----------------------------------------------------------

    @Nested
    @DisplayName("cycles")
    class Cycles {

        @Test
        @DisplayName("each cycle records exactly one label")
        void oneLabelPerCycle() {
            member.register();
            for (int i = 0; i < 6; i++) {
                member.runCycle();
            }

            var snapshot = member.snapshot();
            assertEquals(6, snapshot.cycleCount());
            assertEquals(6, snapshot.actionLabels().size());
            assertEquals("observe", snapshot.actionLabels().get(0));
        }

        @Test
        @DisplayName("server errors are recorded without dropping the credential")
        void serverErrorKeepsCredential() {
            member.register();
            api.failNext(WorldApi.OBSERVE, 500);

            var outcome = member.runCycle();

            assertFalse(outcome.succeeded());
            assertEquals(500, outcome.error().httpStatus());
            assertTrue(member.isRegistered());
            assertEquals(WorldApi.OBSERVE, member.snapshot().lastError().endpoint());
        }
    }

    // -- auth failures ---------------------------------------------------

    @Nested
    @DisplayName("auth failures")
    class AuthFailures {

        @Test
        @DisplayName("a single 401 re-registers under a new identity")
        void reregistersOnUnauthorized() {
            member.register();
            api.failNext(WorldApi.OBSERVE, 401);

            member.runCycle();

            var snapshot = member.snapshot();
            assertEquals("agent-2", snapshot.memberId());
            assertIdentityMatchesCredential(snapshot);
            assertEquals(1, api.calls(WorldApi.UNREGISTER));
            assertEquals(1.0, registry.counter("swarmprobe.members.reregistrations", "success", "true").count());
            assertTrue(events.stream().anyMatch(e -> e.eventType().equals("member.reregistered")));
        }

        @Test
        @DisplayName("retires once consecutive auth failures exceed the ceiling and stops calling")
        void retiresAfterCeiling() {
            api.failAlways(WorldApi.OBSERVE, 401);

            for (int i = 0; i < 3; i++) {
                member.runCycle();
                assertFalse(member.isRetired(), "retired too early on cycle " + (i + 1));
            }
            member.runCycle();
            assertTrue(member.isRetired());

            var snapshot = member.snapshot();
            assertEquals(MemberPhase.RETIRED, snapshot.phase());
            assertIdentityMatchesCredential(snapshot);
            assertEquals(4, snapshot.consecutiveAuthFailures());

            int callsAtRetirement = api.totalCalls();
            for (int i = 0; i < 5; i++) {
                assertEquals(CycleOutcome.NONE, member.runCycle().label());
            }
            assertFalse(member.register());
            assertEquals(callsAtRetirement, api.totalCalls());
            assertTrue(events.stream().anyMatch(e -> e.eventType().equals("member.retired")));
            assertEquals(1.0, registry.counter("swarmprobe.members.retired", "role", "explorer").count());
        }
    }

    // -- shutdown --------------------------------------------------------

    @Test
    @DisplayName("graceful stop unregisters and clears the credential")
    void stopGracefully() {
        member.register();

        member.stopGracefully();

        var snapshot = member.snapshot();
        assertEquals(1, api.calls(WorldApi.UNREGISTER));
        assertEquals(MemberPhase.UNREGISTERED, snapshot.phase());
        assertIdentityMatchesCredential(snapshot);
    }

    @Test
    @DisplayName("a stopped member does not register again")
    void stoppedMemberStaysDown() {
        member.register();
        member.stopGracefully();

        var outcome = member.runCycle();

        assertEquals(CycleOutcome.NONE, outcome.label());
        assertEquals(1, api.calls(WorldApi.REGISTER));
    }

    @Test
    @DisplayName("graceful stop clears the credential even when unregister fails")
    void stopGracefullyWhenUnregisterFails() {
        member.register();
        api.failNext(WorldApi.UNREGISTER, 500);

        member.stopGracefully();

        assertFalse(member.isRegistered());
    }

    @Test
    @DisplayName("role override switches the member's role on its next cycle")
    void roleOverride() {
        var kit = Toolkits.create(api, new MutableClock(Instant.EPOCH), eventBus,
                new SwarmProbeMetrics(registry), Toolkits.properties());
        var converted = new SwarmMember(MemberRole.WORKER, kit, new Random(2));
        kit.shared().setRoleOverride(MemberRole.CHAOS);

        converted.runCycle();

        assertEquals(MemberRole.CHAOS, converted.role());
    }
}
