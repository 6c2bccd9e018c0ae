package com.swarmprobe.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static SwarmEvent event(String type, String memberId) {
        return new SwarmEvent(type, "resident_1", memberId, Map.of(), Instant.now());
    }

    // -- SwarmEvent record ----------------------------------------------------

    @Nested
    @DisplayName("SwarmEvent")
    class SwarmEventTests {

        @Test
        @DisplayName("swarm-level events carry no member")
        void swarmLevelEvent() {
            var now = Instant.now();
            var e = SwarmEvent.swarm("loop.started", "resident_1", Map.of("members", 10), now);

            assertEquals("loop.started", e.eventType());
            assertNull(e.memberId());
            assertEquals(10, e.payload().get("members"));
            assertEquals(now, e.timestamp());
        }

        @Test
        @DisplayName("payload is copied and null becomes empty")
        void payloadIsCopied() {
            var payload = new HashMap<String, Object>();
            payload.put("rung", 1);
            var e = new SwarmEvent("escalation.advanced", null, null, payload, Instant.now());
            payload.put("rung", 2);

            assertEquals(1, e.payload().get("rung"));
            assertTrue(new SwarmEvent("x", null, null, null, Instant.now()).payload().isEmpty());
        }
    }

    // -- Typed subscription ---------------------------------------------------

    @Nested
    @DisplayName("subscribe by type")
    class TypedSubscription {

        @Test
        @DisplayName("delivers only the subscribed type")
        void deliversSubscribedType() {
            List<SwarmEvent> received = new ArrayList<>();
            eventBus.subscribe("member.retired", received::add);

            eventBus.publish(event("member.retired", "agent-1"));
            eventBus.publish(event("member.reregistered", "agent-2"));

            assertEquals(1, received.size());
            assertEquals("agent-1", received.get(0).memberId());
        }

        @Test
        @DisplayName("delivers events in publish order")
        void deliversInOrder() {
            List<SwarmEvent> received = new ArrayList<>();
            eventBus.subscribe("cycle.completed", received::add);

            for (int i = 0; i < 3; i++) {
                eventBus.publish(new SwarmEvent("cycle.completed", "s", null, Map.of("cycle", i), Instant.now()));
            }

            assertEquals(List.of(0, 1, 2), received.stream().map(e -> e.payload().get("cycle")).toList());
        }
    }

    // -- Global subscription --------------------------------------------------

    @Nested
    @DisplayName("global subscription")
    class GlobalSubscription {

        @Test
        @DisplayName("global and typed subscribers both receive the event")
        void globalAndTypedBothReceive() {
            List<SwarmEvent> global = new ArrayList<>();
            List<SwarmEvent> typed = new ArrayList<>();
            eventBus.subscribeAll(global::add);
            eventBus.subscribe("issue.created", typed::add);

            eventBus.publish(event("issue.created", null));
            eventBus.publish(event("issue.duplicate", null));

            assertEquals(2, global.size());
            assertEquals(1, typed.size());
        }
    }

    // -- Unsubscribe ----------------------------------------------------------

    @Nested
    @DisplayName("unsubscribe")
    class Unsubscribe {

        @Test
        @DisplayName("stops delivery for typed and global subscribers")
        void stopsDelivery() {
            List<SwarmEvent> typed = new ArrayList<>();
            List<SwarmEvent> global = new ArrayList<>();
            var typedSub = eventBus.subscribe("loop.stopped", typed::add);
            var globalSub = eventBus.subscribeAll(global::add);

            eventBus.publish(event("loop.stopped", null));
            typedSub.unsubscribe();
            globalSub.unsubscribe();
            eventBus.publish(event("loop.stopped", null));

            assertEquals(1, typed.size());
            assertEquals(1, global.size());
        }
    }

    // -- Fault isolation and concurrency -------------------------------------

    @Nested
    @DisplayName("delivery")
    class Delivery {

        @Test
        @DisplayName("a throwing subscriber does not block the others")
        void throwingSubscriberIsolated() {
            List<SwarmEvent> received = new ArrayList<>();
            eventBus.subscribeAll(e -> { throw new IllegalStateException("boom"); });
            eventBus.subscribeAll(received::add);

            assertDoesNotThrow(() -> eventBus.publish(event("swarm.members_added", null)));
            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("concurrent publishers deliver every event")
        void concurrentPublish() throws Exception {
            List<SwarmEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribeAll(received::add);
            int threads = 8;
            int perThread = 100;
            var done = new CountDownLatch(threads);

            for (int t = 0; t < threads; t++) {
                var memberId = "agent-" + t;
                new Thread(() -> {
                    for (int i = 0; i < perThread; i++) {
                        eventBus.publish(event("member.action", memberId));
                    }
                    done.countDown();
                }).start();
            }

            assertTrue(done.await(10, TimeUnit.SECONDS));
            assertEquals(threads * perThread, received.size());
        }
    }
}
