package com.swarmprobe.core.swarm;

import com.swarmprobe.core.escalation.SwarmControl;
import com.swarmprobe.core.events.SwarmEvent;
import com.swarmprobe.core.model.MemberRole;
import com.swarmprobe.core.model.MemberSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The set of running members. Each member loop runs on the supplied executor; members added
 * after {@link #start()} begin looping immediately.
 */
public class Swarm implements SwarmControl {

    private static final Logger log = LoggerFactory.getLogger(Swarm.class);

    private final MemberToolkit kit;
    private final ExecutorService executor;
    private final Random seeds;
    private final List<SwarmMember> members = new CopyOnWriteArrayList<>();

    private int nextRoleIndex;
    private volatile boolean started;

    public Swarm(MemberToolkit kit, ExecutorService executor, Random seeds) {
        this.kit = kit;
        this.executor = executor;
        this.seeds = seeds;
    }

    /**
     * Creates and registers {@code count} members with roles assigned round-robin.
     */
    public void initialize(int count) {
        for (int i = 0; i < count; i++) {
            spawn(nextRole());
        }
        log.info("{} members initialized ({} registered)", members.size(),
                members.stream().filter(SwarmMember::isRegistered).count());
    }

    public void start() {
        started = true;
        for (SwarmMember member : members) {
            executor.submit(member::runLoop);
        }
    }

    public List<SwarmMember> members() {
        return List.copyOf(members);
    }

    /**
     * Value copies of every member, each consistent on its own.
     */
    public List<MemberSnapshot> snapshot() {
        var snapshots = new ArrayList<MemberSnapshot>(members.size());
        for (SwarmMember member : members) {
            snapshots.add(member.snapshot());
        }
        return snapshots;
    }

    public List<String> memberIds() {
        return snapshot().stream()
                .map(MemberSnapshot::memberId)
                .filter(id -> !id.isEmpty())
                .toList();
    }

    public SwarmSettings settings() {
        return kit.shared();
    }

    public int activeCount() {
        return (int) members.stream().filter(m -> !m.isRetired()).count();
    }

    @Override
    public synchronized void addMembers(int count, MemberRole role) {
        for (int i = 0; i < count; i++) {
            var member = spawn(role != null ? role : nextRole());
            if (started) {
                executor.submit(member::runLoop);
            }
        }
        publish("swarm.members_added", Map.of("count", count, "role", role != null ? role.key() : "mixed"));
    }

    @Override
    public void setCycleDelay(long cycleDelayMs) {
        kit.shared().setCycleDelayMs(cycleDelayMs);
    }

    @Override
    public void enableHighEntropy() {
        kit.shared().setHighEntropy(true);
    }

    @Override
    public void convertAll(MemberRole role) {
        kit.shared().setRoleOverride(role);
    }

    /**
     * Stops every loop, then unregisters all members in parallel, giving up after
     * {@code timeout}. The member executor is shut down afterwards and accepts no more loops.
     */
    public void stopGracefully(Duration timeout) {
        members.forEach(SwarmMember::stop);
        var unregisters = members.stream()
                .map(m -> CompletableFuture.runAsync(m::stopGracefully, executor))
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(unregisters).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Unregister did not finish within {}s, abandoning outstanding calls", timeout.toSeconds());
        } catch (ExecutionException e) {
            log.warn("Unregister failed: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        started = false;
        executor.shutdown();
    }

    private synchronized SwarmMember spawn(MemberRole role) {
        var member = new SwarmMember(role, kit, new Random(seeds.nextLong()));
        member.register();
        members.add(member);
        return member;
    }

    private synchronized MemberRole nextRole() {
        var roles = MemberRole.values();
        return roles[nextRoleIndex++ % roles.length];
    }

    private void publish(String type, Map<String, Object> payload) {
        kit.eventBus().publish(SwarmEvent.swarm(type, null, payload, kit.clock().instant()));
    }
}
