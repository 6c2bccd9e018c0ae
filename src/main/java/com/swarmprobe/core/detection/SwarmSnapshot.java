package com.swarmprobe.core.detection;

import com.swarmprobe.core.model.MemberSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Every member's state as copied at the start of one orchestrator cycle.
 *
 * @param capturedAt when the snapshot was taken; detectors use it as "now"
 * @param cycle      orchestrator cycle number, starting at 1
 * @param members    per-member copies, retired members included
 */
public record SwarmSnapshot(Instant capturedAt, long cycle, List<MemberSnapshot> members) {

    public SwarmSnapshot {
        members = List.copyOf(members);
    }

    /** Members holding a credential. */
    public List<MemberSnapshot> registered() {
        return members.stream().filter(MemberSnapshot::isRegistered).toList();
    }
}
