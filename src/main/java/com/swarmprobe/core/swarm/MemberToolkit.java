package com.swarmprobe.core.swarm;

import com.swarmprobe.core.behavior.ActionSelector;
import com.swarmprobe.core.behavior.CandidateBuilder;
import com.swarmprobe.core.behavior.RoleCatalog;
import com.swarmprobe.core.client.TxIds;
import com.swarmprobe.core.client.WorldApi;
import com.swarmprobe.core.events.EventBus;
import com.swarmprobe.core.metrics.SwarmProbeMetrics;

import java.time.Clock;

/**
 * Collaborators shared by every member of a swarm.
 */
public record MemberToolkit(
    WorldApi api,
    RoleCatalog catalog,
    CandidateBuilder candidateBuilder,
    ActionSelector selector,
    MemberSettings settings,
    SwarmSettings shared,
    TxIds txIds,
    Clock clock,
    Sleeper sleeper,
    SwarmProbeMetrics metrics,
    EventBus eventBus
) {
}
