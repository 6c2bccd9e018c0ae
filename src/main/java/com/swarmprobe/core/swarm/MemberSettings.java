package com.swarmprobe.core.swarm;

import com.swarmprobe.core.config.SwarmProbeProperties;

/**
 * Per-member limits and timings, fixed for the lifetime of the run.
 */
public record MemberSettings(
    String roomId,
    int historyCapacity,
    int labelHistoryCapacity,
    int noveltyWindow,
    int trackedEntities,
    int trackedFacilities,
    int chatCapacity,
    int observeWindowCycles,
    int pollWindowCycles,
    int authFailureCeiling,
    long reregisterDelayMs,
    int reregisterAttempts,
    long reregisterBackoffMs,
    double interactRangePx,
    int errorSuppressionThreshold,
    int observeRadius,
    int chatWindowSec,
    int pollLimit
) {

    public static MemberSettings from(SwarmProbeProperties properties) {
        var swarm = properties.getSwarm();
        var target = properties.getTarget();
        return new MemberSettings(
                target.getRoomId(),
                swarm.getHistoryCapacity(),
                swarm.getLabelHistoryCapacity(),
                swarm.getNoveltyWindow(),
                swarm.getTrackedEntities(),
                swarm.getTrackedFacilities(),
                swarm.getChatCapacity(),
                swarm.getObserveWindowCycles(),
                swarm.getPollWindowCycles(),
                swarm.getAuthFailureCeiling(),
                swarm.getReregisterDelayMs(),
                swarm.getReregisterAttempts(),
                swarm.getReregisterBackoffMs(),
                swarm.getInteractRangePx(),
                swarm.getErrorSuppressionThreshold(),
                target.getObserveRadius(),
                target.getChatWindowSec(),
                target.getPollLimit());
    }

    public MemberSettings withRoomId(String room) {
        return new MemberSettings(room, historyCapacity, labelHistoryCapacity, noveltyWindow, trackedEntities,
                trackedFacilities, chatCapacity, observeWindowCycles, pollWindowCycles, authFailureCeiling,
                reregisterDelayMs, reregisterAttempts, reregisterBackoffMs, interactRangePx,
                errorSuppressionThreshold, observeRadius, chatWindowSec, pollLimit);
    }
}
