package com.swarmprobe.core.model;

/**
 * One row of the per-member state table attached to issue evidence.
 */
public record MemberStateRow(
    String memberId,
    MemberRole role,
    MemberPhase phase,
    Position position,
    int entityCount,
    int facilityCount,
    int errorCount,
    String lastAction
) {

    public static MemberStateRow of(MemberSnapshot member) {
        return new MemberStateRow(
                member.memberId(),
                member.role(),
                member.phase(),
                member.position(),
                member.lastObservedEntityCount(),
                member.lastObservedFacilityIds().size(),
                member.totalErrors(),
                member.lastActionLabel());
    }
}
