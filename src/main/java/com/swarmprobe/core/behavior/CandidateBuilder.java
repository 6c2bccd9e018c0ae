package com.swarmprobe.core.behavior;

import com.swarmprobe.core.client.SkillInfo;
import com.swarmprobe.core.model.EntityTrack;
import com.swarmprobe.core.model.FacilityObservation;
import com.swarmprobe.core.model.MemberSnapshot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Builds the weighted candidate list for one member cycle from what the member last saw.
 */
public class CandidateBuilder {

    private static final int CENTER_JITTER_TILES = 8;
    private static final List<String> PROFILE_STATUSES = List.of("available", "busy", "away", "focus");

    private final BehaviorSettings settings;
    private final WeightCalculator weights;

    public CandidateBuilder(BehaviorSettings settings, WeightCalculator weights) {
        this.settings = settings;
        this.weights = weights;
    }

    public BehaviorSettings settings() {
        return settings;
    }

    public List<ActionCandidate> build(MemberSnapshot member, List<SkillInfo> knownSkills,
                                       SelectionContext context, MemberActions actions, Random random) {
        var profile = context.profile();
        var candidates = new ArrayList<ActionCandidate>();

        add(candidates, context, CandidateLabels.OBSERVE, CandidateCategory.OBSERVE,
                "observe", null, 1.0, actions::observe);
        add(candidates, context, CandidateLabels.POLL_EVENTS, CandidateCategory.POLL,
                "poll_events", null, 1.0, actions::pollEvents);
        add(candidates, context, CandidateLabels.CHAT_OBSERVE, CandidateCategory.CHAT_OBSERVE,
                "chat_observe", null, 1.0, actions::observeChat);

        for (FacilityObservation facility : visibleFacilities(member)) {
            double distance = member.position().distanceTo(facility.position());
            if (distance <= settings.interactRangePx() && !facility.affordances().isEmpty()) {
                for (String action : facility.affordances()) {
                    add(candidates, context, CandidateLabels.interact(facility.type(), action),
                            CandidateCategory.INTERACT, facility.type(), action, 1.0,
                            () -> actions.interact(facility.id(), action));
                }
            } else {
                add(candidates, context, CandidateLabels.NAVIGATE_FACILITY, CandidateCategory.NAVIGATE,
                        "navigate", "facility", WeightCalculator.DAMPEN_FACILITY_NAVIGATE,
                        () -> actions.moveToward(facility.position()));
            }
        }

        for (EntityTrack track : visibleEntities(member)) {
            if (member.position().distanceTo(track.current().position()) <= settings.navigateRadiusPx()) {
                add(candidates, context, CandidateLabels.NAVIGATE_ENTITY, CandidateCategory.NAVIGATE,
                        "navigate", "entity", WeightCalculator.DAMPEN_ENTITY_NAVIGATE,
                        () -> actions.moveToward(track.current().position()));
            }
        }

        if (!profile.chatLines().isEmpty()) {
            var line = profile.chatLines().get(random.nextInt(profile.chatLines().size()));
            add(candidates, context, CandidateLabels.CHAT_GLOBAL, CandidateCategory.CHAT,
                    "chat", "global", 1.0, () -> actions.chat("global", line));
        }

        var status = PROFILE_STATUSES.get(random.nextInt(PROFILE_STATUSES.size()));
        add(candidates, context, CandidateLabels.PROFILE_UPDATE, CandidateCategory.PROFILE,
                "profile_update", null, 1.0, () -> actions.updateProfile(Map.of("status", status)));

        add(candidates, context, CandidateLabels.SKILL_LIST, CandidateCategory.SKILL,
                "skill_list", null, 1.0, actions::listSkills);

        var uninstalled = knownSkills.stream()
                .filter(s -> !member.installedSkills().contains(s.id()))
                .toList();
        if (!uninstalled.isEmpty()) {
            var skill = uninstalled.get(random.nextInt(uninstalled.size()));
            add(candidates, context, CandidateLabels.SKILL_INSTALL, CandidateCategory.SKILL,
                    "skill_install", null, 1.0, () -> actions.installSkill(skill.id()));
        }
        for (SkillInfo skill : knownSkills) {
            if (!member.installedSkills().contains(skill.id())) {
                continue;
            }
            for (String actionId : skill.actionIds()) {
                add(candidates, context, CandidateLabels.skillInvoke(skill.id(), actionId),
                        CandidateCategory.SKILL, "skill_invoke", actionId, 1.0,
                        () -> actions.invokeSkill(skill.id(), actionId));
            }
        }

        int[] tile = wanderTarget(context.starving(), random);
        add(candidates, context, CandidateLabels.WANDER, CandidateCategory.WANDER,
                "wander", null, 1.0, () -> actions.moveToTile(tile[0], tile[1]));

        return candidates;
    }

    /**
     * Random tile, or a tile near the map center when the member has seen nothing.
     */
    int[] wanderTarget(boolean starving, Random random) {
        int width = settings.mapWidthTiles();
        int height = settings.mapHeightTiles();
        if (!starving) {
            return new int[]{random.nextInt(width), random.nextInt(height)};
        }
        int span = CENTER_JITTER_TILES * 2 + 1;
        int tx = width / 2 + random.nextInt(span) - CENTER_JITTER_TILES;
        int ty = height / 2 + random.nextInt(span) - CENTER_JITTER_TILES;
        return new int[]{Math.max(0, Math.min(width - 1, tx)), Math.max(0, Math.min(height - 1, ty))};
    }

    private void add(List<ActionCandidate> candidates, SelectionContext context, String label,
                     CandidateCategory category, String type, String action, double dampening,
                     Runnable operation) {
        var preference = context.profile().lookup(type, action);
        double weight = weights.weigh(label, category, preference, context) * dampening;
        candidates.add(new ActionCandidate(label, category, weight, preference.key(), operation));
    }

    private static List<FacilityObservation> visibleFacilities(MemberSnapshot member) {
        return member.facilities().values().stream()
                .filter(f -> member.lastObservedFacilityIds().contains(f.id()))
                .sorted(Comparator.comparing(FacilityObservation::id))
                .toList();
    }

    private static List<EntityTrack> visibleEntities(MemberSnapshot member) {
        if (member.lastObserveAt() == null) {
            return List.of();
        }
        return member.entityTracks().values().stream()
                .filter(t -> !t.current().observedAt().isBefore(member.lastObserveAt()))
                .sorted(Comparator.comparing(EntityTrack::entityId))
                .toList();
    }
}
