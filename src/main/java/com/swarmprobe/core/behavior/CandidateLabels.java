package com.swarmprobe.core.behavior;

import java.util.List;

/**
 * Builds and parses normalized candidate labels.
 */
public final class CandidateLabels {

    public static final String OBSERVE = "observe";
    public static final String POLL_EVENTS = "poll_events";
    public static final String CHAT_OBSERVE = "chat_observe";
    public static final String NAVIGATE_FACILITY = "navigate:facility";
    public static final String NAVIGATE_ENTITY = "navigate:entity";
    public static final String CHAT_GLOBAL = "chat:global";
    public static final String PROFILE_UPDATE = "profile_update";
    public static final String SKILL_LIST = "skill_list";
    public static final String SKILL_INSTALL = "skill_install";
    public static final String WANDER = "wander";

    private CandidateLabels() {}

    public static String interact(String facilityType, String action) {
        return "interact:" + facilityType + ":" + action;
    }

    public static String skillInvoke(String skillId, String actionId) {
        return "skill_invoke:" + skillId + ":" + actionId;
    }

    /**
     * Preference keys a label can match, in lookup order. Interact labels use the facility
     * type and action; invoke labels use the capability action; two-part labels split on ':'.
     */
    public static List<String> preferenceKeys(String label) {
        var parts = label.split(":");
        if (parts.length == 3 && label.startsWith("interact:")) {
            return RoleProfile.lookupKeys(parts[1], parts[2]);
        }
        if (parts.length == 3 && label.startsWith("skill_invoke:")) {
            return RoleProfile.lookupKeys("skill_invoke", parts[2]);
        }
        if (parts.length == 2) {
            return RoleProfile.lookupKeys(parts[0], parts[1]);
        }
        return RoleProfile.lookupKeys(label, null);
    }
}
