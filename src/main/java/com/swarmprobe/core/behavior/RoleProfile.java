package com.swarmprobe.core.behavior;

import com.swarmprobe.core.model.MemberRole;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable behaviour table for one role: preference weights, mission scripts and chat lines.
 */
public record RoleProfile(
    MemberRole role,
    Map<String, Double> preferences,
    List<Mission> missions,
    List<String> chatLines
) {

    /** Weight used when no preference key matches a candidate. */
    public static final double EPSILON = 0.05;

    /** Preference values at or above this mark a key as something the role is expected to do. */
    public static final double PREFERRED_THRESHOLD = 1.0;

    public RoleProfile {
        preferences = Map.copyOf(preferences);
        missions = List.copyOf(missions);
        chatLines = List.copyOf(chatLines);
    }

    /**
     * Looks up {@code type:action}, then {@code type}, then {@code action}.
     *
     * @param action may be null for candidates without an action part
     */
    public PreferenceMatch lookup(String type, String action) {
        for (String key : lookupKeys(type, action)) {
            Double value = preferences.get(key);
            if (value != null) {
                return new PreferenceMatch(key, value);
            }
        }
        return new PreferenceMatch(null, EPSILON);
    }

    public Set<String> preferredKeys() {
        return preferences.entrySet().stream()
                .filter(e -> e.getValue() >= PREFERRED_THRESHOLD)
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());
    }

    static List<String> lookupKeys(String type, String action) {
        var keys = new ArrayList<String>(3);
        if (action != null) {
            keys.add(type + ":" + action);
        }
        keys.add(type);
        if (action != null) {
            keys.add(action);
        }
        return keys;
    }
}
