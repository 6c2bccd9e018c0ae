package com.swarmprobe.core.behavior;

/**
 * Result of a role-preference lookup.
 *
 * @param key   the preference key that matched, or null when nothing matched
 * @param value the preference value, {@link RoleProfile#EPSILON} when nothing matched
 */
public record PreferenceMatch(String key, double value) {

    public boolean matched() {
        return key != null;
    }
}
