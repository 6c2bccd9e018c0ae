package com.swarmprobe.core.behavior;

import com.swarmprobe.core.model.MemberRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link RoleProfile} and {@link CandidateLabels}.
 */
class RoleProfileTest {

    private final RoleProfile profile = new RoleProfile(MemberRole.WORKER,
            Map.of("whiteboard:write", 4.0, "whiteboard", 2.5, "write", 1.5, "chat", 0.3),
            List.of(), List.of());

    @Test
    @DisplayName("lookup prefers type:action, then type, then action")
    void lookupOrder() {
        assertEquals(new PreferenceMatch("whiteboard:write", 4.0), profile.lookup("whiteboard", "write"));
        assertEquals(new PreferenceMatch("whiteboard", 2.5), profile.lookup("whiteboard", "erase"));
        assertEquals(new PreferenceMatch("write", 1.5), profile.lookup("printer", "write"));
    }

    @Test
    @DisplayName("unmatched lookups fall back to epsilon")
    void epsilonFallback() {
        var match = profile.lookup("vending_machine", "buy");

        assertFalse(match.matched());
        assertEquals(RoleProfile.EPSILON, match.value());
    }

    @Test
    @DisplayName("preferred keys are those weighted 1.0 or more")
    void preferredKeys() {
        assertEquals(Set.of("whiteboard:write", "whiteboard", "write"), profile.preferredKeys());
    }

    @Test
    @DisplayName("labels map back to their preference keys")
    void labelPreferenceKeys() {
        assertEquals(List.of("whiteboard:write", "whiteboard", "write"),
                CandidateLabels.preferenceKeys(CandidateLabels.interact("whiteboard", "write")));
        assertEquals(List.of("skill_invoke:cast", "skill_invoke", "cast"),
                CandidateLabels.preferenceKeys(CandidateLabels.skillInvoke("magic", "cast")));
        assertEquals(List.of("chat:global", "chat", "global"),
                CandidateLabels.preferenceKeys(CandidateLabels.CHAT_GLOBAL));
        assertEquals(List.of("wander"), CandidateLabels.preferenceKeys(CandidateLabels.WANDER));
    }
}
