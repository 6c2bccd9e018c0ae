package com.swarmprobe.core.behavior;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swarmprobe.core.model.MemberRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link RoleCatalog}.
 */
class RoleCatalogTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("bundled catalog defines every role")
    void bundledCatalogCoversAllRoles() {
        var catalog = RoleCatalog.load(objectMapper);

        for (MemberRole role : MemberRole.values()) {
            assertNotNull(catalog.profile(role), "missing " + role);
        }
        assertEquals(MemberRole.values().length, catalog.roles().size());
    }

    @Test
    @DisplayName("explorer favours wandering and has missions and chat lines")
    void explorerProfile() {
        var explorer = RoleCatalog.load(objectMapper).profile(MemberRole.EXPLORER);

        assertEquals(3.0, explorer.preferences().get("wander"));
        assertFalse(explorer.missions().isEmpty());
        assertFalse(explorer.chatLines().isEmpty());
        assertTrue(explorer.preferredKeys().contains("wander"));
    }

    @Test
    @DisplayName("catalog missing a role is rejected")
    void missingRoleRejected() {
        Map<MemberRole, RoleProfile> profiles = new EnumMap<>(MemberRole.class);
        profiles.put(MemberRole.WORKER, new RoleProfile(MemberRole.WORKER, Map.of(), List.of(), List.of()));

        var ex = assertThrows(IllegalArgumentException.class, () -> RoleCatalog.of(profiles));
        assertTrue(ex.getMessage().contains("explorer"));
    }

    @Test
    void unknownResourceFails() {
        assertThrows(IllegalStateException.class, () -> RoleCatalog.load(objectMapper, "roles/nope.json"));
    }
}
