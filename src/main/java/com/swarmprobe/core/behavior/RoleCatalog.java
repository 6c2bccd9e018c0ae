package com.swarmprobe.core.behavior;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.swarmprobe.core.model.MemberRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Role tables, mission scripts and chat lines for every {@link MemberRole}.
 * <p>
 * Loaded once from a JSON classpath resource and immutable afterwards. Every role must be
 * present in the file.
 */
public final class RoleCatalog {

    private static final Logger log = LoggerFactory.getLogger(RoleCatalog.class);

    public static final String DEFAULT_RESOURCE = "roles/role-catalog.json";

    private final Map<MemberRole, RoleProfile> profiles;

    private RoleCatalog(Map<MemberRole, RoleProfile> profiles) {
        this.profiles = Map.copyOf(profiles);
    }

    public static RoleCatalog of(Map<MemberRole, RoleProfile> profiles) {
        for (MemberRole role : MemberRole.values()) {
            if (!profiles.containsKey(role)) {
                throw new IllegalArgumentException("Role catalog is missing role: " + role.key());
            }
        }
        return new RoleCatalog(profiles);
    }

    public static RoleCatalog load(ObjectMapper objectMapper) {
        return load(objectMapper, DEFAULT_RESOURCE);
    }

    public static RoleCatalog load(ObjectMapper objectMapper, String resource) {
        try (InputStream in = RoleCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Role catalog resource not found: " + resource);
            }
            var catalog = parse(objectMapper.readTree(in));
            log.info("Loaded role catalog from {} ({} roles)", resource, catalog.profiles.size());
            return catalog;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read role catalog " + resource, e);
        }
    }

    static RoleCatalog parse(JsonNode root) {
        var profiles = new EnumMap<MemberRole, RoleProfile>(MemberRole.class);
        Iterator<Map.Entry<String, JsonNode>> roles = root.path("roles").fields();
        while (roles.hasNext()) {
            var entry = roles.next();
            var role = MemberRole.fromKey(entry.getKey());
            var node = entry.getValue();

            var preferences = new HashMap<String, Double>();
            node.path("preferences").fields()
                    .forEachRemaining(p -> preferences.put(p.getKey(), p.getValue().asDouble()));

            var missions = new ArrayList<Mission>();
            for (JsonNode m : node.path("missions")) {
                var steps = new ArrayList<MissionStep>();
                for (JsonNode s : m.path("steps")) {
                    steps.add(new MissionStep(
                            s.path("action").asText(),
                            s.path("category").asText(),
                            s.path("cycles").asInt(1)));
                }
                missions.add(new Mission(m.path("name").asText(), steps));
            }

            var chatLines = new ArrayList<String>();
            for (JsonNode line : node.path("chatLines")) {
                chatLines.add(line.asText());
            }

            profiles.put(role, new RoleProfile(role, preferences, missions, chatLines));
        }
        return of(profiles);
    }

    public RoleProfile profile(MemberRole role) {
        return profiles.get(role);
    }

    public List<MemberRole> roles() {
        return List.copyOf(profiles.keySet());
    }
}
