package com.swarmprobe.core.behavior;

import com.swarmprobe.core.model.Position;

import java.util.Map;

/**
 * Calls a member can make against the target. Candidate operations are closures over
 * these methods; implementations record every call in the member's history.
 */
public interface MemberActions {

    void observe();

    void pollEvents();

    void observeChat();

    void interact(String targetId, String action);

    void moveToward(Position target);

    void moveToTile(int tileX, int tileY);

    void chat(String channel, String message);

    void updateProfile(Map<String, String> profile);

    void listSkills();

    void installSkill(String skillId);

    void invokeSkill(String skillId, String actionId);
}
