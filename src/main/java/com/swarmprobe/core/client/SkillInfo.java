package com.swarmprobe.core.client;

import java.util.List;

public record SkillInfo(String id, String name, String category, List<String> actionIds) {

    public SkillInfo {
        actionIds = List.copyOf(actionIds);
    }
}
