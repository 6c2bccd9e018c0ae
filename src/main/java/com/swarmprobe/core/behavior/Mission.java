package com.swarmprobe.core.behavior;

import java.util.List;

public record Mission(String name, List<MissionStep> steps) {

    public Mission {
        steps = List.copyOf(steps);
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("Mission '" + name + "' has no steps");
        }
    }
}
