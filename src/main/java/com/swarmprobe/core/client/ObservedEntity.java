package com.swarmprobe.core.client;

import com.swarmprobe.core.model.Position;

import java.util.List;

/**
 * Another entity inside the observation radius.
 */
public record ObservedEntity(String id, String kind, Position position, double distance, List<String> affordances) {

    public ObservedEntity {
        affordances = affordances == null ? List.of() : List.copyOf(affordances);
    }
}
