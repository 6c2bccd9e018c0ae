package com.swarmprobe.core.client;

import com.swarmprobe.core.model.Position;

import java.util.List;

public record ObservedFacility(String id, String type, Position position, double distance, List<String> affordances) {

    public ObservedFacility {
        affordances = affordances == null ? List.of() : List.copyOf(affordances);
    }
}
