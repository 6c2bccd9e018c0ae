package com.swarmprobe.core.model;

import java.time.Instant;
import java.util.List;

/**
 * A facility as last seen by one member.
 *
 * @param affordances action names offered by the facility, in server order
 * @param distance    distance from the observing member in pixels
 */
public record FacilityObservation(
    String id,
    String type,
    List<String> affordances,
    double distance,
    Position position,
    Instant observedAt
) {
    public FacilityObservation {
        affordances = List.copyOf(affordances);
    }
}
