package com.swarmprobe.core.client;

import com.swarmprobe.core.model.Position;

import java.util.List;

/**
 * Decoded {@code observe} response.
 *
 * @param self       the observing member's own position
 * @param nearby     other entities in radius, nearest first
 * @param facilities facilities in radius, nearest first
 * @param serverTsMs server clock at observation time
 * @param mapWidthPx map width in pixels, or 0 when the server omitted map metadata
 * @param mapHeightPx map height in pixels, or 0 when omitted
 */
public record Observation(
    Position self,
    List<ObservedEntity> nearby,
    List<ObservedFacility> facilities,
    long serverTsMs,
    int mapWidthPx,
    int mapHeightPx
) {
    public Observation {
        nearby = List.copyOf(nearby);
        facilities = List.copyOf(facilities);
    }
}
