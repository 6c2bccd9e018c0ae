package com.swarmprobe.core.model;

import java.time.Duration;

/**
 * The two most recent sightings of one entity by one member.
 *
 * @param current  the latest sighting
 * @param previous the sighting before it, or null if the entity was seen only once
 */
public record EntityTrack(String entityId, EntitySighting current, EntitySighting previous) {

    public EntityTrack advance(EntitySighting next) {
        return new EntityTrack(entityId, next, current);
    }

    public boolean hasPrevious() {
        return previous != null;
    }

    public double jumpPx() {
        return previous == null ? 0 : previous.position().distanceTo(current.position());
    }

    public long deltaMs() {
        return previous == null ? 0
                : Duration.between(previous.observedAt(), current.observedAt()).toMillis();
    }
}
