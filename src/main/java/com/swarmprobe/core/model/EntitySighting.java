package com.swarmprobe.core.model;

import java.time.Instant;

public record EntitySighting(String entityId, Position position, Instant observedAt) {
}
