package com.swarmprobe.core.model;

/**
 * A point in world pixel coordinates.
 */
public record Position(double x, double y) {

    public static final Position ORIGIN = new Position(0, 0);

    public double distanceTo(Position other) {
        double dx = other.x - x;
        double dy = other.y - y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    /**
     * Coarse spatial bucket key, used to group co-located members.
     */
    public String bucket(int bucketSizePx) {
        long bx = (long) Math.floor(x / bucketSizePx);
        long by = (long) Math.floor(y / bucketSizePx);
        return bx + ":" + by;
    }
}
