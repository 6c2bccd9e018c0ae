package com.swarmprobe.core.behavior;

import com.swarmprobe.core.config.SwarmProbeProperties;

/**
 * Geometry used when building candidates.
 *
 * @param interactRangePx  facilities closer than this get interact candidates
 * @param navigateRadiusPx entities closer than this get navigate candidates
 */
public record BehaviorSettings(
    double interactRangePx,
    double navigateRadiusPx,
    int mapWidthTiles,
    int mapHeightTiles,
    int tileSizePx
) {

    public static BehaviorSettings from(SwarmProbeProperties properties) {
        var swarm = properties.getSwarm();
        var target = properties.getTarget();
        return new BehaviorSettings(swarm.getInteractRangePx(), swarm.getNavigateRadiusPx(),
                target.getMapWidthTiles(), target.getMapHeightTiles(), target.getTileSizePx());
    }

    public int toTileX(double px) {
        return clamp((int) Math.floor(px / tileSizePx), mapWidthTiles);
    }

    public int toTileY(double px) {
        return clamp((int) Math.floor(px / tileSizePx), mapHeightTiles);
    }

    private static int clamp(int tile, int max) {
        return Math.max(0, Math.min(max - 1, tile));
    }
}
