package com.swarmprobe.core.engine;

/**
 * Consulted after every orchestrator cycle; a positive answer stops the loop gracefully so
 * an outer supervisor can restart it on a new build.
 */
@FunctionalInterface
public interface DeploymentWatcher {

    DeploymentWatcher NEVER = () -> false;

    boolean restartRequested();
}
