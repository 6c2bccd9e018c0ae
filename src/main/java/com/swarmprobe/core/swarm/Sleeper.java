package com.swarmprobe.core.swarm;

/**
 * Blocking pause used between cycles and during re-registration backoff.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
