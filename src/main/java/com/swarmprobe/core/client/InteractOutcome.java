package com.swarmprobe.core.client;

/**
 * Result of an {@code interact} call. {@code type} is one of ok, no_effect,
 * invalid_action or too_far.
 */
public record InteractOutcome(String type, String message) {
}
