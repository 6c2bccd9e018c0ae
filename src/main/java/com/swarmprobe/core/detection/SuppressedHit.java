package com.swarmprobe.core.detection;

/**
 * A gated finding whose fingerprint is still cooling down.
 *
 * @param reference tracker reference of the original issue (nullable)
 */
public record SuppressedHit(Finding finding, String reference) {
}
