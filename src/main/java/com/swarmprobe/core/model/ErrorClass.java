package com.swarmprobe.core.model;

/**
 * Classification of a failed call against the target service.
 */
public enum ErrorClass {
    /** No HTTP response was received (connect failure, timeout, reset). */
    NETWORK,
    /** HTTP 4xx, or an application-level error envelope. */
    CLIENT,
    /** HTTP 5xx. */
    SERVER
}
