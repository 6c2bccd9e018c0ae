package com.swarmprobe.core.model;

import java.time.Instant;

/**
 * Outcome of a single call against the target service.
 *
 * @param endpoint   endpoint name, e.g. "observe" or "skill/invoke"
 * @param timestamp  when the call completed
 * @param success    whether the call returned an ok envelope
 * @param latencyMs  wall-clock latency
 * @param errorClass failure classification (null on success)
 * @param httpStatus HTTP status code (null when no response was received)
 * @param errorCode  server error code from the error envelope (nullable)
 */
public record ApiCallRecord(
    String endpoint,
    Instant timestamp,
    boolean success,
    long latencyMs,
    ErrorClass errorClass,
    Integer httpStatus,
    String errorCode
) {

    public static ApiCallRecord ok(String endpoint, Instant timestamp, long latencyMs) {
        return new ApiCallRecord(endpoint, timestamp, true, latencyMs, null, 200, null);
    }
}
