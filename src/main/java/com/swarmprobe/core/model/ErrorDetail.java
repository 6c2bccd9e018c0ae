package com.swarmprobe.core.model;

import java.time.Instant;

/**
 * Structured detail of the last failed call, carried into issue evidence.
 */
public record ErrorDetail(
    String endpoint,
    ErrorClass errorClass,
    Integer httpStatus,
    String code,
    String message,
    Instant occurredAt
) {
}
