package com.swarmprobe.core.reporting;

/**
 * Failed call against the issue tracker.
 */
public class TrackerException extends RuntimeException {

    private final Integer httpStatus;

    public TrackerException(String message, Integer httpStatus) {
        super(message);
        this.httpStatus = httpStatus;
    }

    public TrackerException(String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = null;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}
