package com.swarmprobe.core.client;

import com.swarmprobe.core.model.ErrorClass;
import com.swarmprobe.core.model.ErrorDetail;

import java.time.Instant;

/**
 * Failed call against the target service, classified by where the failure happened.
 */
public class WorldApiException extends RuntimeException {

    private final String endpoint;
    private final ErrorClass errorClass;
    private final Integer httpStatus;
    private final String code;
    private final boolean retryable;

    public WorldApiException(String endpoint, ErrorClass errorClass, Integer httpStatus,
                             String code, String message, boolean retryable) {
        super(message);
        this.endpoint = endpoint;
        this.errorClass = errorClass;
        this.httpStatus = httpStatus;
        this.code = code;
        this.retryable = retryable;
    }

    public WorldApiException(String endpoint, String message, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
        this.errorClass = ErrorClass.NETWORK;
        this.httpStatus = null;
        this.code = null;
        this.retryable = true;
    }

    /**
     * Maps an HTTP status to its class: 5xx is SERVER, everything else CLIENT.
     */
    public static ErrorClass classify(int status) {
        return status >= 500 ? ErrorClass.SERVER : ErrorClass.CLIENT;
    }

    public boolean isAuthFailure() {
        return httpStatus != null && httpStatus == 401;
    }

    public ErrorDetail toDetail(Instant occurredAt) {
        return new ErrorDetail(endpoint, errorClass, httpStatus, code, getMessage(), occurredAt);
    }

    public String getEndpoint() { return endpoint; }
    public ErrorClass getErrorClass() { return errorClass; }
    public Integer getHttpStatus() { return httpStatus; }
    public String getCode() { return code; }
    public boolean isRetryable() { return retryable; }
}
