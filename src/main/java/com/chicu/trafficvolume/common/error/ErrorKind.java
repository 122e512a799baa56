package com.chicu.trafficvolume.common.error;

import org.springframework.http.HttpStatus;

/**
 * Error classes surfaced by the prediction API.
 * {@code code} goes to the {@code error} field of the response body.
 */
public enum ErrorKind {

    VALIDATION_ERROR("validation_error", HttpStatus.BAD_REQUEST),
    MODEL_UNAVAILABLE("model_unavailable", HttpStatus.INTERNAL_SERVER_ERROR),
    PREDICTION_FAILED("prediction_failed", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final HttpStatus status;

    ErrorKind(String code, HttpStatus status) {
        this.code = code;
        this.status = status;
    }

    public String code() {
        return code;
    }

    public HttpStatus status() {
        return status;
    }

    /** Client-class errors are caused by the caller's input and are not logged as faults. */
    public boolean isClientError() {
        return status.is4xxClientError();
    }
}
