package com.chicu.trafficvolume.common.error;

public abstract class TrafficApiException extends RuntimeException {

    private final ErrorKind kind;

    protected TrafficApiException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected TrafficApiException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
