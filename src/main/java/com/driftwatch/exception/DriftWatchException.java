package com.driftwatch.exception;

import lombok.Getter;

@Getter
public abstract class DriftWatchException extends RuntimeException {
    private final String errorCode;
    protected DriftWatchException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected DriftWatchException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
