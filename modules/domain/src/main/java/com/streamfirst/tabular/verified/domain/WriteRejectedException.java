package com.streamfirst.tabular.verified.domain;

import lombok.Getter;

/**
 * Thrown by a backend when it refuses a write outright, for example because access rules deny it or
 * the target does not exist. Nothing was persisted, so no verification follows.
 */
@Getter
public class WriteRejectedException extends RuntimeException {

    /** Backend status code, or 0 when the rejection did not come from a response */
    private final int statusCode;

    public WriteRejectedException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public WriteRejectedException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
