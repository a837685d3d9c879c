package com.example.i18n.common;

import java.time.OffsetDateTime;

/**
 * Error body of the translation API.
 *
 * <p>{@code error} is the HTTP reason phrase; {@code errorCode} names the failure
 * independently of the status, e.g. {@code VALIDATION_ERROR} and {@code MALFORMED_REQUEST}
 * are both {@code Bad Request}.
 */
public class ErrorResponse {

    private final OffsetDateTime timestamp = OffsetDateTime.now();
    private final int status;
    private final String error;
    private final String errorCode;
    private final String message;
    private final String path;

    public ErrorResponse(int status, String error, String errorCode, String message, String path) {
        this.status = status;
        this.error = error;
        this.errorCode = errorCode;
        this.message = message;
        this.path = path;
    }

    public OffsetDateTime getTimestamp() {
        return timestamp;
    }

    public int getStatus() {
        return status;
    }

    public String getError() {
        return error;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getMessage() {
        return message;
    }

    public String getPath() {
        return path;
    }
}
