package com.example.jobscheduler.exception;

import lombok.Getter;

/**
 * Exception for task execution engine failures
 */
@Getter
public class EngineInvocationException extends RuntimeException {

    private final Integer httpStatusCode;

    public EngineInvocationException(String message) {
        super(message);
        this.httpStatusCode = null;
    }

    public EngineInvocationException(String message, Exception cause) {
        super(message, cause);
        this.httpStatusCode = null;
    }

    public EngineInvocationException(int httpStatusCode, String responseBody) {
        super(String.format("Engine returned HTTP %d: %s", httpStatusCode, responseBody));
        this.httpStatusCode = httpStatusCode;
    }
}
