package com.example.jobscheduler.exception;

/**
 * Exception for a sweep trigger without a valid shared secret
 */
public class UnauthorizedTriggerException extends RuntimeException {

    public UnauthorizedTriggerException() {
        super("Unauthorized");
    }
}
