package com.example.jobscheduler.exception;

import lombok.Getter;

/**
 * Exception for cron expressions the evaluator cannot parse
 */
@Getter
public class InvalidCronExpressionException extends RuntimeException {

    private final String expression;

    public InvalidCronExpressionException(String expression, String reason) {
        super(String.format("Invalid cron expression '%s': %s", expression, reason));
        this.expression = expression;
    }

    public InvalidCronExpressionException(String expression, Exception cause) {
        super(String.format("Invalid cron expression '%s': %s", expression, cause.getMessage()), cause);
        this.expression = expression;
    }
}
