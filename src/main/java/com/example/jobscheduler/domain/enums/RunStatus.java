package com.example.jobscheduler.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle of a single execution attempt.
 * A run starts as RUNNING and moves to exactly one terminal state.
 */
@Getter
@RequiredArgsConstructor
public enum RunStatus {

    /**
     * Attempt opened, engine invocation in progress.
     */
    RUNNING("running", "Running"),

    /**
     * Engine returned a result. Webhook delivery outcome is recorded separately.
     */
    COMPLETED("completed", "Completed"),

    /**
     * Engine invocation failed.
     */
    FAILED("failed", "Failed");

    @JsonValue
    private final String code;
    private final String displayName;

    /**
     * Find RunStatus by its code value
     */
    public static RunStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown run status code: " + code);
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    /**
     * Check whether a run may move from this status to the given one
     */
    public boolean canTransitionTo(RunStatus target) {
        return this == RUNNING && target.isTerminal();
    }
}
