package com.fieldforce.fieldexecutionbackend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum StopStatus {
    PENDING("pending"),
    ARRIVED("arrived"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    SKIPPED("skipped"),
    PARTIAL("partial"),
    FAILED("failed");

    private final String value;

    StopStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static StopStatus fromValue(String value) {
        for (StopStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown StopStatus: " + value);
    }

    /**
     * Completed and skipped stops are immutable.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == SKIPPED;
    }

    public boolean isActive() {
        return this == ARRIVED || this == IN_PROGRESS;
    }
}
