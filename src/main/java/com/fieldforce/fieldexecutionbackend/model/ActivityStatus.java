package com.fieldforce.fieldexecutionbackend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ActivityStatus {
    PENDING("pending"),
    COMPLETED("completed"),
    SKIPPED("skipped");

    private final String value;

    ActivityStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ActivityStatus fromValue(String value) {
        for (ActivityStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ActivityStatus: " + value);
    }

    public boolean isDone() {
        return this != PENDING;
    }
}
