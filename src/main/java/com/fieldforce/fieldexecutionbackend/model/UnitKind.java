package com.fieldforce.fieldexecutionbackend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** What a progress record is keyed to. */
public enum UnitKind {
    VISIT("visit"),
    TRANSFER("transfer");

    private final String value;

    UnitKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static UnitKind fromValue(String value) {
        for (UnitKind candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown UnitKind: " + value);
    }
}
