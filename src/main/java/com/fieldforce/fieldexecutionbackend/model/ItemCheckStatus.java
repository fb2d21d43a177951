package com.fieldforce.fieldexecutionbackend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ItemCheckStatus {
    PENDING("pending"),
    VERIFIED("verified"),
    PARTIAL("partial"),
    DAMAGED("damaged"),
    MISSING("missing"),
    REJECTED("rejected");

    private final String value;

    ItemCheckStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ItemCheckStatus fromValue(String value) {
        for (ItemCheckStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ItemCheckStatus: " + value);
    }

    /**
     * Terminal means the whole expected quantity is accounted for, not that it arrived intact.
     */
    public boolean isTerminal() {
        return this == VERIFIED || this == DAMAGED || this == MISSING || this == REJECTED;
    }

    /**
     * Derives the check status from counted quantities. Callers validate that the counts do
     * not exceed the expected quantity.
     */
    public static ItemCheckStatus derive(double expected, double verified, double damaged, double missing) {
        double accounted = verified + damaged + missing;
        if (accounted <= 0) {
            return PENDING;
        }
        if (accounted < expected) {
            return PARTIAL;
        }
        if (damaged > 0) {
            return DAMAGED;
        }
        if (missing > 0) {
            return MISSING;
        }
        return VERIFIED;
    }
}
