package com.fieldforce.fieldexecutionbackend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Goods movement lifecycle. Strictly linear up to completed, with returned as a side exit.
 */
public enum TransferStatus {
    PENDING("pending"),
    LOADING("loading"),
    IN_TRANSIT("in_transit"),
    ARRIVED("arrived"),
    COMPLETED("completed"),
    RETURNED("returned"),
    CANCELLED("cancelled");

    private final String value;

    TransferStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TransferStatus fromValue(String value) {
        for (TransferStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown TransferStatus: " + value);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == RETURNED || this == CANCELLED;
    }

    public boolean isReturnable() {
        return this == LOADING || this == IN_TRANSIT || this == ARRIVED;
    }
}
