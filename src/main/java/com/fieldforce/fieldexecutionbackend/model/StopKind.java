package com.fieldforce.fieldexecutionbackend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum StopKind {
    VISIT("visit", "Sales Visit"),
    DELIVERY("delivery", "Delivery"),
    TRANSFER("transfer", "Stock Transfer"),
    PICKUP("pickup", "Pickup"),
    BREAK("break", "Break");

    private final String value;
    private final String backendLabel;

    StopKind(String value, String backendLabel) {
        this.value = value;
        this.backendLabel = backendLabel;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getBackendLabel() {
        return backendLabel;
    }

    @JsonCreator
    public static StopKind fromValue(String value) {
        for (StopKind candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.backendLabel.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown StopKind: " + value);
    }
}
