package com.fieldforce.fieldexecutionbackend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TransferType {
    WH_TO_DC("wh_to_dc"),
    DC_TO_DC("dc_to_dc"),
    RETURN_TO_WH("return_to_wh");

    private final String value;

    TransferType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TransferType fromValue(String value) {
        for (TransferType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown TransferType: " + value);
    }
}
