package com.fieldforce.fieldexecutionbackend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ActivityType {
    PHOTO("photo", "Photo"),
    STOCK_CHECK("stock_check", "Stock Check"),
    PAYMENT("payment", "Custom"),
    ORDER("order", "Custom"),
    SURVEY("survey", "Competitor Tracking"),
    CUSTOM("custom", "Custom");

    private final String value;
    private final String backendLabel;

    ActivityType(String value, String backendLabel) {
        this.value = value;
        this.backendLabel = backendLabel;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Activity type label understood by the field backend's visit activity table.
     */
    public String getBackendLabel() {
        return backendLabel;
    }

    /**
     * Photos reach the backend through media attachment, everything else through an
     * explicit activity row.
     */
    public boolean hasRemoteSignificance() {
        return this != PHOTO;
    }

    @JsonCreator
    public static ActivityType fromValue(String value) {
        for (ActivityType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        if ("Stock Check".equalsIgnoreCase(value)) {
            return STOCK_CHECK;
        }
        if ("Competitor Tracking".equalsIgnoreCase(value)) {
            return SURVEY;
        }
        return CUSTOM;
    }
}
