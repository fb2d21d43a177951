package com.fieldforce.fieldexecutionbackend.execution;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TransferAction {
    START_LOADING("start_loading"),
    RECORD_ITEM_CHECK("record_item_check"),
    VERIFY_ALL_ITEMS("verify_all_items"),
    COMPLETE_LOADING("complete_loading"),
    ARRIVE("arrive"),
    COMPLETE_HANDOFF("complete_handoff"),
    RETURN("return");

    private final String value;

    TransferAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
