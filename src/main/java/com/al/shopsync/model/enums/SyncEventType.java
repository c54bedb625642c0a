package com.al.shopsync.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SyncEventType {
    PROGRESS("progress"),
    COMPLETED("completed"),
    ABORTED("aborted"),
    FAILED("failed");

    private final String value;

    SyncEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
