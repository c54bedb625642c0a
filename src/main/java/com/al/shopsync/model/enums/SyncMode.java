package com.al.shopsync.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * How a sync invocation treats records that may or may not already exist in the
 * target. One mode applies to every item of an invocation.
 */
public enum SyncMode {
    CREATE("create"),
    UPDATE("update"),
    UPSERT("upsert");

    private final String value;

    SyncMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SyncMode fromValue(String value) {
        return Arrays.stream(values())
                .filter(mode -> mode.value.equalsIgnoreCase(value == null ? "" : value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown sync mode: " + value));
    }
}
