package com.al.shopsync.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of syncing a single source record.
 */
public enum SyncStatus {
    CREATED("created"),
    UPDATED("updated"),
    /** Found in a read-only target, nothing written. */
    MATCHED("matched"),
    SKIPPED("skipped"),
    ERROR("error");

    private final String value;

    SyncStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
