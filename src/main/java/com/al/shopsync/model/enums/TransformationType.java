package com.al.shopsync.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum TransformationType {
    DIRECT("direct"),
    REPLACE("replace"),
    REGEX("regex"),
    SPLIT_JOIN("split_join"),
    CUSTOM("custom");

    private final String value;

    TransformationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TransformationType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return DIRECT;
        }
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown transformation type: " + value));
    }
}
