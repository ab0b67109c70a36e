package com.tooldigest.research.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SearchDepth {
    BASIC("basic"),
    ADVANCED("advanced");

    private final String value;

    SearchDepth(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SearchDepth fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (SearchDepth item : values()) {
            if (item.value.equalsIgnoreCase(value.trim())) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown SearchDepth: " + value);
    }
}
