package com.tooldigest.research.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RunStatus {
    IDLE("idle"),
    RUNNING("running"),
    COMPLETED("completed"),
    ERROR("error");

    private final String value;

    RunStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static RunStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (RunStatus item : values()) {
            if (item.value.equalsIgnoreCase(value.trim())) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown RunStatus: " + value);
    }
}
