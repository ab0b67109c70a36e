package com.tooldigest.research.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Progress event kind. COMPLETE and ERROR are terminal.
 */
public enum ProgressEventType {
    PROGRESS("progress"),
    COMPLETE("complete"),
    ERROR("error");

    private final String value;

    ProgressEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ProgressEventType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ProgressEventType item : values()) {
            if (item.value.equalsIgnoreCase(value.trim())) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown ProgressEventType: " + value);
    }
}
