package com.tooldigest.research.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Pipeline phase. Merge runs after SENTIMENT and reports DONE once terminal.
 */
public enum RunPhase {
    PLANNING("planning"),
    DISCOVERY("discovery"),
    VALIDATION("validation"),
    SENTIMENT("sentiment"),
    DONE("done");

    private final String value;

    RunPhase(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static RunPhase fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (RunPhase item : values()) {
            if (item.value.equalsIgnoreCase(value.trim())) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown RunPhase: " + value);
    }
}
