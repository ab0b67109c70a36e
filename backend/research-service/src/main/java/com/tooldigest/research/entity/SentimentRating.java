package com.tooldigest.research.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tool-level rating. UNKNOWN when no mention could be analyzed.
 */
public enum SentimentRating {
    POSITIVE("positive"),
    NEUTRAL("neutral"),
    NEGATIVE("negative"),
    UNKNOWN("unknown");

    private final String value;

    SentimentRating(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SentimentRating fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (SentimentRating item : values()) {
            if (item.value.equalsIgnoreCase(value.trim())) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown SentimentRating: " + value);
    }
}
