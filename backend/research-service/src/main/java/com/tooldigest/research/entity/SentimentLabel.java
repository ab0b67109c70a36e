package com.tooldigest.research.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SentimentLabel {
    POSITIVE,
    NEUTRAL,
    NEGATIVE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
