package com.tooldigest.research.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.tooldigest.research.entity.ProgressEventType;

import java.time.Instant;

public record ProgressEvent(
        ProgressEventType type,
        String message,
        Instant timestamp
) {
    public static ProgressEvent progress(String message, Instant timestamp) {
        return new ProgressEvent(ProgressEventType.PROGRESS, message, timestamp);
    }

    public static ProgressEvent complete(String message, Instant timestamp) {
        return new ProgressEvent(ProgressEventType.COMPLETE, message, timestamp);
    }

    public static ProgressEvent error(String message, Instant timestamp) {
        return new ProgressEvent(ProgressEventType.ERROR, message, timestamp);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return type == ProgressEventType.COMPLETE || type == ProgressEventType.ERROR;
    }
}
