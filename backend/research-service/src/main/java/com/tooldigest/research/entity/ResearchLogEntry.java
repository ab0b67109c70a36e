package com.tooldigest.research.entity;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Summary of one finished research run, appended to research_log.json.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResearchLogEntry(
        String runId,
        List<String> focusAreas,
        Integer maxTools,
        RunStatus status,
        int discovered,
        int added,
        String error,
        Instant timestamp
) {
    public ResearchLogEntry {
        focusAreas = focusAreas == null ? List.of() : List.copyOf(focusAreas);
    }
}
