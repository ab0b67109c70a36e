package com.tooldigest.research.dto;

import com.tooldigest.research.entity.RunPhase;
import com.tooldigest.research.entity.RunStatus;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of the current (or last) research run.
 */
public record ResearchRunView(
        String runId,
        RunStatus status,
        RunPhase phase,
        List<String> focusAreas,
        Integer maxTools,
        int discoveredCount,
        int addedCount,
        Instant startedAt,
        Instant completedAt,
        String error,
        List<ProgressEvent> progress
) {
    public ResearchRunView {
        focusAreas = focusAreas == null ? List.of() : List.copyOf(focusAreas);
        progress = progress == null ? List.of() : List.copyOf(progress);
    }

    public static ResearchRunView idle() {
        return new ResearchRunView(null, RunStatus.IDLE, null, List.of(), null, 0, 0,
                null, null, null, List.of());
    }
}
