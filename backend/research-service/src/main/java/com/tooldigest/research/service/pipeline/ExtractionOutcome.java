package com.tooldigest.research.service.pipeline;

import com.tooldigest.research.dto.CandidateTool;

import java.util.List;

/**
 * Tools extracted from one discovery query. error is set when the query must be skipped.
 */
public record ExtractionOutcome(
        String query,
        List<CandidateTool> candidates,
        int dropped,
        String error
) {
    public ExtractionOutcome {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static ExtractionOutcome failed(String query, String error) {
        return new ExtractionOutcome(query, List.of(), 0, error);
    }

    public boolean isFailed() {
        return error != null;
    }
}
