package com.tooldigest.research.service.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Validation reply shape. Indices are 1-based positions in the submitted list;
 * quality_scores is keyed by the same index as a string.
 */
record QualityVerdictPayload(
        @JsonProperty("approved_indices") List<Integer> approvedIndices,
        String reasoning,
        @JsonProperty("quality_scores") Map<String, Score> qualityScores
) {
    record Score(Double score, String reason) {
    }
}
