package com.tooldigest.research.dto;

import java.time.Instant;
import java.util.List;

/**
 * A tool proposed by the model during discovery.
 *
 * url is either null or an absolute http(s) URL; confidence is within [0, 1].
 */
public record CandidateTool(
        String title,
        String url,
        String description,
        String category,
        List<String> features,
        double confidence,
        String sourceUrl,
        String discoveryQuery,
        Instant discoveredAt,
        SearchProvenance provenance
) {
    public CandidateTool {
        features = features == null ? List.of() : List.copyOf(features);
        description = description == null ? "" : description;
    }
}
