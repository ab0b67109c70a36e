package com.tooldigest.research.dto;

import java.time.Instant;
import java.util.List;

/**
 * Search results together with the name of the provider that actually served them.
 */
public record SearchResponse(
        String provider,
        String query,
        List<SearchResult> results,
        String answer,
        Instant timestamp
) {
    public SearchResponse {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
