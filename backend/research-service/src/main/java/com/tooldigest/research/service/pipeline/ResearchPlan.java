package com.tooldigest.research.service.pipeline;

import java.util.List;

/**
 * Queries to run in discovery. fallbackReason is set when the default query set was used.
 */
public record ResearchPlan(
        String reasoning,
        List<String> queries,
        String fallbackReason
) {
    public ResearchPlan {
        queries = queries == null ? List.of() : List.copyOf(queries);
    }

    public boolean isFallback() {
        return fallbackReason != null;
    }
}
