package com.tooldigest.research.service.pipeline;

import com.tooldigest.research.dto.ValidatedTool;

import java.util.List;

/**
 * Result of the quality filter.
 *
 * @param submitted candidates sent to the model (at most the configured cap)
 * @param excluded  candidates beyond the cap, never considered
 * @param fallbackReason set when the confidence-threshold fallback was applied
 */
public record ValidationOutcome(
        List<ValidatedTool> approved,
        int submitted,
        int excluded,
        String reasoning,
        String fallbackReason
) {
    public ValidationOutcome {
        approved = approved == null ? List.of() : List.copyOf(approved);
    }

    public boolean isFallback() {
        return fallbackReason != null;
    }
}
