package com.tooldigest.research.dto;

public record ValidatedTool(
        CandidateTool candidate,
        double qualityScore,
        String qualityReason
) {
    public String title() {
        return candidate.title();
    }
}
