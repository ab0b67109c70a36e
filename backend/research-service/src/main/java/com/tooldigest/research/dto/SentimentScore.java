package com.tooldigest.research.dto;

import com.tooldigest.research.entity.SentimentLabel;

import java.util.List;

public record SentimentScore(
        int score,
        double normalizedScore,
        SentimentLabel label,
        int positiveCount,
        int negativeCount,
        int tokenCount,
        List<SentimentHighlight> highlights
) {
    public SentimentScore {
        highlights = highlights == null ? List.of() : List.copyOf(highlights);
    }
}
