package com.tooldigest.research.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SentimentRecord(
        String toolName,
        String query,
        Instant generatedAt,
        int totalResults,
        int analyzedCount,
        SentimentSummary summary,
        List<SentimentMention> mentions,
        String searchError
) {
    public SentimentRecord {
        mentions = mentions == null ? List.of() : List.copyOf(mentions);
    }

    /**
     * Record for a tool whose sentiment search could not run at all.
     */
    public static SentimentRecord failed(String toolName, String query, Instant generatedAt, String error) {
        return new SentimentRecord(toolName, query, generatedAt, 0, 0, SentimentSummary.unknown(), List.of(), error);
    }
}
