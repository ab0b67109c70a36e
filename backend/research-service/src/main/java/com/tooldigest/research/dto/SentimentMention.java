package com.tooldigest.research.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One article considered for a tool. Either carries a sentiment score or an error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SentimentMention(
        String title,
        String url,
        String snippet,
        SentimentScore sentiment,
        String source,
        String publishedAt,
        String error
) {
    public static SentimentMention analyzed(SearchResult result, String snippet, SentimentScore sentiment) {
        return new SentimentMention(result.title(), result.url(), snippet, sentiment,
                result.source(), result.publishedAt(), null);
    }

    public static SentimentMention failed(SearchResult result, String error) {
        return new SentimentMention(result.title(), result.url(), null, null,
                result.source(), result.publishedAt(), error);
    }

    @JsonIgnore
    public boolean isAnalyzed() {
        return error == null && sentiment != null;
    }
}
