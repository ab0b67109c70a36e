package com.tooldigest.research.dto;

/**
 * One normalized web search hit, independent of the provider that produced it.
 */
public record SearchResult(
        String title,
        String url,
        String content,
        Double score,
        String publishedAt,
        String source
) {
    public SearchResult {
        title = title == null ? "" : title.trim();
        content = content == null ? "" : content.trim();
    }
}
