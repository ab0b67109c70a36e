package com.tooldigest.research.service.pipeline;

import com.tooldigest.research.dto.SearchResponse;
import com.tooldigest.research.dto.SearchResult;

/**
 * Renders a search response as a compact text block for a model prompt.
 */
public final class SearchResultFormatter {

    static final int CONTENT_PREVIEW = 300;

    private SearchResultFormatter() {
    }

    public static String format(SearchResponse response) {
        StringBuilder out = new StringBuilder();
        out.append("Search Results for: '").append(response.query()).append("'\n");
        out.append("Provider: ").append(response.provider()).append('\n');
        out.append("Timestamp: ").append(response.timestamp()).append("\n\n");

        if (response.answer() != null && !response.answer().isBlank()) {
            out.append("Quick Answer:\n").append(response.answer()).append("\n\n");
        }

        out.append("Top ").append(response.results().size()).append(" Results:\n\n");
        int i = 1;
        for (SearchResult result : response.results()) {
            out.append(i++).append(". ").append(result.title()).append('\n');
            out.append("   URL: ").append(result.url()).append('\n');
            String content = result.content();
            if (content.length() > CONTENT_PREVIEW) {
                content = content.substring(0, CONTENT_PREVIEW) + "...";
            }
            out.append("   ").append(content).append("\n\n");
        }
        return out.toString();
    }
}
