package com.tooldigest.research.dto;

import com.tooldigest.research.entity.SearchDepth;

import java.util.List;

public record SearchRequest(
        String query,
        int maxResults,
        SearchDepth depth,
        List<String> includeDomains
) {
    public SearchRequest {
        depth = depth == null ? SearchDepth.BASIC : depth;
        includeDomains = includeDomains == null ? List.of() : List.copyOf(includeDomains);
    }

    public static SearchRequest of(String query, int maxResults) {
        return new SearchRequest(query, maxResults, SearchDepth.BASIC, List.of());
    }

    public SearchRequest withMaxResults(int maxResults) {
        return new SearchRequest(query, maxResults, depth, includeDomains);
    }
}
