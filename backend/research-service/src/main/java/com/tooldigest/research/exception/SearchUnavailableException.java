package com.tooldigest.research.exception;

import lombok.Getter;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Every configured search provider failed (or none was enabled).
 */
@Getter
public class SearchUnavailableException extends ResearchException {

    /** provider name -> failure message, in attempt order */
    private final Map<String, String> failures;

    public SearchUnavailableException(String query, Map<String, String> failures) {
        super("SEARCH_UNAVAILABLE", buildMessage(query, failures));
        this.failures = failures;
    }

    private static String buildMessage(String query, Map<String, String> failures) {
        if (failures.isEmpty()) {
            return "No search provider is enabled for query '" + query + "'";
        }
        List<String> parts = failures.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.toList());
        return "All search providers failed for query '" + query + "' (" + String.join("; ", parts) + ")";
    }
}
