package com.tooldigest.research.service.search;

import com.tooldigest.research.dto.SearchRequest;
import com.tooldigest.research.dto.SearchResponse;
import reactor.core.publisher.Mono;

/**
 * A web search backend. Implementations signal failures (auth, quota, network)
 * as errors so {@link SearchProviderChain} can fall back to the next provider.
 */
public interface SearchProvider {

    /**
     * Stable lower-case name used in configuration and provenance, e.g. "tavily".
     */
    String name();

    /**
     * False when the provider lacks what it needs to run, typically an API key.
     */
    boolean isEnabled();

    Mono<SearchResponse> search(SearchRequest request);
}
