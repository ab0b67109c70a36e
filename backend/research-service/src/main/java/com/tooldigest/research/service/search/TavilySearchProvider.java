package com.tooldigest.research.service.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.tooldigest.research.config.ResearchProperties;
import com.tooldigest.research.dto.SearchRequest;
import com.tooldigest.research.dto.SearchResponse;
import com.tooldigest.research.dto.SearchResult;
import com.tooldigest.research.util.UrlNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tavily search API client (POST /search).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TavilySearchProvider implements SearchProvider {

    public static final String NAME = "tavily";

    private final WebClient webClient;
    private final ResearchProperties properties;
    private final Clock clock;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        String apiKey = properties.getSearch().getTavilyApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Mono<SearchResponse> search(SearchRequest request) {
        if (!isEnabled()) {
            return Mono.error(new IllegalStateException("Tavily API key is not configured"));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("api_key", properties.getSearch().getTavilyApiKey());
        body.put("query", request.query());
        body.put("search_depth", request.depth().getValue());
        body.put("max_results", request.maxResults());
        body.put("include_answer", true);
        body.put("include_raw_content", false);
        if (!request.includeDomains().isEmpty()) {
            body.put("include_domains", request.includeDomains());
        }

        return webClient.post()
                .uri(properties.getSearch().getTavilyBaseUrl() + "/search")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(json -> toResponse(request.query(), json));
    }

    private SearchResponse toResponse(String query, JsonNode json) {
        List<SearchResult> results = new ArrayList<>();
        for (JsonNode item : json.path("results")) {
            String url = item.path("url").asText(null);
            results.add(new SearchResult(
                    item.path("title").asText(""),
                    url,
                    item.path("content").asText(""),
                    item.hasNonNull("score") ? item.get("score").asDouble() : null,
                    item.hasNonNull("published_date") ? item.get("published_date").asText() : null,
                    UrlNormalizer.hostOf(url)
            ));
        }
        String answer = json.hasNonNull("answer") ? json.get("answer").asText() : null;
        log.debug("Tavily returned {} results for '{}'", results.size(), query);
        return new SearchResponse(NAME, query, results, answer, Instant.now(clock));
    }
}
