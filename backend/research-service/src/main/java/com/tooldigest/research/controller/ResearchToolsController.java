package com.tooldigest.research.controller;

import com.tooldigest.research.config.ResearchProperties;
import com.tooldigest.research.dto.SearchRequest;
import com.tooldigest.research.dto.SearchResponse;
import com.tooldigest.research.dto.SentimentRecord;
import com.tooldigest.research.entity.ResearchLogEntry;
import com.tooldigest.research.entity.SearchDepth;
import com.tooldigest.research.service.ResearchLogService;
import com.tooldigest.research.service.search.SearchProviderChain;
import com.tooldigest.research.service.sentiment.SentimentAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Direct access to the building blocks of a run: one search, one sentiment lookup,
 * and the log of past runs.
 */
@RestController
@RequestMapping("/api/v1/research")
@RequiredArgsConstructor
@Slf4j
public class ResearchToolsController {

    private final SearchProviderChain searchProviderChain;
    private final SentimentAnalyzer sentimentAnalyzer;
    private final ResearchLogService researchLogService;
    private final ResearchProperties properties;

    @GetMapping("/search")
    public Mono<SearchResponse> search(
            @RequestParam(required = false) String query,
            @RequestParam(required = false) Integer maxResults,
            @RequestParam(required = false) String depth
    ) {
        String effectiveQuery = query == null || query.isBlank() ? properties.getSearch().getDefaultQuery() : query.trim();
        int limit = maxResults != null ? maxResults : properties.getSearch().getDefaultMaxResults();
        log.info("Direct search: '{}' (maxResults={})", effectiveQuery, limit);

        return searchProviderChain.search(new SearchRequest(effectiveQuery, limit,
                depth != null ? SearchDepth.fromValue(depth) : SearchDepth.BASIC, List.of()));
    }

    @GetMapping("/sentiment")
    public Mono<SentimentRecord> sentiment(
            @RequestParam String tool,
            @RequestParam(required = false) Integer maxResults,
            @RequestParam(required = false) Integer maxArticles
    ) {
        if (tool.isBlank()) {
            return Mono.error(new IllegalArgumentException("Parameter 'tool' must not be blank"));
        }
        int results = maxResults != null ? maxResults : properties.getSentiment().getMaxResults();
        int articles = maxArticles != null ? maxArticles : properties.getSentiment().getMaxArticles();
        log.info("Direct sentiment lookup for '{}'", tool);

        return sentimentAnalyzer.analyze(tool, results, articles);
    }

    @GetMapping("/logs")
    public Mono<List<ResearchLogEntry>> logs() {
        return Mono.fromCallable(researchLogService::recent)
                .subscribeOn(Schedulers.boundedElastic());
    }
}
