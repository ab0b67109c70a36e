package com.tooldigest.research.service.sentiment;

import com.tooldigest.research.config.ResearchProperties;
import com.tooldigest.research.dto.SearchRequest;
import com.tooldigest.research.dto.SearchResponse;
import com.tooldigest.research.dto.SearchResult;
import com.tooldigest.research.dto.SentimentMention;
import com.tooldigest.research.dto.SentimentRecord;
import com.tooldigest.research.dto.SentimentScore;
import com.tooldigest.research.dto.SentimentSummary;
import com.tooldigest.research.entity.SearchDepth;
import com.tooldigest.research.service.search.SearchProviderChain;
import com.tooldigest.research.util.UrlNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Public sentiment for a tool, from forum and review pages found by web search.
 *
 * Pages are fetched one at a time. A page that cannot be fetched becomes a mention
 * with an error and does not count toward the averages.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SentimentAnalyzer {

    public static final int MAX_RESULTS_LIMIT = 10;
    public static final int MAX_ARTICLES_LIMIT = 5;

    private final SearchProviderChain searchProviderChain;
    private final PageFetcher pageFetcher;
    private final SentimentScorer scorer;
    private final ResearchProperties properties;
    private final Clock clock;

    public Mono<SentimentRecord> analyze(String toolName) {
        return analyze(toolName, properties.getSentiment().getMaxResults(), properties.getSentiment().getMaxArticles());
    }

    public Mono<SentimentRecord> analyze(String toolName, int maxResults, int maxArticles) {
        if (toolName == null || toolName.isBlank()) {
            return Mono.error(new IllegalArgumentException("Tool name must not be blank"));
        }
        String name = toolName.trim();
        String query = buildQuery(name);
        int results = Math.max(1, Math.min(MAX_RESULTS_LIMIT, maxResults));
        int articles = Math.max(1, Math.min(MAX_ARTICLES_LIMIT, maxArticles));

        SearchRequest request = new SearchRequest(query, results, SearchDepth.ADVANCED, List.of());
        return searchProviderChain.search(request)
                .flatMap(response -> analyzeResults(name, query, response, articles))
                .onErrorResume(e -> {
                    log.warn("Sentiment search failed for {}: {}", name, e.getMessage());
                    return Mono.just(SentimentRecord.failed(name, query, Instant.now(clock), e.getMessage()));
                });
    }

    String buildQuery(String toolName) {
        int year = Instant.now(clock).atZone(ZoneOffset.UTC).getYear();
        return "\"" + toolName + "\" reviews opinions "
                + "(site:reddit.com OR site:news.ycombinator.com OR site:dev.to) " + year;
    }

    private Mono<SentimentRecord> analyzeResults(String toolName, String query, SearchResponse response, int maxArticles) {
        List<SearchResult> selected = selectArticles(response.results(), maxArticles);

        return Flux.fromIterable(selected)
                .concatMap(this::analyzeArticle)
                .collectList()
                .map(mentions -> {
                    int analyzed = (int) mentions.stream().filter(SentimentMention::isAnalyzed).count();
                    log.info("Sentiment for {}: {}/{} articles analyzed", toolName, analyzed, mentions.size());
                    return new SentimentRecord(toolName, query, Instant.now(clock), response.results().size(),
                            analyzed, SentimentSummary.from(mentions), mentions, null);
                });
    }

    /**
     * Up to maxArticles results, one per normalized URL.
     */
    static List<SearchResult> selectArticles(List<SearchResult> results, int maxArticles) {
        Set<String> seen = new HashSet<>();
        List<SearchResult> selected = new ArrayList<>();
        for (SearchResult result : results) {
            if (selected.size() >= maxArticles) {
                break;
            }
            String key = UrlNormalizer.normalizeForKey(result.url());
            if (key.isEmpty() || !seen.add(key)) {
                continue;
            }
            selected.add(result);
        }
        return selected;
    }

    private Mono<SentimentMention> analyzeArticle(SearchResult result) {
        int snippetLength = properties.getSentiment().getSnippetLength();
        return pageFetcher.fetchText(result.url())
                .map(text -> {
                    SentimentScore score = scorer.score(text);
                    String snippet = text.length() > snippetLength ? text.substring(0, snippetLength) : text;
                    return SentimentMention.analyzed(result, snippet, score);
                })
                .onErrorResume(e -> {
                    String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                    return Mono.just(SentimentMention.failed(result, reason));
                });
    }
}
