package com.tooldigest.research.service.sentiment;

import com.tooldigest.research.config.ResearchProperties;
import com.tooldigest.research.dto.SearchRequest;
import com.tooldigest.research.dto.SearchResponse;
import com.tooldigest.research.dto.SearchResult;
import com.tooldigest.research.dto.SentimentMention;
import com.tooldigest.research.dto.SentimentRecord;
import com.tooldigest.research.entity.SentimentRating;
import com.tooldigest.research.exception.SearchUnavailableException;
import com.tooldigest.research.service.search.SearchProviderChain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SentimentAnalyzerTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @Mock
    private SearchProviderChain searchProviderChain;

    @Mock
    private PageFetcher pageFetcher;

    private SentimentAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new SentimentAnalyzer(searchProviderChain, pageFetcher, new SentimentScorer(),
                new ResearchProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static SearchResult result(String url) {
        return new SearchResult("Thread about " + url, url, "", null, "2025-05-01", "reddit.com");
    }

    private static SearchResponse response(SearchResult... results) {
        return new SearchResponse("tavily", "q", List.of(results), null, NOW);
    }

    @Test
    @DisplayName("Builds the forum query with the current year")
    void buildsQuery() {
        assertThat(analyzer.buildQuery("Aider"))
                .isEqualTo("\"Aider\" reviews opinions (site:reddit.com OR site:news.ycombinator.com OR site:dev.to) 2025");
    }

    @Test
    @DisplayName("Scores fetched pages and aggregates them")
    void scoresPages() {
        when(searchProviderChain.search(any())).thenReturn(Mono.just(response(
                result("https://reddit.com/r/a"), result("https://news.ycombinator.com/item?id=1"))));
        when(pageFetcher.fetchText("https://reddit.com/r/a")).thenReturn(Mono.just("great useful tool love it"));
        when(pageFetcher.fetchText("https://news.ycombinator.com/item?id=1")).thenReturn(Mono.just("fast and reliable"));

        SentimentRecord record = analyzer.analyze("Aider").block();

        assertThat(record.toolName()).isEqualTo("Aider");
        assertThat(record.totalResults()).isEqualTo(2);
        assertThat(record.analyzedCount()).isEqualTo(2);
        assertThat(record.summary().rating()).isEqualTo(SentimentRating.POSITIVE);
        assertThat(record.mentions()).allMatch(SentimentMention::isAnalyzed);
        assertThat(record.mentions().get(0).snippet()).isEqualTo("great useful tool love it");
        assertThat(record.searchError()).isNull();
    }

    @Test
    @DisplayName("All fetches failing yields zero analyzed and an unknown rating")
    void allFetchesFail() {
        when(searchProviderChain.search(any())).thenReturn(Mono.just(response(
                result("https://reddit.com/r/a"), result("https://dev.to/b"))));
        when(pageFetcher.fetchText(anyString())).thenReturn(Mono.error(new IllegalStateException("403 Forbidden")));

        SentimentRecord record = analyzer.analyze("Cline").block();

        assertThat(record.analyzedCount()).isZero();
        assertThat(record.mentions()).hasSize(2).allSatisfy(m -> assertThat(m.error()).contains("403"));
        assertThat(record.summary().rating()).isEqualTo(SentimentRating.UNKNOWN);
    }

    @Test
    @DisplayName("Picks at most maxArticles results with distinct URLs")
    void distinctArticles() {
        when(searchProviderChain.search(any())).thenReturn(Mono.just(response(
                result("https://reddit.com/r/a"), result("https://reddit.com/r/a/"),
                result("https://dev.to/b"), result("https://dev.to/c"))));
        when(pageFetcher.fetchText(anyString())).thenReturn(Mono.just("neutral words only"));

        SentimentRecord record = analyzer.analyze("Cursor", 6, 2).block();

        assertThat(record.mentions()).extracting(SentimentMention::url)
                .containsExactly("https://reddit.com/r/a", "https://dev.to/b");
    }

    @Test
    @DisplayName("Clamps maxResults to 10 and maxArticles to 5")
    void clampsLimits() {
        when(searchProviderChain.search(any())).thenReturn(Mono.just(response()));

        analyzer.analyze("Cursor", 50, 50).block();

        ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
        verify(searchProviderChain).search(captor.capture());
        assertThat(captor.getValue().maxResults()).isEqualTo(10);
        assertThat(SentimentAnalyzer.selectArticles(List.of(
                result("https://a.dev/1"), result("https://a.dev/2"), result("https://a.dev/3"),
                result("https://a.dev/4"), result("https://a.dev/5"), result("https://a.dev/6")), 5)).hasSize(5);
    }

    @Test
    @DisplayName("A failed sentiment search yields a record with searchError")
    void searchFails() {
        when(searchProviderChain.search(any()))
                .thenReturn(Mono.error(new SearchUnavailableException("q", Map.of("tavily", "quota"))));

        SentimentRecord record = analyzer.analyze("Tabnine").block();

        assertThat(record.searchError()).contains("quota");
        assertThat(record.totalResults()).isZero();
        assertThat(record.analyzedCount()).isZero();
        assertThat(record.summary().rating()).isEqualTo(SentimentRating.UNKNOWN);
        verify(pageFetcher, never()).fetchText(anyString());
    }
}
