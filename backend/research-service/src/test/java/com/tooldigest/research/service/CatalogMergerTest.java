package com.tooldigest.research.service;

import com.tooldigest.research.dto.CandidateTool;
import com.tooldigest.research.dto.GitHubRepoStats;
import com.tooldigest.research.dto.ResearchedTool;
import com.tooldigest.research.dto.SearchProvenance;
import com.tooldigest.research.dto.SearchResult;
import com.tooldigest.research.dto.SentimentMention;
import com.tooldigest.research.dto.SentimentRecord;
import com.tooldigest.research.dto.SentimentSummary;
import com.tooldigest.research.dto.ValidatedTool;
import com.tooldigest.research.entity.StoredTool;
import com.tooldigest.research.repository.MergeResult;
import com.tooldigest.research.repository.ToolCatalog;
import com.tooldigest.research.service.sentiment.SentimentScorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CatalogMergerTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @Mock
    private ToolCatalog catalog;

    private CatalogMerger merger;

    @BeforeEach
    void setUp() {
        merger = new CatalogMerger(catalog, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ResearchedTool researched(String title) {
        CandidateTool candidate = new CandidateTool(title, "https://github.com/acme/" + title.toLowerCase(),
                title + " does things", "CLI", List.of("fast"), 0.85, "https://blog.example/post",
                "ai cli tools", NOW.minusSeconds(60), new SearchProvenance("tavily", "ai cli tools", NOW.minusSeconds(60)));
        return new ResearchedTool(new ValidatedTool(candidate, 0.9, "well maintained"), null, null);
    }

    private static StoredTool stored(long id, String title) {
        return StoredTool.builder().id(id).title(title).build();
    }

    @Test
    @DisplayName("Skips titles already in the catalog, case-insensitively, and assigns ids after the maximum")
    void mergesNewTools() {
        // given
        when(catalog.load()).thenReturn(new ArrayList<>(List.of(stored(3, "Aider"), stored(12, "Cursor"))));

        // when
        MergeResult result = merger.merge(List.of(researched("aider"), researched("Cline"), researched("Continue")));

        // then
        assertThat(result.addedCount()).isEqualTo(2);
        assertThat(result.skipped()).isEqualTo(1);
        assertThat(result.catalogSize()).isEqualTo(4);
        assertThat(result.added()).extracting(StoredTool::getId).containsExactly(13L, 14L);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<StoredTool>> saved = ArgumentCaptor.forClass(List.class);
        verify(catalog).save(saved.capture());
        assertThat(saved.getValue()).extracting(StoredTool::getTitle)
                .containsExactly("Aider", "Cursor", "Cline", "Continue");
    }

    @Test
    @DisplayName("Duplicates within one batch are added once")
    void batchDuplicates() {
        when(catalog.load()).thenReturn(new ArrayList<>());

        MergeResult result = merger.merge(List.of(researched("Cline"), researched("CLINE ")));

        assertThat(result.addedCount()).isEqualTo(1);
        assertThat(result.skipped()).isEqualTo(1);
        assertThat(result.added().get(0).getId()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Nothing new means the catalog is not rewritten")
    void noRewriteWhenNothingAdded() {
        when(catalog.load()).thenReturn(new ArrayList<>(List.of(stored(1, "Cline"))));

        MergeResult result = merger.merge(List.of(researched("cline")));

        assertThat(result.addedCount()).isZero();
        assertThat(result.catalogSize()).isEqualTo(1);
        verify(catalog, never()).save(any());
    }

    @Test
    @DisplayName("Maps provenance, sentiment and GitHub stats onto the stored entry")
    void mapsFields() {
        SearchResult article = new SearchResult("Cline review", "https://dev.to/cline", "", null, null, "dev.to");
        SentimentMention good = SentimentMention.analyzed(article, "great", new SentimentScorer().score("great tool"));
        SentimentMention failed = SentimentMention.failed(
                new SearchResult("Blocked", "https://reddit.com/x", "", null, null, "reddit.com"), "403");
        SentimentRecord sentiment = new SentimentRecord("Cline", "q", NOW, 2, 1,
                SentimentSummary.from(List.of(good, failed)), List.of(good, failed), null);
        ResearchedTool tool = new ResearchedTool(researched("Cline").tool(), sentiment,
                new GitHubRepoStats(4200, "https://github.com/acme/cline", NOW.minusSeconds(86400 * 3), 3L));

        StoredTool stored = merger.toStoredTool(5, tool, NOW);

        assertThat(stored.getId()).isEqualTo(5L);
        assertThat(stored.getSearchProvider()).isEqualTo("tavily");
        assertThat(stored.getDiscoveryQuery()).isEqualTo("ai cli tools");
        assertThat(stored.getQualityScore()).isEqualTo(0.9);
        assertThat(stored.getSearchTimestamp()).isEqualTo("2025-06-01T12:00:00Z");
        assertThat(stored.getPublicSentiment()).isEqualTo("positive");
        assertThat(stored.getSentimentSources()).containsExactly(
                new StoredTool.SentimentSource("Cline review", "https://dev.to/cline"));
        assertThat(stored.getGithubStars()).isEqualTo(4200);
        assertThat(stored.getGithubDaysAgo()).isEqualTo(3L);
    }
}
