package com.tooldigest.research.service;

import com.tooldigest.research.dto.CandidateTool;
import com.tooldigest.research.dto.GitHubRepoStats;
import com.tooldigest.research.dto.ResearchedTool;
import com.tooldigest.research.dto.SentimentMention;
import com.tooldigest.research.dto.SentimentRecord;
import com.tooldigest.research.entity.StoredTool;
import com.tooldigest.research.repository.MergeResult;
import com.tooldigest.research.repository.ToolCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Adds researched tools to the catalog.
 *
 * A tool whose case-folded title is already in the catalog, or earlier in the same
 * batch, is skipped. New entries get ids after the current maximum. The catalog is
 * rewritten only when something was added.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogMerger {

    private final ToolCatalog catalog;
    private final Clock clock;

    public synchronized MergeResult merge(List<ResearchedTool> tools) {
        List<StoredTool> existing = catalog.load();
        Set<String> titles = new HashSet<>();
        long nextId = 1;
        for (StoredTool stored : existing) {
            titles.add(titleKey(stored.getTitle()));
            if (stored.getId() != null && stored.getId() >= nextId) {
                nextId = stored.getId() + 1;
            }
        }

        Instant now = Instant.now(clock);
        List<StoredTool> added = new ArrayList<>();
        int skipped = 0;
        for (ResearchedTool tool : tools) {
            String key = titleKey(tool.tool().title());
            if (key.isEmpty() || !titles.add(key)) {
                log.debug("Skipping {}: already in catalog", tool.tool().title());
                skipped++;
                continue;
            }
            added.add(toStoredTool(nextId++, tool, now));
        }

        if (added.isEmpty()) {
            log.info("Merge added no new tools ({} skipped)", skipped);
            return new MergeResult(List.of(), skipped, existing.size());
        }

        List<StoredTool> merged = new ArrayList<>(existing);
        merged.addAll(added);
        catalog.save(merged);
        log.info("Merged {} new tools into catalog ({} skipped, {} total)", added.size(), skipped, merged.size());
        return new MergeResult(added, skipped, merged.size());
    }

    static String titleKey(String title) {
        return title == null ? "" : title.trim().toLowerCase(Locale.ROOT);
    }

    StoredTool toStoredTool(long id, ResearchedTool researched, Instant searchTimestamp) {
        CandidateTool candidate = researched.tool().candidate();
        StoredTool.StoredToolBuilder builder = StoredTool.builder()
                .id(id)
                .title(candidate.title())
                .description(candidate.description())
                .category(candidate.category())
                .url(candidate.url())
                .features(candidate.features())
                .confidence(candidate.confidence())
                .qualityScore(researched.tool().qualityScore())
                .qualityReason(researched.tool().qualityReason())
                .discoveredAt(candidate.discoveredAt() != null ? candidate.discoveredAt().toString() : null)
                .discoveryQuery(candidate.discoveryQuery())
                .searchProvider(candidate.provenance() != null ? candidate.provenance().provider() : null)
                .searchTimestamp(searchTimestamp.toString());

        SentimentRecord sentiment = researched.sentiment();
        if (sentiment != null) {
            builder.publicSentiment(sentiment.summary().rating().getValue())
                    .sentimentSummary(sentiment.summary())
                    .sentimentAnalyzedAt(sentiment.generatedAt() != null ? sentiment.generatedAt().toString() : null)
                    .sentimentSources(sentiment.mentions().stream()
                            .filter(SentimentMention::isAnalyzed)
                            .map(m -> new StoredTool.SentimentSource(m.title(), m.url()))
                            .toList());
        }

        GitHubRepoStats github = researched.github();
        if (github != null) {
            builder.githubStars(github.stars())
                    .githubUrl(github.htmlUrl())
                    .githubLastPushed(Objects.toString(github.lastPushedAt(), null))
                    .githubDaysAgo(github.daysSinceLastPush());
        }
        return builder.build();
    }
}
