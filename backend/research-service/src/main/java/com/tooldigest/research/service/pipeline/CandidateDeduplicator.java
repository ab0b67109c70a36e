package com.tooldigest.research.service.pipeline;

import com.tooldigest.research.dto.CandidateTool;
import com.tooldigest.research.util.UrlNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Order-stable deduplication; the first occurrence of a tool wins.
 *
 * Two candidates are the same tool when their case-folded title and normalized URL
 * both match, or when they share a normalized URL.
 */
@Component
public class CandidateDeduplicator {

    public List<CandidateTool> deduplicate(List<CandidateTool> candidates) {
        Set<String> seenKeys = new HashSet<>();
        Set<String> seenUrls = new HashSet<>();
        List<CandidateTool> unique = new ArrayList<>();

        for (CandidateTool candidate : candidates) {
            String urlKey = UrlNormalizer.normalizeForKey(candidate.url());
            String key = titleKey(candidate.title()) + "||" + urlKey;

            if (seenKeys.contains(key) || (!urlKey.isEmpty() && seenUrls.contains(urlKey))) {
                continue;
            }
            seenKeys.add(key);
            if (!urlKey.isEmpty()) {
                seenUrls.add(urlKey);
            }
            unique.add(candidate);
        }
        return unique;
    }

    static String titleKey(String title) {
        return title == null ? "" : title.trim().toLowerCase(Locale.ROOT);
    }
}
