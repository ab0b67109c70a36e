package com.tooldigest.research.service.pipeline;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tooldigest.research.client.ModelClient;
import com.tooldigest.research.client.ModelRequest;
import com.tooldigest.research.config.ResearchProperties;
import com.tooldigest.research.dto.CandidateTool;
import com.tooldigest.research.dto.SearchProvenance;
import com.tooldigest.research.dto.SearchResponse;
import com.tooldigest.research.util.ModelJsonParser;
import com.tooldigest.research.util.ParseResult;
import com.tooldigest.research.util.UrlNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Discovery phase: turns one query's search results into candidate tools via the model.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CandidateExtractor {

    static final List<String> CATEGORIES = List.of(
            "Code Completion", "IDE/Editor", "Terminal Tools", "Testing",
            "Code Review", "Agent Framework", "Language Model", "Developer Platform"
    );

    private static final TypeReference<List<ExtractedToolPayload>> PAYLOAD_LIST = new TypeReference<>() {
    };

    private final ModelClient modelClient;
    private final ModelJsonParser jsonParser;
    private final ResearchProperties properties;
    private final Clock clock;

    public Mono<ExtractionOutcome> extract(String query, SearchResponse response) {
        if (response.isEmpty()) {
            return Mono.just(new ExtractionOutcome(query, List.of(), 0, null));
        }

        ModelRequest request = new ModelRequest(null, buildPrompt(SearchResultFormatter.format(response)), 4000, null);
        SearchProvenance provenance = new SearchProvenance(response.provider(), query, response.timestamp());

        return modelClient.complete(request)
                .timeout(Duration.ofSeconds(properties.getModel().getTimeoutSeconds()))
                .map(text -> fromReply(query, text, provenance))
                .onErrorResume(e -> {
                    log.warn("Extraction model call failed for '{}': {}", query, e.getMessage());
                    return Mono.just(ExtractionOutcome.failed(query, "model call failed: " + e.getMessage()));
                })
                .defaultIfEmpty(ExtractionOutcome.failed(query, "model returned no reply"));
    }

    ExtractionOutcome fromReply(String query, String text, SearchProvenance provenance) {
        ParseResult<List<ExtractedToolPayload>> parsed = jsonParser.parse(text, PAYLOAD_LIST);
        if (!parsed.isSuccess()) {
            log.warn("Could not parse extracted tools for '{}': {}", query, parsed.getError());
            return ExtractionOutcome.failed(query, "unparseable tool list: " + parsed.getError());
        }

        Instant discoveredAt = Instant.now(clock);
        List<CandidateTool> candidates = new ArrayList<>();
        int dropped = 0;
        for (ExtractedToolPayload payload : parsed.getValue()) {
            CandidateTool candidate = toCandidate(payload, query, discoveredAt, provenance);
            if (candidate == null) {
                dropped++;
            } else {
                candidates.add(candidate);
            }
        }
        return new ExtractionOutcome(query, candidates, dropped, null);
    }

    private CandidateTool toCandidate(ExtractedToolPayload payload, String query, Instant discoveredAt,
                                      SearchProvenance provenance) {
        if (payload == null || payload.title() == null || payload.title().isBlank()) {
            return null;
        }
        String url = UrlNormalizer.isAbsoluteHttpUrl(payload.url()) ? payload.url().trim() : null;
        if (url == null && payload.url() != null && !payload.url().isBlank()) {
            log.debug("Clearing invalid URL '{}' for {}", payload.url(), payload.title());
        }
        String sourceUrl = UrlNormalizer.isAbsoluteHttpUrl(payload.sourceUrl()) ? payload.sourceUrl().trim() : null;
        List<String> features = payload.features() == null ? List.of()
                : payload.features().stream().filter(Objects::nonNull).map(String::trim).filter(f -> !f.isEmpty()).toList();

        return new CandidateTool(
                payload.title().trim(),
                url,
                payload.description(),
                payload.category(),
                features,
                clampConfidence(payload.confidence()),
                sourceUrl,
                query,
                discoveredAt,
                provenance
        );
    }

    static double clampConfidence(Double confidence) {
        if (confidence == null || confidence.isNaN()) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private String buildPrompt(String formattedResults) {
        return """
                You are analyzing web search results to discover agentic coding tools.

                %s

                Your task: Extract ACTUAL agentic coding tools from these search results.

                Requirements:
                - Only include real, existing tools that appear in the search results above. Do not invent tools.
                - Focus on tools that help developers write, review, or generate code
                - Exclude: papers, tutorials, blog posts that aren't about specific tools

                Return ONLY a JSON array of tools:
                [
                  {
                    "title": "Tool Name",
                    "description": "4-5 sentences: what it does, how it works, target users, unique features",
                    "url": "https://tool-url.com",
                    "category": "One of: %s",
                    "features": ["Feature 1", "Feature 2", "Feature 3"],
                    "confidence": 0.95,
                    "source_url": "URL where you found this information"
                  }
                ]

                If no relevant tools found, return: []
                Include 3-7 tools maximum per search.
                """.formatted(formattedResults, String.join(", ", CATEGORIES));
    }
}
