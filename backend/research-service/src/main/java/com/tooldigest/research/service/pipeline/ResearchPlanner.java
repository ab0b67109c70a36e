package com.tooldigest.research.service.pipeline;

import com.tooldigest.research.client.ModelClient;
import com.tooldigest.research.client.ModelRequest;
import com.tooldigest.research.config.ResearchProperties;
import com.tooldigest.research.util.ModelJsonParser;
import com.tooldigest.research.util.ParseResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Planning phase: asks the model for a set of diverse discovery queries.
 * Never fails; any problem yields the configured default query set.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResearchPlanner {

    static final String DEFAULT_FOCUS =
            "General agentic coding tools, AI code assistants, and developer AI platforms (decide for yourself)";

    private final ModelClient modelClient;
    private final ModelJsonParser jsonParser;
    private final ResearchProperties properties;

    public Mono<ResearchPlan> plan(List<String> focusAreas, int maxTools) {
        ModelRequest request = new ModelRequest(null, buildPrompt(focusAreas, maxTools), 2000, null);

        return modelClient.complete(request)
                .timeout(Duration.ofSeconds(properties.getModel().getTimeoutSeconds()))
                .map(text -> fromReply(text))
                .onErrorResume(e -> {
                    log.warn("Planning model call failed: {}", e.getMessage());
                    return Mono.just(fallback("model call failed: " + e.getMessage()));
                })
                .defaultIfEmpty(fallback("model returned no reply"));
    }

    ResearchPlan fromReply(String text) {
        ParseResult<PlanPayload> parsed = jsonParser.parse(text, PlanPayload.class);
        if (!parsed.isSuccess()) {
            log.warn("Could not parse research plan: {}", parsed.getError());
            return fallback("unparseable plan: " + parsed.getError());
        }
        List<String> queries = cleanQueries(parsed.getValue().queries());
        if (queries.isEmpty()) {
            return fallback("plan contained no queries");
        }
        return new ResearchPlan(parsed.getValue().reasoning(), queries, null);
    }

    ResearchPlan fallback(String reason) {
        List<String> defaults = cleanQueries(properties.getPipeline().getDefaultQueries());
        return new ResearchPlan("Using default query set", defaults, reason);
    }

    /**
     * Trims, drops blanks and case-insensitive duplicates, keeps at most the configured maximum.
     */
    List<String> cleanQueries(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        List<String> result = new ArrayList<>();
        for (String query : raw) {
            if (query == null || query.isBlank()) {
                continue;
            }
            String trimmed = query.trim();
            if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                result.add(trimmed);
            }
            if (result.size() >= properties.getPipeline().getMaxQueries()) {
                break;
            }
        }
        return result;
    }

    private String buildPrompt(List<String> focusAreas, int maxTools) {
        String focus = focusAreas == null || focusAreas.isEmpty() ? DEFAULT_FOCUS : String.join(", ", focusAreas);
        return """
                You are an autonomous research agent tasked with discovering agentic coding tools.

                Your goal: Find %d high-quality, recently active agentic coding tools.

                Focus areas: %s

                Create a strategic research plan by generating 5-8 diverse search queries that will:
                1. Find recently launched tools
                2. Discover both popular and emerging tools
                3. Cover different categories (IDEs, CLI tools, code completion, agents, etc.)
                4. Include queries for trending discussions on HackerNews, Reddit, Twitter
                5. Search for "best of" lists and comparisons

                Return ONLY a JSON object in this exact format:
                {
                  "reasoning": "Brief explanation of your search strategy",
                  "queries": ["search query 1", "search query 2"]
                }
                """.formatted(maxTools, focus);
    }
}
