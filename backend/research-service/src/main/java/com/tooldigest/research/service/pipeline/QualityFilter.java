package com.tooldigest.research.service.pipeline;

import com.tooldigest.research.client.ModelClient;
import com.tooldigest.research.client.ModelRequest;
import com.tooldigest.research.config.ResearchProperties;
import com.tooldigest.research.dto.CandidateTool;
import com.tooldigest.research.dto.ValidatedTool;
import com.tooldigest.research.util.ModelJsonParser;
import com.tooldigest.research.util.ParseResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Validation phase: the model approves candidates by 1-based index.
 *
 * Only the first maxCandidates are submitted. When the reply cannot be used the
 * filter keeps submitted candidates whose confidence meets the threshold.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QualityFilter {

    private static final int DESCRIPTION_PREVIEW = 100;

    private final ModelClient modelClient;
    private final ModelJsonParser jsonParser;
    private final ResearchProperties properties;

    public Mono<ValidationOutcome> validate(List<CandidateTool> candidates) {
        if (candidates.isEmpty()) {
            return Mono.just(new ValidationOutcome(List.of(), 0, 0, null, null));
        }

        int cap = Math.max(1, properties.getValidation().getMaxCandidates());
        List<CandidateTool> submitted = candidates.subList(0, Math.min(cap, candidates.size()));
        int excluded = candidates.size() - submitted.size();

        ModelRequest request = new ModelRequest(null, buildPrompt(submitted), 3000, null);
        return modelClient.complete(request)
                .timeout(Duration.ofSeconds(properties.getModel().getTimeoutSeconds()))
                .map(text -> fromReply(text, submitted, excluded))
                .onErrorResume(e -> {
                    log.warn("Validation model call failed: {}", e.getMessage());
                    return Mono.just(fallback(submitted, excluded, "model call failed: " + e.getMessage()));
                })
                .defaultIfEmpty(fallback(submitted, excluded, "model returned no reply"));
    }

    ValidationOutcome fromReply(String text, List<CandidateTool> submitted, int excluded) {
        ParseResult<QualityVerdictPayload> parsed = jsonParser.parse(text, QualityVerdictPayload.class);
        if (!parsed.isSuccess()) {
            log.warn("Could not parse validation verdict: {}", parsed.getError());
            return fallback(submitted, excluded, "unparseable verdict: " + parsed.getError());
        }
        QualityVerdictPayload verdict = parsed.getValue();
        if (verdict.approvedIndices() == null) {
            return fallback(submitted, excluded, "verdict has no approved_indices");
        }

        // TreeSet: ignores repeats and restores candidate order
        TreeSet<Integer> indices = new TreeSet<>();
        for (Integer index : verdict.approvedIndices()) {
            if (index != null && index >= 1 && index <= submitted.size()) {
                indices.add(index);
            }
        }

        Map<String, QualityVerdictPayload.Score> scores = verdict.qualityScores() == null ? Map.of() : verdict.qualityScores();
        List<ValidatedTool> approved = new ArrayList<>();
        for (Integer index : indices) {
            CandidateTool candidate = submitted.get(index - 1);
            QualityVerdictPayload.Score score = scores.get(String.valueOf(index));
            double qualityScore = score != null && score.score() != null
                    ? CandidateExtractor.clampConfidence(score.score())
                    : candidate.confidence();
            String reason = score != null ? score.reason() : null;
            approved.add(new ValidatedTool(candidate, qualityScore, reason));
        }
        return new ValidationOutcome(approved, submitted.size(), excluded, verdict.reasoning(), null);
    }

    ValidationOutcome fallback(List<CandidateTool> submitted, int excluded, String reason) {
        double threshold = properties.getValidation().getConfidenceThreshold();
        List<ValidatedTool> approved = submitted.stream()
                .filter(c -> c.confidence() >= threshold)
                .map(c -> new ValidatedTool(c, c.confidence(), "Kept by confidence threshold " + threshold))
                .toList();
        return new ValidationOutcome(approved, submitted.size(), excluded, null, reason);
    }

    private String buildPrompt(List<CandidateTool> submitted) {
        StringBuilder summary = new StringBuilder();
        for (int i = 0; i < submitted.size(); i++) {
            CandidateTool tool = submitted.get(i);
            String description = tool.description().isBlank() ? "No description" : tool.description();
            if (description.length() > DESCRIPTION_PREVIEW) {
                description = description.substring(0, DESCRIPTION_PREVIEW);
            }
            summary.append(i + 1).append(". ").append(tool.title()).append(" - ").append(description)
                    .append("... (confidence: ").append(tool.confidence()).append(")\n");
        }

        return """
                You are a quality control agent for an agentic coding tools directory.

                Review these discovered tools and assess their quality:

                %s
                Criteria for HIGH QUALITY tools:
                1. Real, existing tool (not hypothetical or concept)
                2. Actively maintained (not abandoned)
                3. Genuinely useful for developers
                4. Clear value proposition
                5. Accessible (has website or GitHub repo)

                Return ONLY a JSON object:
                {
                  "approved_indices": [1, 3],
                  "reasoning": "Brief explanation of your decisions",
                  "quality_scores": {
                    "1": {"score": 0.95, "reason": "Excellent tool, widely used"},
                    "3": {"score": 0.85, "reason": "Good tool, active development"}
                  }
                }

                Be selective but fair. List indices (1-based) of HIGH QUALITY tools only.
                """.formatted(summary);
    }
}
