package com.tooldigest.research.service.sentiment;

import com.tooldigest.research.dto.SentimentHighlight;
import com.tooldigest.research.dto.SentimentScore;
import com.tooldigest.research.entity.SentimentLabel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lexicon polarity scorer.
 *
 * Counts tokens found in fixed positive and negative word sets. Negation and
 * context are ignored.
 */
@Component
public class SentimentScorer {

    static final Set<String> POSITIVE_WORDS = Set.of(
            "accessible", "accurate", "amazing", "awesome", "beneficial", "best", "breakthrough",
            "clean", "comprehensive", "convenient", "effective", "efficient", "empowering",
            "excellent", "fast", "flexible", "great", "helpful", "impressive", "innovative",
            "intuitive", "love", "productive", "progress", "reliable", "recommend", "robust",
            "solid", "streamlined", "success", "supportive", "transformative", "useful", "valuable"
    );

    static final Set<String> NEGATIVE_WORDS = Set.of(
            "annoying", "broken", "bug", "buggy", "confusing", "crash", "difficult", "disappointed",
            "expensive", "fail", "frustrating", "hard", "hate", "inaccurate", "issue", "lag", "laggy",
            "lacking", "limited", "negative", "outdated", "overpriced", "poor", "problem", "slow",
            "terrible", "unreliable", "unsatisfied", "unusable", "worse"
    );

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^a-z0-9]+");

    public SentimentScore score(String text) {
        List<String> tokens = tokenize(text);
        int positive = 0;
        int negative = 0;
        List<SentimentHighlight> highlights = new ArrayList<>();

        for (String token : tokens) {
            if (POSITIVE_WORDS.contains(token)) {
                positive++;
                highlights.add(new SentimentHighlight(token, SentimentLabel.POSITIVE));
            } else if (NEGATIVE_WORDS.contains(token)) {
                negative++;
                highlights.add(new SentimentHighlight(token, SentimentLabel.NEGATIVE));
            }
        }

        int score = positive - negative;
        double normalized = (double) score / Math.max(tokens.size(), 1);
        return new SentimentScore(score, normalized, labelFor(normalized), positive, negative,
                tokens.size(), highlights);
    }

    static SentimentLabel labelFor(double normalizedScore) {
        if (normalizedScore > 0.02) {
            return SentimentLabel.POSITIVE;
        }
        if (normalizedScore < -0.02) {
            return SentimentLabel.NEGATIVE;
        }
        return SentimentLabel.NEUTRAL;
    }

    private static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String token : TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
