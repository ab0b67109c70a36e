package com.tooldigest.research.dto;

import com.tooldigest.research.entity.SentimentLabel;
import com.tooldigest.research.entity.SentimentRating;

import java.util.List;

/**
 * Aggregate over the analyzed mentions of one tool. Errored mentions do not count.
 */
public record SentimentSummary(
        double averageScore,
        double averageNormalizedScore,
        SentimentDistribution distribution,
        SentimentRating rating
) {
    public static final double POSITIVE_THRESHOLD = 0.02;
    public static final double NEGATIVE_THRESHOLD = -0.02;

    public static SentimentSummary unknown() {
        return new SentimentSummary(0.0, 0.0, SentimentDistribution.empty(), SentimentRating.UNKNOWN);
    }

    public static SentimentSummary from(List<SentimentMention> mentions) {
        List<SentimentScore> scores = mentions.stream()
                .filter(SentimentMention::isAnalyzed)
                .map(SentimentMention::sentiment)
                .toList();
        if (scores.isEmpty()) {
            return unknown();
        }

        double avgScore = scores.stream().mapToInt(SentimentScore::score).average().orElse(0.0);
        double avgNormalized = scores.stream().mapToDouble(SentimentScore::normalizedScore).average().orElse(0.0);
        int positive = (int) scores.stream().filter(s -> s.label() == SentimentLabel.POSITIVE).count();
        int negative = (int) scores.stream().filter(s -> s.label() == SentimentLabel.NEGATIVE).count();
        int neutral = scores.size() - positive - negative;

        double roundedNormalized = round(avgNormalized);
        return new SentimentSummary(
                round(avgScore),
                roundedNormalized,
                new SentimentDistribution(positive, neutral, negative),
                rate(roundedNormalized)
        );
    }

    static SentimentRating rate(double averageNormalizedScore) {
        if (averageNormalizedScore > POSITIVE_THRESHOLD) {
            return SentimentRating.POSITIVE;
        }
        if (averageNormalizedScore < NEGATIVE_THRESHOLD) {
            return SentimentRating.NEGATIVE;
        }
        return SentimentRating.NEUTRAL;
    }

    private static double round(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }
}
