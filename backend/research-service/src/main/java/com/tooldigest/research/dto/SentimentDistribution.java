package com.tooldigest.research.dto;

public record SentimentDistribution(int positive, int neutral, int negative) {

    public static SentimentDistribution empty() {
        return new SentimentDistribution(0, 0, 0);
    }
}
