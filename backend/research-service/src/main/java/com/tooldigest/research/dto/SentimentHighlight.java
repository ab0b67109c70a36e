package com.tooldigest.research.dto;

import com.tooldigest.research.entity.SentimentLabel;

public record SentimentHighlight(String token, SentimentLabel polarity) {
}
