package com.tooldigest.research.dto;

import java.time.Instant;

public record GitHubRepoStats(
        int stars,
        String htmlUrl,
        Instant lastPushedAt,
        Long daysSinceLastPush
) {
}
