package com.tooldigest.research.dto;

/**
 * A validated tool with everything gathered for it before merge.
 * github is null when the tool is not hosted on GitHub or the lookup failed.
 */
public record ResearchedTool(
        ValidatedTool tool,
        SentimentRecord sentiment,
        GitHubRepoStats github
) {
}
