package com.tooldigest.research.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Research pipeline configuration.
 *
 * Loaded from application.yml under the {@code research} prefix. Secrets are bound
 * from environment variables referenced there.
 */
@Configuration
@ConfigurationProperties(prefix = "research")
@Data
public class ResearchProperties {

    private Model model = new Model();
    private Search search = new Search();
    private Sentiment sentiment = new Sentiment();
    private Validation validation = new Validation();
    private Pipeline pipeline = new Pipeline();
    private Catalog catalog = new Catalog();
    private Github github = new Github();

    @Data
    public static class Model {
        /** anthropic | openai */
        private String provider = "anthropic";
        private String apiKey;
        private String baseUrl = "https://api.anthropic.com";
        private String model = "claude-sonnet-4-20250514";
        private int maxTokens = 4096;
        private int timeoutSeconds = 120;
    }

    @Data
    public static class Search {
        private String preferredProvider = "tavily";
        private List<String> providerOrder = new ArrayList<>(List.of("tavily", "duckduckgo"));
        private String tavilyApiKey;
        private String tavilyBaseUrl = "https://api.tavily.com";
        private String duckDuckGoBaseUrl = "https://html.duckduckgo.com";
        private boolean duckDuckGoEnabled = true;
        private int defaultMaxResults = 6;
        private int timeoutSeconds = 30;
        private String defaultQuery = "agentic coding systems and tools";
    }

    @Data
    public static class Sentiment {
        private int maxResults = 6;
        private int maxArticles = 3;
        private int fetchTimeoutSeconds = 12;
        private int maxTextLength = 1500;
        private int snippetLength = 320;
    }

    @Data
    public static class Validation {
        /** Candidates beyond this many are not submitted to the model */
        private int maxCandidates = 20;
        private double confidenceThreshold = 0.7;
    }

    @Data
    public static class Pipeline {
        private int defaultMaxTools = 10;
        private int resultsPerQuery = 10;
        private int maxQueries = 8;
        private int eventReplayLimit = 500;
        /** Upper bound for any single blocking step of a run */
        private int stepTimeoutSeconds = 600;
        private long heartbeatSeconds = 15;
        private List<String> defaultQueries = new ArrayList<>(List.of(
                "best agentic coding tools 2025",
                "AI code editor IDE 2025 trending",
                "GitHub copilot alternatives 2025",
                "autonomous coding agents LLM",
                "AI pair programming tools reddit discussions 2025"
        ));
    }

    @Data
    public static class Catalog {
        private String path = "data/tools.json";
        private String logPath = "data/research_log.json";
        private int logLimit = 100;
    }

    @Data
    public static class Github {
        private boolean enabled = true;
        private String token;
        private String baseUrl = "https://api.github.com";
        private int timeoutSeconds = 10;
    }
}
