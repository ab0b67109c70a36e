package com.tooldigest.research.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.tooldigest.research.config.ResearchProperties;
import com.tooldigest.research.dto.GitHubRepoStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads repository stats from the GitHub REST API for tools hosted on github.com.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GitHubClient {

    private static final Pattern REPO_PATH = Pattern.compile("^/([A-Za-z0-9_.-]+)/([A-Za-z0-9_.-]+)");
    private static final Pattern REPO_LINK =
            Pattern.compile("https?://(?:www\\.)?github\\.com/[A-Za-z0-9_-]+/[A-Za-z0-9_.-]+", Pattern.CASE_INSENSITIVE);

    private final WebClient webClient;
    private final ResearchProperties properties;
    private final Clock clock;

    public boolean isEnabled() {
        return properties.getGithub().isEnabled();
    }

    /**
     * owner/repo for a github.com URL, empty for anything else.
     */
    public static Optional<String> repositoryOf(String url) {
        if (url == null) {
            return Optional.empty();
        }
        try {
            URI uri = URI.create(url.trim());
            String host = uri.getHost();
            if (host == null || !(host.equalsIgnoreCase("github.com") || host.equalsIgnoreCase("www.github.com"))) {
                return Optional.empty();
            }
            Matcher m = REPO_PATH.matcher(uri.getPath() == null ? "" : uri.getPath());
            if (!m.find()) {
                return Optional.empty();
            }
            String repo = m.group(2).endsWith(".git") ? m.group(2).substring(0, m.group(2).length() - 4) : m.group(2);
            return Optional.of(m.group(1) + "/" + repo);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * owner/repo of the first github.com repository link found in free text, such as a
     * tool description.
     */
    public static Optional<String> repositoryIn(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher m = REPO_LINK.matcher(text);
        while (m.find()) {
            // sentence punctuation right after a link
            String link = m.group().replaceAll("\\.+$", "");
            Optional<String> repository = repositoryOf(link);
            if (repository.isPresent()) {
                return repository;
            }
        }
        return Optional.empty();
    }

    public Mono<GitHubRepoStats> fetchStats(String repository) {
        ResearchProperties.Github config = properties.getGithub();
        return webClient.get()
                .uri(URI.create(config.getBaseUrl() + "/repos/" + repository))
                .headers(headers -> {
                    headers.set(HttpHeaders.ACCEPT, "application/vnd.github+json");
                    if (config.getToken() != null && !config.getToken().isBlank()) {
                        headers.setBearerAuth(config.getToken());
                    }
                })
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(this::toStats)
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()));
    }

    private GitHubRepoStats toStats(JsonNode json) {
        Instant pushedAt = null;
        Long daysAgo = null;
        String pushed = json.path("pushed_at").asText(null);
        if (pushed != null && !pushed.isBlank()) {
            pushedAt = Instant.parse(pushed);
            daysAgo = Duration.between(pushedAt, Instant.now(clock)).toDays();
        }
        return new GitHubRepoStats(
                json.path("stargazers_count").asInt(0),
                json.path("html_url").asText(null),
                pushedAt,
                daysAgo
        );
    }
}
