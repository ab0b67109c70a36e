package com.tooldigest.research.service.sentiment;

import com.tooldigest.research.config.ResearchProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;

/**
 * Fetches an article and reduces it to plain text for scoring.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PageFetcher {

    private final WebClient webClient;
    private final ResearchProperties properties;

    /**
     * Plain text of the page, truncated to the configured length. Errors on HTTP failure,
     * timeout, or a page without text.
     */
    public Mono<String> fetchText(String url) {
        ResearchProperties.Sentiment config = properties.getSentiment();
        // URLs arrive already percent-encoded and are sent as is
        return Mono.defer(() -> webClient.get()
                        .uri(URI.create(url))
                        .accept(MediaType.TEXT_HTML, MediaType.APPLICATION_XHTML_XML, MediaType.TEXT_PLAIN)
                        .retrieve()
                        .bodyToMono(String.class))
                .timeout(Duration.ofSeconds(config.getFetchTimeoutSeconds()))
                .map(html -> extractText(html, config.getMaxTextLength()))
                .flatMap(text -> text.isEmpty()
                        ? Mono.error(new IllegalStateException("Page has no readable text"))
                        : Mono.just(text))
                .switchIfEmpty(Mono.error(new IllegalStateException("Empty response body")))
                .doOnError(e -> log.debug("Fetch failed for {}: {}", url, e.getMessage()));
    }

    static String extractText(String html, int maxLength) {
        Document doc = Jsoup.parse(html);

        doc.select("script, style, noscript, nav, footer, aside").remove();

        String text = doc.body() != null ? doc.body().text() : doc.text();
        text = text.replaceAll("\\s+", " ").trim();
        return text.length() > maxLength ? text.substring(0, maxLength) : text;
    }
}
