package com.tooldigest.research.service.search;

import com.tooldigest.research.config.ResearchProperties;
import com.tooldigest.research.dto.SearchRequest;
import com.tooldigest.research.dto.SearchResponse;
import com.tooldigest.research.dto.SearchResult;
import com.tooldigest.research.util.UrlNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Keyless fallback: scrapes the DuckDuckGo HTML endpoint.
 * Domain allow-lists are not supported and are ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DuckDuckGoSearchProvider implements SearchProvider {

    public static final String NAME = "duckduckgo";

    private final WebClient webClient;
    private final ResearchProperties properties;
    private final Clock clock;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return properties.getSearch().isDuckDuckGoEnabled();
    }

    @Override
    public Mono<SearchResponse> search(SearchRequest request) {
        if (!request.includeDomains().isEmpty()) {
            log.debug("DuckDuckGo ignores includeDomains {}", request.includeDomains());
        }

        return webClient.post()
                .uri(properties.getSearch().getDuckDuckGoBaseUrl() + "/html/")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.TEXT_HTML)
                .body(BodyInserters.fromFormData("q", request.query()))
                .retrieve()
                .bodyToMono(String.class)
                .map(html -> new SearchResponse(NAME, request.query(),
                        parseResults(html, request.maxResults()), null, Instant.now(clock)));
    }

    /**
     * Parses a DuckDuckGo HTML result page. Ads and entries without a usable link are skipped.
     */
    static List<SearchResult> parseResults(String html, int maxResults) {
        Document doc = Jsoup.parse(html);
        List<SearchResult> results = new ArrayList<>();

        for (Element result : doc.select("div.result")) {
            if (results.size() >= maxResults) {
                break;
            }
            if (result.hasClass("result--ad")) {
                continue;
            }
            Element link = result.selectFirst("a.result__a");
            if (link == null) {
                continue;
            }
            String url = resolveUrl(link.attr("href"));
            if (!UrlNormalizer.isAbsoluteHttpUrl(url)) {
                continue;
            }
            Element snippet = result.selectFirst(".result__snippet");
            results.add(new SearchResult(
                    link.text(),
                    url,
                    snippet != null ? snippet.text() : "",
                    null,
                    null,
                    UrlNormalizer.hostOf(url)
            ));
        }
        return results;
    }

    /**
     * Result links are redirects of the form //duckduckgo.com/l/?uddg=&lt;encoded target&gt;.
     */
    static String resolveUrl(String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        int idx = href.indexOf("uddg=");
        if (idx >= 0) {
            String encoded = href.substring(idx + 5);
            int amp = encoded.indexOf('&');
            if (amp >= 0) {
                encoded = encoded.substring(0, amp);
            }
            return URLDecoder.decode(encoded, StandardCharsets.UTF_8);
        }
        if (href.startsWith("//")) {
            return "https:" + href;
        }
        return href;
    }
}
