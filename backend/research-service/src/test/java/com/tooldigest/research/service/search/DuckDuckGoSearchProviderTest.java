package com.tooldigest.research.service.search;

import com.tooldigest.research.config.ResearchProperties;
import com.tooldigest.research.dto.SearchRequest;
import com.tooldigest.research.dto.SearchResponse;
import com.tooldigest.research.dto.SearchResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DuckDuckGoSearchProviderTest {

    private static final String HTML = """
            <html><body>
              <div class="result results_links result--ad">
                <a class="result__a" href="https://duckduckgo.com/y.js?ad_provider=x">Sponsored</a>
              </div>
              <div class="result results_links">
                <a class="result__a" href="//duckduckgo.com/l/?uddg=https%3A%2F%2Faider.chat%2F&amp;rut=abc">Aider - AI pair programming</a>
                <a class="result__snippet">Aider lets you pair program with LLMs in your terminal.</a>
              </div>
              <div class="result results_links">
                <a class="result__a" href="https://www.reddit.com/r/LocalLLaMA/comments/1">Best coding agents?</a>
                <div class="result__snippet">Thread comparing agents</div>
              </div>
              <div class="result results_links">
                <span>no link here</span>
              </div>
            </body></html>
            """;

    @Test
    @DisplayName("Parses organic results, decodes redirect links, skips ads")
    void parsesResults() {
        List<SearchResult> results = DuckDuckGoSearchProvider.parseResults(HTML, 10);

        assertThat(results).hasSize(2);
        assertThat(results.get(0).title()).isEqualTo("Aider - AI pair programming");
        assertThat(results.get(0).url()).isEqualTo("https://aider.chat/");
        assertThat(results.get(0).content()).startsWith("Aider lets you");
        assertThat(results.get(0).source()).isEqualTo("aider.chat");
        assertThat(results.get(1).source()).isEqualTo("reddit.com");
    }

    @Test
    @DisplayName("Respects maxResults")
    void respectsLimit() {
        assertThat(DuckDuckGoSearchProvider.parseResults(HTML, 1)).hasSize(1);
    }

    @Test
    @DisplayName("Searches through the HTML endpoint")
    void searchesViaWebClient() {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    assertThat(request.url().toString()).isEqualTo("https://html.duckduckgo.com/html/");
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header("Content-Type", MediaType.TEXT_HTML_VALUE)
                            .body(HTML)
                            .build());
                })
                .build();
        DuckDuckGoSearchProvider provider = new DuckDuckGoSearchProvider(webClient, new ResearchProperties(),
                Clock.systemUTC());

        SearchResponse response = provider.search(SearchRequest.of("ai coding agents", 5)).block();

        assertThat(response.provider()).isEqualTo("duckduckgo");
        assertThat(response.query()).isEqualTo("ai coding agents");
        assertThat(response.results()).hasSize(2);
    }
}
