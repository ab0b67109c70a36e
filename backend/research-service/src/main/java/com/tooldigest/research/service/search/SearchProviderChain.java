package com.tooldigest.research.service.search;

import com.tooldigest.research.config.ResearchProperties;
import com.tooldigest.research.dto.SearchRequest;
import com.tooldigest.research.dto.SearchResponse;
import com.tooldigest.research.exception.SearchUnavailableException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Search with provider fallback.
 *
 * Fallback order:
 * 1. The configured preferred provider (RESEARCH_SEARCH_PROVIDER)
 * 2. The remaining providers in research.search.provider-order
 *
 * Disabled providers are skipped. An error or timeout moves on to the next provider;
 * an empty result set is a valid answer and ends the chain.
 */
@Service
@Slf4j
public class SearchProviderChain {

    public static final int MIN_RESULTS = 1;
    public static final int MAX_RESULTS = 10;

    private final Map<String, SearchProvider> providers;
    private final ResearchProperties properties;
    private final MeterRegistry meterRegistry;

    public SearchProviderChain(List<SearchProvider> providers, ResearchProperties properties,
                               MeterRegistry meterRegistry) {
        this.providers = providers.stream()
                .collect(Collectors.toMap(p -> p.name().toLowerCase(Locale.ROOT), Function.identity(),
                        (a, b) -> a, LinkedHashMap::new));
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    public Mono<SearchResponse> search(SearchRequest request) {
        if (request.query() == null || request.query().isBlank()) {
            return Mono.error(new IllegalArgumentException("Search query must not be blank"));
        }
        SearchRequest clamped = request.withMaxResults(clamp(request.maxResults()));
        List<SearchProvider> chain = buildProviderChain();

        if (chain.isEmpty()) {
            log.error("No search providers are enabled");
            return Mono.error(new SearchUnavailableException(clamped.query(), Map.of()));
        }

        log.debug("Search fallback chain for '{}': {}", clamped.query(),
                chain.stream().map(SearchProvider::name).toList());
        return Mono.defer(() -> tryProvidersInSequence(chain, 0, clamped, new LinkedHashMap<>()));
    }

    /**
     * Enabled providers in preference order.
     */
    public List<SearchProvider> buildProviderChain() {
        List<String> order = new ArrayList<>();
        String preferred = properties.getSearch().getPreferredProvider();
        if (preferred != null && !preferred.isBlank()) {
            order.add(preferred.trim().toLowerCase(Locale.ROOT));
        }
        for (String name : properties.getSearch().getProviderOrder()) {
            String key = name.trim().toLowerCase(Locale.ROOT);
            if (!order.contains(key)) {
                order.add(key);
            }
        }
        // providers registered but not named in configuration go last
        for (String key : providers.keySet()) {
            if (!order.contains(key)) {
                order.add(key);
            }
        }

        List<SearchProvider> chain = new ArrayList<>();
        for (String key : order) {
            SearchProvider provider = providers.get(key);
            if (provider == null) {
                log.warn("Unknown search provider in configuration: {}", key);
            } else if (provider.isEnabled()) {
                chain.add(provider);
            } else {
                log.debug("Search provider {} is disabled, skipping", key);
            }
        }
        return chain;
    }

    private Mono<SearchResponse> tryProvidersInSequence(List<SearchProvider> chain, int index,
                                                        SearchRequest request, Map<String, String> failures) {
        if (index >= chain.size()) {
            log.error("All search providers failed for '{}': {}", request.query(), failures);
            return Mono.error(new SearchUnavailableException(request.query(),
                    Collections.unmodifiableMap(new LinkedHashMap<>(failures))));
        }

        SearchProvider current = chain.get(index);
        Duration timeout = Duration.ofSeconds(properties.getSearch().getTimeoutSeconds());

        return Mono.defer(() -> current.search(request))
                .timeout(timeout)
                .doOnNext(response -> {
                    log.info("Search '{}' served by {} ({} results)",
                            request.query(), current.name(), response.results().size());
                    meterRegistry.counter("research.search.requests", "provider", current.name()).increment();
                })
                .onErrorResume(e -> {
                    String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                    log.warn("Search provider {} failed: {}. Trying next provider...", current.name(), reason);
                    meterRegistry.counter("research.search.failures", "provider", current.name()).increment();
                    failures.put(current.name(), reason);
                    return tryProvidersInSequence(chain, index + 1, request, failures);
                })
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("Search provider {} completed without a response. Trying next provider...",
                            current.name());
                    failures.put(current.name(), "no response");
                    return tryProvidersInSequence(chain, index + 1, request, failures);
                }));
    }

    static int clamp(int maxResults) {
        return Math.max(MIN_RESULTS, Math.min(MAX_RESULTS, maxResults));
    }
}
