package com.tooldigest.research.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.tooldigest.research.config.ResearchProperties;
import com.tooldigest.research.exception.ModelClientException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API client.
 */
@Component
@ConditionalOnProperty(name = "research.model.provider", havingValue = "anthropic", matchIfMissing = true)
@Slf4j
public class AnthropicClient implements ModelClient {

    static final String API_VERSION = "2023-06-01";

    private final WebClient webClient;
    private final ResearchProperties properties;

    public AnthropicClient(@Qualifier("modelWebClient") WebClient webClient, ResearchProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public String name() {
        return "anthropic";
    }

    @Override
    public Mono<String> complete(ModelRequest request) {
        ResearchProperties.Model model = properties.getModel();
        if (model.getApiKey() == null || model.getApiKey().isBlank()) {
            return Mono.error(ModelClientException.notConfigured("Anthropic"));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model.getModel());
        body.put("max_tokens", request.maxTokens() != null ? request.maxTokens() : model.getMaxTokens());
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            body.put("system", request.systemPrompt());
        }
        if (request.temperature() != null) {
            body.put("temperature", request.temperature());
        }
        body.put("messages", List.of(Map.of("role", "user", "content", request.userPrompt())));

        return webClient.post()
                .uri(model.getBaseUrl() + "/v1/messages")
                .header("x-api-key", model.getApiKey())
                .header("anthropic-version", API_VERSION)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .flatMap(this::extractText)
                .doOnNext(text -> log.debug("Anthropic response: {} chars", text.length()));
    }

    private Mono<String> extractText(JsonNode json) {
        StringBuilder text = new StringBuilder();
        for (JsonNode block : json.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText(""));
            }
        }
        if (text.length() == 0) {
            return Mono.error(ModelClientException.emptyResponse("Anthropic"));
        }
        return Mono.just(text.toString());
    }
}
