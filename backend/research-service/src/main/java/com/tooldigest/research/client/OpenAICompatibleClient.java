package com.tooldigest.research.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.tooldigest.research.config.ResearchProperties;
import com.tooldigest.research.exception.ModelClientException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completions client (OpenAI, OpenRouter, local gateways).
 * Selected with research.model.provider=openai.
 */
@Component
@ConditionalOnProperty(name = "research.model.provider", havingValue = "openai")
@Slf4j
public class OpenAICompatibleClient implements ModelClient {

    private final WebClient webClient;
    private final ResearchProperties properties;

    public OpenAICompatibleClient(@Qualifier("modelWebClient") WebClient webClient, ResearchProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public String name() {
        return "openai";
    }

    @Override
    public Mono<String> complete(ModelRequest request) {
        ResearchProperties.Model model = properties.getModel();
        if (model.getApiKey() == null || model.getApiKey().isBlank()) {
            return Mono.error(ModelClientException.notConfigured("OpenAI"));
        }

        List<Map<String, String>> messages = new ArrayList<>();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.add(Map.of("role", "system", "content", request.systemPrompt()));
        }
        messages.add(Map.of("role", "user", "content", request.userPrompt()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model.getModel());
        body.put("messages", messages);
        body.put("max_tokens", request.maxTokens() != null ? request.maxTokens() : model.getMaxTokens());
        if (request.temperature() != null) {
            body.put("temperature", request.temperature());
        }

        return webClient.post()
                .uri(model.getBaseUrl() + "/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + model.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .flatMap(json -> {
                    JsonNode content = json.path("choices").path(0).path("message").path("content");
                    if (content.isMissingNode() || content.isNull() || content.asText().isBlank()) {
                        return Mono.error(ModelClientException.emptyResponse("OpenAI"));
                    }
                    return Mono.just(content.asText());
                });
    }
}
