package com.tooldigest.research.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a JSON document from free-form model output.
 *
 * Models wrap JSON in markdown fences or surround it with prose. The parser strips
 * fences, falls back to the outermost array or object in the text, and reports
 * failure as a {@link ParseResult} instead of throwing.
 */
@Component
@Slf4j
public class ModelJsonParser {

    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*(.*?)```", Pattern.DOTALL);
    private static final Pattern JSON_BODY = Pattern.compile("(\\[.*]|\\{.*})", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public ModelJsonParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
    }

    public <T> ParseResult<T> parse(String text, Class<T> type) {
        return parse(text, objectMapper.getTypeFactory().constructType(type));
    }

    public <T> ParseResult<T> parse(String text, TypeReference<T> type) {
        return parse(text, objectMapper.getTypeFactory().constructType(type));
    }

    private <T> ParseResult<T> parse(String text, JavaType type) {
        if (text == null || text.isBlank()) {
            return ParseResult.failure("Empty model response");
        }

        String candidate = text.trim();
        Matcher fenced = FENCED.matcher(candidate);
        if (fenced.find()) {
            candidate = fenced.group(1).trim();
        }

        Matcher body = JSON_BODY.matcher(candidate);
        if (!body.find()) {
            return ParseResult.failure("No JSON object or array found in model response");
        }

        try {
            T value = objectMapper.readValue(body.group(1), type);
            if (value == null) {
                return ParseResult.failure("Model response contained JSON null");
            }
            return ParseResult.success(value);
        } catch (JsonProcessingException e) {
            log.debug("Failed to parse model JSON: {}", e.getOriginalMessage());
            return ParseResult.failure("Malformed JSON: " + e.getOriginalMessage());
        }
    }
}
