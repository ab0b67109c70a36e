package com.tooldigest.research.client;

public record ModelRequest(
        String systemPrompt,
        String userPrompt,
        Integer maxTokens,
        Double temperature
) {
    public static ModelRequest of(String systemPrompt, String userPrompt) {
        return new ModelRequest(systemPrompt, userPrompt, null, null);
    }
}
