package com.openforge.tutor.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * The request body sent to an OpenAI-compatible /chat/completions endpoint.
 *
 * responseFormat   {"type":"json_object"} for structured replies.
 * extraBody   provider extension block, serialized as "extra_body".
 *                  Gemini reads {"google":{"cached_content":"cachedContents/…"}}
 *                  from it; other providers never receive it (see LlmRouter).
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        Double temperature,
        Integer maxTokens,
        Map<String, Object> responseFormat,
        Map<String, Object> extraBody
) {

    public static final Map<String, Object> JSON_OBJECT = Map.of("type", "json_object");

    public static ChatRequest simple(String model, List<Message> messages) {
        return ChatRequest.builder()
                .model(model)
                .messages(messages)
                .temperature(0.7)
                .maxTokens(4096)
                .build();
    }

    public static ChatRequest json(String model, List<Message> messages) {
        return ChatRequest.builder()
                .model(model)
                .messages(messages)
                .temperature(0.4)
                .maxTokens(4096)
                .responseFormat(JSON_OBJECT)
                .build();
    }

    /** Attaches a Gemini cached-content handle. */
    public ChatRequest withCachedContent(String cacheName) {
        if (cacheName == null) return this;
        return toBuilder()
                .extraBody(Map.of("google", Map.of("cached_content", cacheName)))
                .build();
    }
}
