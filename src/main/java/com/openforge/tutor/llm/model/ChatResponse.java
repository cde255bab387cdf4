package com.openforge.tutor.llm.model;

import java.util.List;

/**
 * Top-level response from /chat/completions.
 */
public record ChatResponse(
        String id,
        String object,
        Long created,
        String model,
        List<Choice> choices,
        Usage usage
) {

    /** Convenience: first choice message (always present for non-streaming responses). */
    public Message firstMessage() {
        if (choices == null || choices.isEmpty()) {
            throw new IllegalStateException("LLM returned no choices in response: " + id);
        }
        return choices.get(0).message();
    }

    /** Text of the first choice, or null when the model returned nothing. */
    public String text() {
        Message message = firstMessage();
        return message == null ? null : message.textContent();
    }

    public record Choice(
            int index,
            Message message,
            String finishReason
    ) {}

    public record Usage(
            int promptTokens,
            int completionTokens,
            int totalTokens
    ) {}
}
