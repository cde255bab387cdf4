package com.openforge.tutor.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A single entry in the LLM conversation.
 *
 * role variants:
 *   "system"   agent instructions (only when no cached instruction set is used)
 *   "user"   the assembled turn context plus the student's input
 *   "assistant"   model reply
 *
 * content is either a plain String or a List of {@link ContentPart} when
 * inline audio or images ride along with the text.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        String role,
        Object content
) {

    // ── Static factory helpers ──────────────────────────────────────────────

    public static Message system(String content) {
        return Message.builder().role("system").content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role("user").content(content).build();
    }

    public static Message user(List<ContentPart> parts) {
        return Message.builder().role("user").content(parts).build();
    }

    public static Message assistantText(String content) {
        return Message.builder().role("assistant").content(content).build();
    }

    /** Text view of the content, joining text parts of a multi-part message. */
    public String textContent() {
        if (content == null) return null;
        if (content instanceof String s) return s;
        if (content instanceof List<?> parts) {
            return parts.stream()
                    .filter(ContentPart.class::isInstance)
                    .map(ContentPart.class::cast)
                    .filter(p -> "text".equals(p.type()))
                    .map(ContentPart::text)
                    .collect(Collectors.joining("\n"));
        }
        return content.toString();
    }
}
