package com.openforge.tutor.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Represents one SSE data frame from a streaming /chat/completions response.
 *
 * Wire format (one line from the SSE stream):
 *   data: {"id":"chatcmpl-xxx","object":"chat.completion.chunk",
 *           "choices":[{"index":0,"delta":{"content":"{\"audio"},"finish_reason":null}]}
 *
 * Last frame:
 *   data: [DONE]
 *
 * With JSON response format the content deltas are fragments of one JSON
 * object; nothing guarantees a fragment ends on a token or string boundary.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamingChunk(
        String id,
        String object,
        Long created,
        String model,
        List<ChunkChoice> choices
) {

    public record ChunkChoice(
            int index,
            DeltaMessage delta,
            String finishReason
    ) {}

    public record DeltaMessage(
            String role,
            String content
    ) {}
}
