package com.openforge.tutor.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.tutor.llm.model.ChatRequest;
import com.openforge.tutor.llm.model.ChatResponse;
import com.openforge.tutor.llm.model.Message;
import com.openforge.tutor.llm.model.StreamingChunk;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Stateless client for one OpenAI-compatible /chat/completions provider.
 *
 * Two modes of operation:
 *
 *  chat()   synchronous, waits for the full response.
 *                  Used for routing, validation, evidence classification
 *                  and the last-resort teaching tier.
 *
 *  streamChat()   streaming SSE, calls fragmentCallback per content delta.
 *                  Used by the streaming and progressive teaching tiers so
 *                  sentence extraction can start before the reply is complete.
 *                  Returns the fully assembled ChatResponse when the stream ends.
 *
 * Both methods block the calling thread; callers that need concurrency run
 * them on the shared task executor.
 */
@Slf4j
public class LlmClient {

    private static final String SSE_DATA_PREFIX = "data: ";
    private static final String SSE_DONE        = "data: [DONE]";

    private final HttpClient   httpClient;
    private final ObjectMapper objectMapper;
    private final LlmProperties.ProviderConfig config;

    public LlmClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties.ProviderConfig config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Blocking (non-streaming) chat completion.
     */
    public ChatResponse chat(ChatRequest request) {
        String requestBody = serialize(withDefaultModel(request), false);
        log.debug("[LlmClient:{}] → chat POST body-length={}", config.name(), requestBody.length());

        HttpResponse<String> httpResponse = sendBlocking(
                buildHttpRequest(requestBody, false));

        return parseFullResponse(httpResponse);
    }

    /**
     * Streaming chat completion via SSE.
     *
     * For every non-empty content delta, {@code fragmentCallback} is invoked
     * synchronously on the calling thread.  A callback that blocks (for
     * instance on a full synthesis permit pool) applies back-pressure to the
     * read loop, which is intended.
     *
     * @param request          ChatRequest (stream flag is forced to true internally)
     * @param fragmentCallback invoked with each non-empty content fragment
     * @return assembled ChatResponse with the complete message
     */
    public ChatResponse streamChat(ChatRequest request, Consumer<String> fragmentCallback) {
        if (request == null) {
            throw new LlmException("ChatRequest must not be null for provider [%s]"
                    .formatted(config.name()));
        }

        String requestBody = serialize(withDefaultModel(request), true);
        log.debug("[LlmClient:{}] → streamChat POST body-length={}", config.name(), requestBody.length());

        HttpResponse<Stream<String>> httpResponse;
        try {
            httpResponse = httpClient.send(
                    buildHttpRequest(requestBody, true),
                    HttpResponse.BodyHandlers.ofLines());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted while opening stream to provider [%s]"
                    .formatted(config.name()), e);
        } catch (IOException e) {
            throw new LlmException("Network error (streaming) calling provider [%s]"
                    .formatted(config.name()), e);
        }

        int status = httpResponse.statusCode();
        if (status == 429) {
            throw new LlmRateLimitException(
                    "Rate-limited by provider [%s].".formatted(config.name()));
        }
        if (status < 200 || status >= 300) {
            String bodySnippet = "";
            try (Stream<String> lines = httpResponse.body()) {
                if (lines != null) {
                    bodySnippet = lines.limit(20).reduce(
                            new StringBuilder(),
                            (sb, line) -> {
                                if (sb.length() > 0) sb.append('\n');
                                if (sb.length() < 2048) {
                                    sb.append(line);
                                }
                                return sb;
                            },
                            StringBuilder::append
                    ).toString();
                }
            }
            throw new LlmException(
                    "Provider [%s] returned HTTP %d on stream open: %s"
                            .formatted(config.name(), status, bodySnippet));
        }

        try (Stream<String> lines = httpResponse.body()) {
            return assembleStreamingResponse(lines, fragmentCallback);
        }
    }

    /** The model name configured for this provider. */
    public String modelName() {
        return config.model();
    }

    public String providerName() {
        return config.name();
    }

    // ── Streaming assembly ───────────────────────────────────────────────────

    /**
     * Reads the SSE line stream, calls fragmentCallback for content deltas,
     * and assembles a ChatResponse that mirrors the non-streaming format.
     */
    private ChatResponse assembleStreamingResponse(Stream<String> lines,
                                                   Consumer<String> fragmentCallback) {
        StringBuilder contentBuilder = new StringBuilder();
        String responseId    = null;
        String responseModel = null;
        String finishReason  = null;

        for (String line : (Iterable<String>) lines::iterator) {
            if (line.isEmpty() || !line.startsWith(SSE_DATA_PREFIX)) continue;
            if (SSE_DONE.equals(line)) break;

            String json = line.substring(SSE_DATA_PREFIX.length());
            StreamingChunk chunk;
            try {
                chunk = objectMapper.readValue(json, StreamingChunk.class);
            } catch (JsonProcessingException e) {
                log.warn("[LlmClient:{}] Failed to parse SSE chunk: {}", config.name(), json);
                continue;
            }

            if (responseId == null)    responseId    = chunk.id();
            if (responseModel == null) responseModel = chunk.model();

            if (chunk.choices() == null || chunk.choices().isEmpty()) continue;

            StreamingChunk.ChunkChoice choice = chunk.choices().get(0);
            if (choice.finishReason() != null) finishReason = choice.finishReason();

            StreamingChunk.DeltaMessage delta = choice.delta();
            if (delta == null) continue;

            if (delta.content() != null && !delta.content().isEmpty()) {
                contentBuilder.append(delta.content());
                fragmentCallback.accept(delta.content());
            }
        }

        Message assistantMessage = Message.assistantText(
                contentBuilder.isEmpty() ? null : contentBuilder.toString());

        ChatResponse.Choice choice = new ChatResponse.Choice(0, assistantMessage, finishReason);
        return new ChatResponse(responseId, "chat.completion", null,
                responseModel, List.of(choice), null);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /** Upstream callers may leave the model empty; the provider default applies. */
    private ChatRequest withDefaultModel(ChatRequest request) {
        if (request.model() != null && !request.model().isBlank()) {
            return request;
        }
        return request.toBuilder().model(config.model()).build();
    }

    private HttpRequest buildHttpRequest(String body, boolean streaming) {
        return HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .timeout(Duration.ofSeconds(streaming ? config.timeoutSeconds() * 2L : config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private HttpResponse<String> sendBlocking(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted calling provider [%s]".formatted(config.name()), e);
        } catch (IOException e) {
            throw new LlmException("Network error calling provider [%s]".formatted(config.name()), e);
        }
    }

    private ChatResponse parseFullResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[LlmClient:{}] ← HTTP {} body-length={}", config.name(), status,
                body == null ? 0 : body.length());

        if (status == 429) throw new LlmRateLimitException(
                "Rate-limited by provider [%s].".formatted(config.name()));
        if (status < 200 || status >= 300) throw new LlmException(
                "Provider [%s] returned HTTP %d: %s".formatted(config.name(), status, body));

        try {
            return objectMapper.readValue(body, ChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new LlmException(
                    "Failed to parse response from provider [%s]: %s".formatted(config.name(), body), e);
        }
    }

    /** Serializes a ChatRequest, injecting "stream": true for SSE calls. */
    private String serialize(ChatRequest request, boolean stream) {
        try {
            ObjectNode node = objectMapper.valueToTree(request);
            if (stream) {
                node.put("stream", true);
            }
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new LlmException("Failed to serialize request", e);
        }
    }

    // ── Exception types ──────────────────────────────────────────────────────

    public static class LlmException extends RuntimeException {
        public LlmException(String message) { super(message); }
        public LlmException(String message, Throwable cause) { super(message, cause); }
    }

    public static class LlmRateLimitException extends LlmException {
        public LlmRateLimitException(String message) { super(message); }
    }
}
