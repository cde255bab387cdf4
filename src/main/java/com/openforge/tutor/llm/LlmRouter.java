package com.openforge.tutor.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.tutor.llm.model.ChatRequest;
import com.openforge.tutor.llm.model.ChatResponse;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * High-availability LLM request router.
 *
 * Call graph (both chat and streamChat):
 *
 *   chat(primaryRequest, fallbackRequest)
 *     └─ primaryCircuitBreaker + primaryRetry
 *           └─ primaryLlmClient.{chat|streamChat}(primaryRequest)
 *                 ↓ (on CallNotPermittedException or any exception)
 *     └─ fallbackCircuitBreaker + fallbackRetry
 *           └─ fallbackLlmClient.{chat|streamChat}(fallbackRequest)
 *
 * The primary request keeps its own model id (agents pick their model);
 * the fallback request is always re-pointed at the fallback provider's
 * model and stripped of provider extensions such as cached-content handles.
 * Callers that rely on a cached instruction set pass an explicit fallback
 * request carrying the full system prompt instead.
 *
 * Streaming note:
 *   If the primary stream drops mid-way, the fragment callback may already
 *   have seen partial content.  The fallback replays from scratch, so
 *   callback owners must tolerate a replayed stream (ResponseGenerator drops
 *   progressive audio when the streamed text diverges from the final reply).
 */
@Slf4j
@Component
public class LlmRouter {

    private final LlmClient      primaryClient;
    private final LlmClient      fallbackClient;
    private final CircuitBreaker primaryCb;
    private final CircuitBreaker fallbackCb;
    private final Retry          primaryRetry;
    private final Retry          fallbackRetry;

    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     CircuitBreaker primaryLlmCircuitBreaker,
                     CircuitBreaker fallbackLlmCircuitBreaker,
                     Retry primaryLlmRetry,
                     Retry fallbackLlmRetry) {
        this(new LlmClient(httpClient, objectMapper, properties.primary()),
             new LlmClient(httpClient, objectMapper, properties.fallback()),
             primaryLlmCircuitBreaker, fallbackLlmCircuitBreaker,
             primaryLlmRetry, fallbackLlmRetry);
    }

    LlmRouter(LlmClient primaryClient,
              LlmClient fallbackClient,
              CircuitBreaker primaryCb,
              CircuitBreaker fallbackCb,
              Retry primaryRetry,
              Retry fallbackRetry) {
        this.primaryClient  = primaryClient;
        this.fallbackClient = fallbackClient;
        this.primaryCb      = primaryCb;
        this.fallbackCb     = fallbackCb;
        this.primaryRetry   = primaryRetry;
        this.fallbackRetry  = fallbackRetry;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public ChatResponse chat(ChatRequest request) {
        return chat(request, request);
    }

    /**
     * Route a chat request through primary → fallback with full resilience.
     */
    public ChatResponse chat(ChatRequest primaryRequest, ChatRequest fallbackRequest) {
        try {
            ChatRequest effective = forPrimary(primaryRequest);
            return executeWithResilience(primaryCb, primaryRetry,
                    () -> primaryClient.chat(effective), "primary");
        } catch (Exception primaryException) {
            log.warn("[LlmRouter] Primary provider failed ({}), engaging fallback. Cause: {}",
                    primaryException.getClass().getSimpleName(), primaryException.getMessage());

            ChatRequest effective = forFallback(fallbackRequest);
            return executeWithResilience(fallbackCb, fallbackRetry,
                    () -> fallbackClient.chat(effective), "fallback");
        }
    }

    public ChatResponse streamChat(ChatRequest request, Consumer<String> fragmentCallback) {
        return streamChat(request, request, fragmentCallback);
    }

    /**
     * Streaming variant of {@link #chat(ChatRequest, ChatRequest)}: identical
     * resilience wrapping, delegating to {@link LlmClient#streamChat}.
     */
    public ChatResponse streamChat(ChatRequest primaryRequest,
                                   ChatRequest fallbackRequest,
                                   Consumer<String> fragmentCallback) {
        try {
            ChatRequest effective = forPrimary(primaryRequest);
            return executeWithResilience(primaryCb, primaryRetry,
                    () -> primaryClient.streamChat(effective, fragmentCallback), "primary");
        } catch (Exception primaryException) {
            log.warn("[LlmRouter] Primary stream failed ({}), engaging fallback. Cause: {}",
                    primaryException.getClass().getSimpleName(), primaryException.getMessage());

            ChatRequest effective = forFallback(fallbackRequest);
            return executeWithResilience(fallbackCb, fallbackRetry,
                    () -> fallbackClient.streamChat(effective, fragmentCallback), "fallback");
        }
    }

    /** Default model of the primary provider, used when an agent row names none. */
    public String primaryModel() {
        return primaryClient.modelName();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /**
     * Decorates a supplier with circuit-breaker + retry, then executes it.
     * Fully programmatic, without AOP proxies or annotations.
     */
    private ChatResponse executeWithResilience(CircuitBreaker cb,
                                               Retry retry,
                                               Supplier<ChatResponse> call,
                                               String label) {
        Supplier<ChatResponse> decorated =
                CircuitBreaker.decorateSupplier(cb,
                        Retry.decorateSupplier(retry, call));
        try {
            return decorated.get();
        } catch (Exception e) {
            throw new LlmClient.LlmException(
                    "[LlmRouter] %s provider ultimately failed: %s".formatted(label, e.getMessage()), e);
        }
    }

    private ChatRequest forPrimary(ChatRequest request) {
        if (request.model() != null && !request.model().isBlank()) {
            return request;
        }
        return request.toBuilder().model(primaryClient.modelName()).build();
    }

    private ChatRequest forFallback(ChatRequest request) {
        return request.toBuilder()
                .model(fallbackClient.modelName())
                .extraBody(null)
                .build();
    }
}
