package com.openforge.tutor.agent;

import com.openforge.tutor.cache.ContextCacheManager;
import com.openforge.tutor.context.AgentContext;
import com.openforge.tutor.domain.Agent;
import com.openforge.tutor.llm.LlmRouter;
import com.openforge.tutor.llm.model.ChatRequest;
import com.openforge.tutor.llm.model.ChatResponse;
import com.openforge.tutor.response.ParseResult;
import com.openforge.tutor.response.TeachingResponse;
import com.openforge.tutor.response.TeachingResponseParser;
import com.openforge.tutor.speech.ProgressiveSynthesisPipeline;
import com.openforge.tutor.speech.SpeechService;
import com.openforge.tutor.speech.SynthesisOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Facade over the teaching model.
 *
 *   generate()   blocking call, parse, normalise
 *   generateStreaming()   streamed call buffered to completion, then parsed
 *   generateProgressive()   streamed call whose fragments also feed a
 *                            {@link ProgressiveSynthesisPipeline}
 *
 * Every variant uses the model group's cached instruction set when one is
 * fresh and otherwise sends the agent's system prompt.  The fallback
 * provider always gets the uncached form.
 */
@Slf4j
@Service
public class ResponseGenerator {

    private final AgentRegistry          agentRegistry;
    private final ContextCacheManager    cacheManager;
    private final LlmRouter              llmRouter;
    private final PromptBuilder          promptBuilder;
    private final TeachingResponseParser parser;
    private final SpeechService          speechService;
    private final Clock                  clock;

    public ResponseGenerator(AgentRegistry agentRegistry,
                             ContextCacheManager cacheManager,
                             LlmRouter llmRouter,
                             PromptBuilder promptBuilder,
                             TeachingResponseParser parser,
                             SpeechService speechService,
                             Clock clock) {
        this.agentRegistry = agentRegistry;
        this.cacheManager  = cacheManager;
        this.llmRouter     = llmRouter;
        this.promptBuilder = promptBuilder;
        this.parser        = parser;
        this.speechService = speechService;
        this.clock         = clock;
    }

    // ── Variants ─────────────────────────────────────────────────────────────

    public AgentResponse generate(String agentName, AgentContext context) {
        long start = clock.millis();
        Agent agent = agentRegistry.get(agentName);
        Requests requests = requests(agent, context);

        ChatResponse response = llmRouter.chat(requests.primary(), requests.fallback());
        TeachingResponse parsed = parse(agent, response.text());
        return new AgentResponse(parsed, AgentResponse.Tier.SYNC, null, clock.millis() - start);
    }

    public AgentResponse generateStreaming(String agentName, AgentContext context) {
        long start = clock.millis();
        Agent agent = agentRegistry.get(agentName);
        Requests requests = requests(agent, context);

        ChatResponse response = llmRouter.streamChat(requests.primary(), requests.fallback(), fragment -> {});
        TeachingResponse parsed = parse(agent, response.text());
        return new AgentResponse(parsed, AgentResponse.Tier.STREAMING, null, clock.millis() - start);
    }

    /**
     * Streams the reply while synthesising speech sentence by sentence.  If the
     * stream was replayed by the fallback provider, the partial audio no longer
     * matches the reply and is dropped; the outcome then asks for full-text
     * synthesis.
     */
    public AgentResponse generateProgressive(String agentName, AgentContext context) {
        long start = clock.millis();
        Agent agent = agentRegistry.get(agentName);
        Requests requests = requests(agent, context);
        ProgressiveSynthesisPipeline pipeline = speechService.newPipeline(agent.getName());

        ChatResponse response;
        try {
            response = llmRouter.streamChat(requests.primary(), requests.fallback(), pipeline);
        } catch (RuntimeException e) {
            pipeline.abandon();
            throw e;
        }

        String text = response.text();
        TeachingResponse parsed;
        try {
            parsed = parse(agent, text);
        } catch (RuntimeException e) {
            pipeline.abandon();
            throw e;
        }

        SynthesisOutcome outcome;
        if (!pipeline.streamedText().equals(text)) {
            log.warn("[Generator] Stream for {} was replayed, discarding progressive audio", agent.getName());
            outcome = pipeline.abandon();
        } else {
            outcome = pipeline.finish(parsed.audioText());
        }
        return new AgentResponse(parsed, AgentResponse.Tier.PROGRESSIVE, outcome, clock.millis() - start);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private record Requests(ChatRequest primary, ChatRequest fallback) {}

    private Requests requests(Agent agent, AgentContext context) {
        String handle = cacheManager.ensureFresh(agent.getModel());
        ChatRequest uncached = ChatRequest.json(agent.getModel(), promptBuilder.messages(agent, context, false));
        if (handle == null) {
            log.debug("[Generator] No cached instructions for {}, sending full system prompt", agent.getModel());
            return new Requests(uncached, uncached);
        }
        ChatRequest cached = ChatRequest.json(agent.getModel(), promptBuilder.messages(agent, context, true))
                .withCachedContent(handle);
        return new Requests(cached, uncached);
    }

    private TeachingResponse parse(Agent agent, String text) {
        if (text == null || text.isBlank()) {
            throw new GenerationException("No response from " + agent.getName());
        }
        ParseResult<TeachingResponse> result = parser.parse(text, agent.getName());
        if (!result.isOk()) {
            throw new GenerationException("Invalid JSON response from %s: %s".formatted(agent.getName(), result.error()));
        }
        log.debug("[Generator] {} replied via {} parse", agent.getName(), result.strategy());
        return result.value();
    }

    public static class GenerationException extends RuntimeException {
        public GenerationException(String message) { super(message); }
    }
}
