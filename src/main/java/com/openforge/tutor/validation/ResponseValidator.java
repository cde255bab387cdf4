package com.openforge.tutor.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.tutor.agent.AgentNames;
import com.openforge.tutor.agent.AgentRegistry;
import com.openforge.tutor.domain.Agent;
import com.openforge.tutor.domain.Lesson;
import com.openforge.tutor.llm.LlmRouter;
import com.openforge.tutor.llm.model.ChatRequest;
import com.openforge.tutor.llm.model.Message;
import com.openforge.tutor.profile.LearnerProfile;
import com.openforge.tutor.response.TeachingResponse;
import com.openforge.tutor.response.TeachingResponseParser;
import com.openforge.tutor.teaching.TeachingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Second-opinion quality check of a specialist reply, run off the critical
 * path.
 *
 * Fail-open: on timeout, provider error or unreadable verdict the reply is
 * approved with {@link ValidationResult#failOpen()}.  A timed-out call is
 * abandoned, not cancelled; whatever it returns later is discarded.
 */
@Slf4j
@Service
public class ResponseValidator {

    private final AgentRegistry      agentRegistry;
    private final LlmRouter          llmRouter;
    private final ObjectMapper       objectMapper;
    private final ExecutorService    executor;
    private final TeachingProperties properties;

    public ResponseValidator(AgentRegistry agentRegistry,
                             LlmRouter llmRouter,
                             ObjectMapper objectMapper,
                             ExecutorService tutorTaskExecutor,
                             TeachingProperties properties) {
        this.agentRegistry = agentRegistry;
        this.llmRouter     = llmRouter;
        this.objectMapper  = objectMapper;
        this.executor      = tutorTaskExecutor;
        this.properties    = properties;
    }

    /**
     * Starts validation and returns immediately.  The future never completes
     * exceptionally and always completes within the configured timeout.
     */
    public CompletableFuture<ValidationResult> validateAsync(TeachingResponse response,
                                                            LearnerProfile profile,
                                                            Lesson lesson) {
        CompletableFuture<ValidationResult> call;
        try {
            call = CompletableFuture.supplyAsync(() -> validate(response, profile, lesson), executor);
        } catch (RuntimeException e) {
            log.warn("[Validator] Could not schedule validation: {}", e.getMessage());
            return CompletableFuture.completedFuture(ValidationResult.failOpen());
        }
        return call
                .orTimeout(properties.validationTimeoutSeconds(), TimeUnit.SECONDS)
                .exceptionally(e -> {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    if (cause instanceof TimeoutException) {
                        log.warn("[Validator] Timed out after {}s for {} - auto-approving",
                                properties.validationTimeoutSeconds(), response.agentName());
                    } else {
                        log.warn("[Validator] Validation failed for {} - auto-approving. Cause: {}",
                                response.agentName(), cause.getMessage());
                    }
                    return ValidationResult.failOpen();
                });
    }

    /** Blocking validation; same fail-open policy minus the timeout. */
    ValidationResult validate(TeachingResponse response, LearnerProfile profile, Lesson lesson) {
        try {
            Agent validator = agentRegistry.get(AgentNames.VALIDATOR);
            ChatRequest request = ChatRequest.json(validator.getModel(), List.of(
                    Message.system(validator.getSystemPrompt()),
                    Message.user(buildPrompt(response, profile, lesson))));

            String raw = llmRouter.chat(request).text();
            if (raw == null || raw.isBlank()) {
                throw new IllegalStateException("No response from validator");
            }
            ValidationResult result = objectMapper.readValue(
                    TeachingResponseParser.stripMarkdownJson(raw), ValidationResult.class);

            log.info("[Validator] {} response {} (confidence {})",
                    response.agentName(), result.approved() ? "approved" : "REJECTED", result.confidenceScore());
            return result;
        } catch (Exception e) {
            log.warn("[Validator] Validation failed for {} - auto-approving. Cause: {}",
                    response.agentName(), e.getMessage());
            return ValidationResult.failOpen();
        }
    }

    static String buildPrompt(TeachingResponse response, LearnerProfile profile, Lesson lesson) {
        StringBuilder sb = new StringBuilder();
        sb.append("VALIDATE THE FOLLOWING TEACHING RESPONSE:\n\n");
        sb.append("CONTEXT:\n");
        sb.append("- Student Grade: ").append(profile.gradeLevel()).append('\n');
        sb.append("- Student Age: ").append(profile.age()).append(" years old\n");
        if (lesson != null) {
            sb.append("- Lesson: ").append(lesson.getTitle()).append(" (").append(lesson.getSubject()).append(")\n");
            sb.append("- Learning Objective: ").append(lesson.getLearningObjective()).append('\n');
        }
        sb.append("- Specialist: ").append(response.agentName()).append("\n\n");

        sb.append("RESPONSE TO VALIDATE:\n");
        sb.append("Audio Text (for TTS):\n").append(response.audioText()).append("\n\n");
        sb.append("Display Text (for screen):\n").append(response.displayText()).append("\n\n");
        sb.append(response.hasSvg() ? "SVG Diagram:\n" + response.svg() : "SVG: None").append("\n\n");
        sb.append("---\n\n");

        sb.append("""
                YOUR TASK:
                Run all 5 validation checks from your system prompt:
                1. Factual Consistency
                2. Curriculum Alignment
                3. Internal Consistency
                4. Pedagogical Soundness
                5. Visual-Text Alignment (if SVG present)

                Respond in JSON format with your validation decision.""");
        return sb.toString();
    }
}
