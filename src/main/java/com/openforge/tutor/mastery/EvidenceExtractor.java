package com.openforge.tutor.mastery;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.tutor.domain.EvidenceType;
import com.openforge.tutor.llm.LlmRouter;
import com.openforge.tutor.llm.model.ChatRequest;
import com.openforge.tutor.llm.model.Message;
import com.openforge.tutor.response.TeachingResponseParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Classifies a student's message into a piece of learning evidence with an
 * LLM.  Semantic classification replaces keyword matching on the teacher's
 * reply.
 *
 * Never throws: a failed call yields a low-confidence "explanation" that the
 * recording threshold filters out.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EvidenceExtractor {

    private static final String PROMPT_TEMPLATE = """
            You are analyzing a student's learning evidence during a lesson.

            CONCEPT BEING TAUGHT: %s

            STUDENT RESPONSE: "%s"

            TEACHER RESPONSE: "%s"

            Analyze the student's response and classify the evidence:

            EVIDENCE TYPES:
            - correct_answer: Student answered correctly
            - incorrect_answer: Student answered incorrectly
            - explanation: Student explained a concept (assess quality)
            - application: Student applied knowledge to solve a problem
            - struggle: Student showed confusion or asked for help

            QUALITY SCORE (0-100):
            - For correct_answer: 100 if fully correct, 80 if mostly correct
            - For explanation: Rate clarity, completeness, understanding (0-100)
            - For application: Rate success in applying concept (0-100)
            - For incorrect_answer: 0-30 (closer to correct = higher)
            - For struggle: 0 (indicates need for support)

            CONFIDENCE (0-1): How certain are you of this classification?

            Return JSON with: evidenceType, qualityScore, confidence, reasoning
            """;

    private final LlmRouter    llmRouter;
    private final ObjectMapper objectMapper;

    public record EvidenceQuality(
            @JsonProperty("evidenceType") String evidenceType,
            @JsonProperty("qualityScore") int qualityScore,
            @JsonProperty("confidence")   double confidence,
            @JsonProperty("reasoning")    String reasoning
    ) {
        public EvidenceType type() {
            return EvidenceType.fromWire(evidenceType);
        }

        static EvidenceQuality fallback(String reason) {
            return new EvidenceQuality(EvidenceType.EXPLANATION.wire(), 50, 0.3,
                    "Evidence extraction failed: " + reason);
        }
    }

    public EvidenceQuality extract(String studentResponse, String teacherResponse, String concept) {
        String prompt = PROMPT_TEMPLATE.formatted(concept, studentResponse, teacherResponse);
        try {
            String raw = llmRouter.chat(ChatRequest.json(null, List.of(Message.user(prompt)))).text();
            if (raw == null || raw.isBlank()) {
                return EvidenceQuality.fallback("empty response");
            }
            EvidenceQuality quality = objectMapper.readValue(
                    TeachingResponseParser.stripMarkdownJson(raw), EvidenceQuality.class);
            quality.type(); // rejects unknown evidence types
            log.debug("[Evidence] Classified '{}' as {} (quality={}, confidence={})",
                    preview(studentResponse), quality.evidenceType(), quality.qualityScore(), quality.confidence());
            return quality;
        } catch (Exception e) {
            log.warn("[Evidence] Extraction failed: {}", e.getMessage());
            return EvidenceQuality.fallback(e.getMessage());
        }
    }

    private static String preview(String s) {
        return s == null || s.length() <= 50 ? s : s.substring(0, 50) + "...";
    }
}
