package com.openforge.tutor.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.tutor.domain.PendingCorrection;
import com.openforge.tutor.domain.PendingCorrection.CorrectionStatus;
import com.openforge.tutor.domain.ValidationFailure;
import com.openforge.tutor.repository.PendingCorrectionRepository;
import com.openforge.tutor.repository.ValidationFailureRepository;
import com.openforge.tutor.response.TeachingResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Deferred self-correction queue.
 *
 * A rejected reply becomes a PENDING correction for its session.  The next
 * turn picks up the oldest one, asks the responder to acknowledge the error,
 * and afterwards marks it DELIVERED.  PENDING → DELIVERED is the only
 * transition and it is a conditional update, so two concurrent turns can
 * never both deliver the same row.  Rows are kept as an audit trail.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorrectionService {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final int QUOTE_LENGTH = 300;

    private final PendingCorrectionRepository correctionRepository;
    private final ValidationFailureRepository failureRepository;
    private final ObjectMapper                objectMapper;
    private final Clock                       clock;

    // ── Write side ───────────────────────────────────────────────────────────

    /**
     * Queues a correction for a rejected reply and writes the audit row.
     */
    @Transactional
    public PendingCorrection recordRejection(String sessionId,
                                             String specialistName,
                                             TeachingResponse original,
                                             ValidationResult result) {
        List<String> fixes = result.requiredFixes() == null ? List.of() : result.requiredFixes();

        PendingCorrection correction = correctionRepository.save(PendingCorrection.builder()
                .sessionId(sessionId)
                .specialistName(specialistName)
                .originalResponse(toJson(snapshot(original)))
                .validationIssues(toJson(result.issues()))
                .requiredFixes(toJson(fixes))
                .build());

        failureRepository.save(ValidationFailure.builder()
                .sessionId(sessionId)
                .agentName(specialistName)
                .originalResponse(toJson(snapshot(original)))
                .validationIssues(toJson(result.issues()))
                .requiredFixes(toJson(fixes))
                .confidenceScore(result.confidenceScore())
                .retryCount(0)
                .finalAction("failed_validation")
                .build());

        log.info("[Corrections] Stored correction {} for {} in session {}",
                correction.getId(), specialistName, sessionId);
        return correction;
    }

    // ── Read side ────────────────────────────────────────────────────────────

    /** Oldest correction still waiting for delivery, if any. */
    @Transactional(readOnly = true)
    public Optional<PendingCorrection> nextPending(String sessionId) {
        return correctionRepository.findFirstBySessionIdAndStatusOrderByCreateTimeAscIdAsc(
                sessionId, CorrectionStatus.PENDING);
    }

    @Transactional(readOnly = true)
    public long pendingCount(String sessionId) {
        return correctionRepository.countBySessionIdAndStatus(sessionId, CorrectionStatus.PENDING);
    }

    /**
     * Moves the correction to DELIVERED.
     *
     * @return true if this call performed the transition, false if it had
     *         already been delivered
     */
    @Transactional
    public boolean markDelivered(Long correctionId) {
        int updated = correctionRepository.transition(
                correctionId, CorrectionStatus.PENDING, CorrectionStatus.DELIVERED, clock.instant());
        if (updated == 1) {
            log.info("[Corrections] Marked correction {} as delivered", correctionId);
            return true;
        }
        log.warn("[Corrections] Correction {} was already delivered", correctionId);
        return false;
    }

    // ── Prompt block ─────────────────────────────────────────────────────────

    /**
     * Instruction block that makes the responder acknowledge and fix the
     * earlier mistake before answering the new question.
     */
    public String correctionBlock(PendingCorrection correction) {
        String displayText = String.valueOf(readSnapshot(correction.getOriginalResponse())
                .getOrDefault("displayText", ""));
        String quoted = displayText.length() > QUOTE_LENGTH ? displayText.substring(0, QUOTE_LENGTH) : displayText;

        List<String> lines = new ArrayList<>();
        lines.add("[SELF-CORRECTION REQUIRED]");
        lines.add("In your previous response, you made an error that needs to be corrected.");
        lines.add("");
        lines.add("Your incorrect statement: \"" + quoted + "\"");
        lines.add("");
        lines.add("Issues found:");
        readList(correction.getValidationIssues()).forEach(issue -> lines.add("- " + issue));

        List<String> fixes = readList(correction.getRequiredFixes());
        if (!fixes.isEmpty()) {
            lines.add("");
            lines.add("Required fixes:");
            fixes.forEach(fix -> lines.add("- " + fix));
        }

        lines.add("");
        lines.add("IMPORTANT: Before answering the student's current question, briefly and naturally acknowledge your earlier mistake.");
        lines.add("Say something like \"Before we continue, I want to correct something I said earlier...\" then provide the correct information.");
        lines.add("Keep the correction concise and age-appropriate, then seamlessly continue with the student's current question.");
        lines.add("[END SELF-CORRECTION]");
        return String.join("\n", lines) + "\n";
    }

    // ── JSON helpers ─────────────────────────────────────────────────────────

    private static Map<String, Object> snapshot(TeachingResponse response) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("audioText", response.audioText());
        snapshot.put("displayText", response.displayText());
        snapshot.put("svg", response.svg());
        return snapshot;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize correction payload", e);
        }
    }

    private Map<String, Object> readSnapshot(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (Exception e) {
            log.warn("[Corrections] Unreadable response snapshot: {}", e.getMessage());
            return Map.of();
        }
    }

    private List<String> readList(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (Exception e) {
            log.warn("[Corrections] Unreadable list column: {}", e.getMessage());
            return List.of();
        }
    }
}
