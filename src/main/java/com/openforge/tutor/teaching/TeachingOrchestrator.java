package com.openforge.tutor.teaching;

import com.openforge.tutor.adaptive.AdaptationLogger;
import com.openforge.tutor.adaptive.AdaptiveDirectiveGenerator;
import com.openforge.tutor.adaptive.AdaptiveDirectives;
import com.openforge.tutor.agent.AgentNames;
import com.openforge.tutor.agent.AgentRegistry;
import com.openforge.tutor.agent.AgentResponse;
import com.openforge.tutor.agent.ResponseGenerator;
import com.openforge.tutor.context.AgentContext;
import com.openforge.tutor.context.ContextAssembler;
import com.openforge.tutor.context.TeachingContext;
import com.openforge.tutor.domain.EvidenceRecord;
import com.openforge.tutor.domain.Interaction;
import com.openforge.tutor.domain.Lesson;
import com.openforge.tutor.domain.TutoringSession;
import com.openforge.tutor.mastery.EvidenceExtractor;
import com.openforge.tutor.mastery.EvidenceExtractor.EvidenceQuality;
import com.openforge.tutor.mastery.MasteryCalculator;
import com.openforge.tutor.mastery.MasteryDetector;
import com.openforge.tutor.mastery.MasteryResult;
import com.openforge.tutor.profile.ProfileEnricher;
import com.openforge.tutor.repository.InteractionRepository;
import com.openforge.tutor.repository.TutoringSessionRepository;
import com.openforge.tutor.response.TeachingResponse;
import com.openforge.tutor.routing.ResponderRouter;
import com.openforge.tutor.routing.RoutingDecision;
import com.openforge.tutor.speech.SpeechService;
import com.openforge.tutor.task.BackgroundTasks;
import com.openforge.tutor.validation.CorrectionService;
import com.openforge.tutor.validation.ResponseValidator;
import com.openforge.tutor.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runs one tutoring turn end to end.
 *
 * <pre>
 *   load context (parallel) ─► directives ─► route
 *     ├─ coordinator answered directly ─► speak it
 *     └─ responder: progressive ─► streaming ─► sync
 *          ─► handoff chain (capped) ─► mastery check on "lesson complete"
 *   ─► mark injected correction delivered
 *   ─► audio (progressive result, else full-text synthesis)
 *   ─► validator (async, fail-open) ─► correction queue on rejection
 *   ─► background: interaction log, adaptation log, evidence, profile enrichment
 * </pre>
 *
 * Only a missing lesson/profile or a reply that no tier could produce fails
 * the turn.  Everything after the reply exists is best effort.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TeachingOrchestrator {

    static final String ASSESSMENT_HANDOFF_MESSAGE =
            "Great work! You've mastered this lesson. Let's test your understanding.";
    static final String ASSESSMENT_REASON = "Lesson complete - automated assessment";
    static final String APOLOGY = "I'm sorry, I had trouble answering that. Could you try asking again?";

    private final ContextAssembler           contextAssembler;
    private final AdaptiveDirectiveGenerator directiveGenerator;
    private final ResponderRouter            router;
    private final ResponseGenerator          generator;
    private final AgentRegistry              agentRegistry;
    private final MasteryDetector            masteryDetector;
    private final MasteryCalculator          masteryCalculator;
    private final EvidenceExtractor          evidenceExtractor;
    private final ProfileEnricher            profileEnricher;
    private final ResponseValidator          validator;
    private final CorrectionService          correctionService;
    private final AdaptationLogger           adaptationLogger;
    private final SpeechService              speechService;
    private final InteractionRepository      interactionRepository;
    private final TutoringSessionRepository  sessionRepository;
    private final BackgroundTasks            backgroundTasks;
    private final TeachingProperties         properties;
    private final Clock                      clock;

    // ── Turn ─────────────────────────────────────────────────────────────────

    /**
     * @throws ContextAssembler.LessonNotFoundException  lesson missing
     * @throws ContextAssembler.ProfileNotFoundException profile missing
     * @throws TurnFailedException                       no reply could be generated
     */
    public TurnResult teach(TurnRequest request) {
        long start = clock.millis();

        TeachingContext context = contextAssembler.load(request.userId(), request.sessionId(), request.lessonId());
        AdaptiveDirectives directives = directiveGenerator.generate(
                context.profile(), context.recentHistory(), context.currentMastery());
        log.info("[Teach] session={} mastery={} directives={}",
                request.sessionId(), context.currentMastery(), directives.directiveCount());

        AgentContext agentContext = contextAssembler.assemble(context, directives,
                request.userId(), request.sessionId(), request.lessonId(), request.input());

        RoutingDecision routing = router.decide(context.activeResponder(),
                request.input() == null ? null : request.input().message(),
                context.profile(), context.lesson());

        AgentResponse reply;
        String reason = routing.reason();
        List<String> chain = new ArrayList<>();
        MasteryResult mastery = null;

        if (routing.isDirect()) {
            reply = new AgentResponse(TeachingResponse.spoken(routing.directResponse(), AgentNames.COORDINATOR),
                    AgentResponse.Tier.DIRECT, null, 0);
            chain.add(AgentNames.COORDINATOR);
        } else {
            AgentContext responderContext = routing.source() == RoutingDecision.Source.COORDINATOR
                    ? agentContext.handedOffFrom(AgentNames.COORDINATOR)
                    : agentContext;
            reply = generateTiered(routing.responder(), responderContext);
            if (routing.handoffMessage() != null) {
                reply = reply.withResponse(reply.response().toBuilder()
                        .handoffMessage(routing.handoffMessage()).build());
            }
            chain.add(reply.agentName());

            reply = followHandoffs(reply, agentContext, chain);
            if (chain.size() > 1) {
                reason = "Handoff chain: " + String.join(" → ", chain);
            }

            if (reply.response().lessonComplete()) {
                mastery = checkMastery(request, context.lesson());
                if (mastery.hasMastered()) {
                    AgentResponse assessment = routeToAssessor(reply, agentContext);
                    if (assessment != reply) {
                        reply = assessment;
                        reason = ASSESSMENT_REASON;
                        chain.add(AgentNames.ASSESSOR);
                    }
                }
            }
        }

        if (context.hasPendingCorrection()) {
            markDelivered(context.pendingCorrection().getId());
        }

        TeachingResponse response = reply.response();
        byte[] audio = audioFor(reply);
        CompletableFuture<ValidationResult> validation = validate(request, context, response);

        long elapsed = clock.millis() - start;
        recordInBackground(request, context, directives, response, reason, elapsed, reply.tier());

        log.info("[Teach] session={} answered by {} via {} in {}ms ({})",
                request.sessionId(), response.agentName(), reply.tier(), elapsed, reason);
        return new TurnResult(response, reason, reply.tier(), audio, List.copyOf(chain), mastery, validation, elapsed);
    }

    // ── Generation ───────────────────────────────────────────────────────────

    /**
     * Progressive streaming first, then plain streaming, then a blocking call.
     */
    AgentResponse generateTiered(String agentName, AgentContext context) {
        try {
            return generator.generateProgressive(agentName, context);
        } catch (AgentRegistry.AgentNotFoundException e) {
            throw new TurnFailedException(APOLOGY, e);
        } catch (RuntimeException progressiveError) {
            log.warn("[Teach] Progressive generation failed for {}, falling back to streaming: {}",
                    agentName, progressiveError.getMessage());
        }

        try {
            return generator.generateStreaming(agentName, context);
        } catch (RuntimeException streamingError) {
            log.warn("[Teach] Streaming failed for {}, falling back to non-streaming: {}",
                    agentName, streamingError.getMessage());
        }

        try {
            return generator.generate(agentName, context);
        } catch (RuntimeException e) {
            log.error("[Teach] All generation tiers failed for {}: {}", agentName, e.getMessage());
            throw new TurnFailedException(APOLOGY, e);
        }
    }

    private AgentResponse followHandoffs(AgentResponse reply, AgentContext context, List<String> chain) {
        AgentResponse current = reply;
        int remaining = properties.maxHandoffs();

        while (current.response().wantsHandoff() && remaining > 0) {
            String from   = current.agentName();
            String target = AgentNames.resolveAlias(current.response().handoffRequest());
            log.info("[Teach] Handoff {} → {}", from, target);
            try {
                AgentResponse next = generator.generate(target, context.handedOffFrom(from));
                if (current.response().handoffMessage() != null) {
                    next = next.withResponse(next.response().toBuilder()
                            .handoffMessage(current.response().handoffMessage()).build());
                }
                chain.add(target);
                current = next;
                remaining--;
            } catch (RuntimeException e) {
                log.warn("[Teach] Handoff {} → {} failed, keeping last reply: {}", from, target, e.getMessage());
                break;
            }
        }

        if (remaining == 0 && current.response().wantsHandoff()) {
            log.warn("[Teach] Max handoffs ({}) reached, chain: {}", properties.maxHandoffs(), chain);
        }
        return current;
    }

    // ── Mastery ──────────────────────────────────────────────────────────────

    private MasteryResult checkMastery(TurnRequest request, Lesson lesson) {
        Instant sessionStart = sessionRepository.findBySessionId(request.sessionId())
                .map(TutoringSession::getStartedAt)
                .orElseGet(clock::instant);
        int grade = lesson.getGradeLevel() == null ? 0 : lesson.getGradeLevel();
        return masteryDetector.determineMastery(request.userId(), request.lessonId(),
                lesson.getSubject(), grade, sessionStart);
    }

    private AgentResponse routeToAssessor(AgentResponse prior, AgentContext context) {
        log.info("[Teach] Mastery confirmed - routing to assessor");
        try {
            AgentResponse assessment = generator.generate(AgentNames.ASSESSOR, context.handedOffFrom(prior.agentName()));
            return assessment.withResponse(assessment.response().toBuilder()
                    .handoffMessage(ASSESSMENT_HANDOFF_MESSAGE).build());
        } catch (RuntimeException e) {
            log.warn("[Teach] Assessor unavailable, keeping {} reply: {}", prior.agentName(), e.getMessage());
            return prior;
        }
    }

    // ── Post-reply ───────────────────────────────────────────────────────────

    private void markDelivered(Long correctionId) {
        try {
            correctionService.markDelivered(correctionId);
        } catch (RuntimeException e) {
            log.error("[Teach] Failed to mark correction {} as delivered: {}", correctionId, e.getMessage());
        }
    }

    private byte[] audioFor(AgentResponse reply) {
        if (reply.hasProgressiveAudio()) {
            return reply.synthesis().audio();
        }
        String text = reply.response().audioText();
        if (text == null || text.isBlank()) return null;
        try {
            return speechService.synthesizeFullText(text, reply.agentName());
        } catch (RuntimeException e) {
            log.warn("[Teach] Speech synthesis failed for {}, replying without audio: {}",
                    reply.agentName(), e.getMessage());
            return null;
        }
    }

    private CompletableFuture<ValidationResult> validate(TurnRequest request,
                                                         TeachingContext context,
                                                         TeachingResponse response) {
        if (!properties.shouldValidate(response.agentName())) {
            return CompletableFuture.completedFuture(ValidationResult.skipped());
        }

        CompletableFuture<ValidationResult> verdict =
                validator.validateAsync(response, context.profile(), context.lesson());
        verdict.thenAccept(result -> {
            if (result.approved()) {
                log.info("[Validator] Approved {} (confidence {})", response.agentName(), result.confidenceScore());
                return;
            }
            log.warn("[Validator] Rejected {}: {}", response.agentName(), result.issues());
            backgroundTasks.submit("store-correction", () -> correctionService.recordRejection(
                    request.sessionId(), response.agentName(), response, result));
        });
        return verdict;
    }

    private void recordInBackground(TurnRequest request,
                                    TeachingContext context,
                                    AdaptiveDirectives directives,
                                    TeachingResponse response,
                                    String reason,
                                    long elapsedMs,
                                    AgentResponse.Tier tier) {
        String message = request.loggedMessage();

        backgroundTasks.submit("save-interaction", () -> interactionRepository.save(Interaction.builder()
                .sessionId(request.sessionId())
                .agentName(response.agentName())
                .userMessage(message)
                .agentResponse(response.displayText())
                .routingReason(reason)
                .responseTimeMs(elapsedMs)
                .build()));

        if (tier == AgentResponse.Tier.DIRECT) {
            return;
        }

        adaptationLogger.log(request.userId(), request.lessonId(), request.sessionId(), directives,
                context.profile().learningStyle(), response.displayText(), response.hasSvg());

        if (request.input() == null || !request.input().hasText() || response.displayText() == null) {
            backgroundTasks.submit("enrich-profile",
                    () -> profileEnricher.enrichIfNeeded(request.userId(), request.sessionId()));
            return;
        }

        String topic = context.lesson().getTitle();
        backgroundTasks.submit("record-evidence", () -> recordEvidence(request, message, response, topic))
                .thenRun(() -> backgroundTasks.submit("enrich-profile",
                        () -> profileEnricher.enrichIfNeeded(request.userId(), request.sessionId())));
    }

    private void recordEvidence(TurnRequest request, String message, TeachingResponse response, String topic) {
        EvidenceQuality quality = evidenceExtractor.extract(message, response.displayText(), topic);
        if (quality.confidence() <= properties.evidenceConfidenceThreshold()) {
            log.debug("[Evidence] Confidence {} too low, not recorded", quality.confidence());
            return;
        }
        masteryCalculator.recordEvidence(EvidenceRecord.builder()
                .userId(request.userId())
                .lessonId(request.lessonId())
                .sessionId(request.sessionId())
                .evidenceType(quality.type())
                .content(message)
                .qualityScore(quality.qualityScore())
                .confidence(quality.confidence())
                .context(topic)
                .build());
        log.info("[Evidence] Recorded {} (quality {}) for lesson {}",
                quality.type(), quality.qualityScore(), request.lessonId());
    }

    // ── Exceptions ───────────────────────────────────────────────────────────

    /** The turn produced no reply; {@link #getMessage()} is safe to show the student. */
    public static class TurnFailedException extends RuntimeException {
        public TurnFailedException(String message, Throwable cause) { super(message, cause); }
    }
}
