package com.openforge.tutor.teaching;

import com.openforge.tutor.adaptive.AdaptationLogger;
import com.openforge.tutor.adaptive.AdaptiveDirectiveGenerator;
import com.openforge.tutor.adaptive.AdaptiveDirectives;
import com.openforge.tutor.adaptive.EncouragementLevel;
import com.openforge.tutor.agent.AgentNames;
import com.openforge.tutor.agent.AgentRegistry;
import com.openforge.tutor.agent.AgentResponse;
import com.openforge.tutor.agent.ResponseGenerator;
import com.openforge.tutor.context.AgentContext;
import com.openforge.tutor.context.ContextAssembler;
import com.openforge.tutor.context.StudentInput;
import com.openforge.tutor.context.TeachingContext;
import com.openforge.tutor.domain.EvidenceRecord;
import com.openforge.tutor.domain.EvidenceType;
import com.openforge.tutor.domain.Interaction;
import com.openforge.tutor.domain.PendingCorrection;
import com.openforge.tutor.mastery.EvidenceExtractor;
import com.openforge.tutor.mastery.EvidenceExtractor.EvidenceQuality;
import com.openforge.tutor.mastery.MasteryCalculator;
import com.openforge.tutor.mastery.MasteryDetector;
import com.openforge.tutor.mastery.MasteryResult;
import com.openforge.tutor.mastery.MasteryRules;
import com.openforge.tutor.profile.ProfileEnricher;
import com.openforge.tutor.repository.InteractionRepository;
import com.openforge.tutor.repository.TutoringSessionRepository;
import com.openforge.tutor.response.TeachingResponse;
import com.openforge.tutor.routing.ResponderRouter;
import com.openforge.tutor.routing.RoutingDecision;
import com.openforge.tutor.speech.SpeechService;
import com.openforge.tutor.speech.SynthesisOutcome;
import com.openforge.tutor.task.BackgroundTasks;
import com.openforge.tutor.testutil.Fixtures;
import com.openforge.tutor.testutil.MutableClock;
import com.openforge.tutor.testutil.SyncExecutor;
import com.openforge.tutor.validation.CorrectionService;
import com.openforge.tutor.validation.ResponseValidator;
import com.openforge.tutor.validation.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static com.openforge.tutor.testutil.Fixtures.LESSON;
import static com.openforge.tutor.testutil.Fixtures.SESSION;
import static com.openforge.tutor.testutil.Fixtures.USER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TeachingOrchestratorTest {

    private static final String MATH    = AgentNames.MATH_SPECIALIST;
    private static final String SCIENCE = AgentNames.SCIENCE_SPECIALIST;

    private final ContextAssembler assembler = mock(ContextAssembler.class);
    private final AdaptiveDirectiveGenerator directiveGenerator = mock(AdaptiveDirectiveGenerator.class);
    private final ResponderRouter router = mock(ResponderRouter.class);
    private final ResponseGenerator generator = mock(ResponseGenerator.class);
    private final AgentRegistry registry = mock(AgentRegistry.class);
    private final MasteryDetector masteryDetector = mock(MasteryDetector.class);
    private final MasteryCalculator masteryCalculator = mock(MasteryCalculator.class);
    private final EvidenceExtractor evidenceExtractor = mock(EvidenceExtractor.class);
    private final ProfileEnricher profileEnricher = mock(ProfileEnricher.class);
    private final ResponseValidator validator = mock(ResponseValidator.class);
    private final CorrectionService correctionService = mock(CorrectionService.class);
    private final AdaptationLogger adaptationLogger = mock(AdaptationLogger.class);
    private final SpeechService speechService = mock(SpeechService.class);
    private final InteractionRepository interactions = mock(InteractionRepository.class);
    private final TutoringSessionRepository sessions = mock(TutoringSessionRepository.class);
    private final MutableClock clock = MutableClock.at("2026-01-01T10:00:00Z");

    private final AgentContext agentContext = AgentContext.builder()
            .userId(USER).sessionId(SESSION).lessonId(LESSON)
            .profile(Fixtures.profile("visual"))
            .lesson(Fixtures.lesson())
            .input(StudentInput.text("What is 1/4 + 2/4?"))
            .instructions("[CURRENT MASTERY: 40/100]")
            .build();

    private TeachingOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new TeachingOrchestrator(assembler, directiveGenerator, router, generator, registry,
                masteryDetector, masteryCalculator, evidenceExtractor, profileEnricher, validator,
                correctionService, adaptationLogger, speechService, interactions, sessions,
                new BackgroundTasks(new SyncExecutor()), TeachingProperties.defaults(), clock);

        givenContext(null);
        when(directiveGenerator.generate(any(), any(), anyInt())).thenReturn(new AdaptiveDirectives(
                List.of(), List.of(), List.of(), List.of(), EncouragementLevel.STANDARD, 40, 0.0));
        when(assembler.assemble(any(), any(), eq(USER), eq(SESSION), eq(LESSON), any())).thenReturn(agentContext);
        when(router.decide(any(), any(), any(), any())).thenReturn(RoutingDecision.continuity(MATH));
        when(speechService.synthesizeFullText(anyString(), anyString()))
                .thenReturn("audio".getBytes(StandardCharsets.UTF_8));
        when(validator.validateAsync(any(), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(new ValidationResult(true, 0.95, List.of(), null)));
        when(evidenceExtractor.extract(anyString(), anyString(), anyString()))
                .thenReturn(new EvidenceQuality("correct_answer", 85, 0.9, "right"));
    }

    private void givenContext(PendingCorrection correction) {
        when(assembler.load(USER, SESSION, LESSON)).thenReturn(new TeachingContext(
                Fixtures.profile("visual"), List.of(), Fixtures.lesson(), MATH, 40, correction));
    }

    private static TurnRequest request() {
        return TurnRequest.text(USER, SESSION, LESSON, "What is 1/4 + 2/4?");
    }

    private static AgentResponse reply(String agent, AgentResponse.Tier tier) {
        return new AgentResponse(TeachingResponse.builder()
                .audioText("Three quarters.")
                .displayText("1/4 + 2/4 = 3/4")
                .agentName(agent)
                .build(), tier, null, 5);
    }

    private static AgentResponse handoff(String from, String to) {
        return new AgentResponse(TeachingResponse.builder()
                .audioText("Let me get someone.")
                .displayText("Passing you on")
                .handoffRequest(to)
                .agentName(from)
                .build(), AgentResponse.Tier.SYNC, null, 5);
    }

    // ── Routing ──────────────────────────────────────────────────────────────

    @Test
    void directCoordinatorReplySkipsGeneration() {
        when(router.decide(any(), any(), any(), any())).thenReturn(new RoutingDecision(
                AgentNames.COORDINATOR, "Greeting", "Hi Sam!", null, RoutingDecision.Source.COORDINATOR));

        TurnResult result = orchestrator.teach(request());

        assertThat(result.tier()).isEqualTo(AgentResponse.Tier.DIRECT);
        assertThat(result.responder()).isEqualTo(AgentNames.COORDINATOR);
        assertThat(result.response().displayText()).isEqualTo("Hi Sam!");
        assertThat(result.handoffChain()).containsExactly(AgentNames.COORDINATOR);
        assertThat(result.validation().join().approved()).isTrue();
        verify(generator, never()).generateProgressive(anyString(), any());
        verify(validator, never()).validateAsync(any(), any(), any());
        verify(interactions).save(any(Interaction.class));
        verify(adaptationLogger, never()).log(any(), any(), any(), any(), any(), any(), anyBoolean());
        verify(evidenceExtractor, never()).extract(any(), any(), any());
    }

    @Test
    void coordinatorRoutedResponderIsTreatedAsHandoff() {
        when(router.decide(any(), any(), any(), any())).thenReturn(new RoutingDecision(
                MATH, "Math question", null, "Let me bring in our math expert!", RoutingDecision.Source.COORDINATOR));
        when(generator.generateProgressive(eq(MATH), any())).thenReturn(reply(MATH, AgentResponse.Tier.PROGRESSIVE));

        TurnResult result = orchestrator.teach(request());

        ArgumentCaptor<AgentContext> ctx = ArgumentCaptor.forClass(AgentContext.class);
        verify(generator).generateProgressive(eq(MATH), ctx.capture());
        assertThat(ctx.getValue().previousAgent()).isEqualTo(AgentNames.COORDINATOR);
        assertThat(result.response().handoffMessage()).isEqualTo("Let me bring in our math expert!");
        assertThat(result.routingReason()).isEqualTo("Math question");
    }

    // ── Generation tiers ─────────────────────────────────────────────────────

    @Test
    void fallsThroughTiers() {
        when(generator.generateProgressive(eq(MATH), any())).thenThrow(new IllegalStateException("stream broke"));
        when(generator.generateStreaming(eq(MATH), any())).thenThrow(new IllegalStateException("stream broke"));
        when(generator.generate(eq(MATH), any())).thenReturn(reply(MATH, AgentResponse.Tier.SYNC));

        TurnResult result = orchestrator.teach(request());

        assertThat(result.tier()).isEqualTo(AgentResponse.Tier.SYNC);
        assertThat(result.responder()).isEqualTo(MATH);
        assertThat(result.routingReason()).isEqualTo("Continuing with " + MATH);
        assertThat(new String(result.audio(), StandardCharsets.UTF_8)).isEqualTo("audio");
    }

    @Test
    void allTiersFailingFailsTheTurn() {
        when(generator.generateProgressive(eq(MATH), any())).thenThrow(new IllegalStateException("a"));
        when(generator.generateStreaming(eq(MATH), any())).thenThrow(new IllegalStateException("b"));
        when(generator.generate(eq(MATH), any())).thenThrow(new IllegalStateException("c"));

        assertThatThrownBy(() -> orchestrator.teach(request()))
                .isInstanceOf(TeachingOrchestrator.TurnFailedException.class)
                .hasMessage(TeachingOrchestrator.APOLOGY);
        verify(interactions, never()).save(any());
    }

    @Test
    void unknownAgentDoesNotRetryOtherTiers() {
        when(generator.generateProgressive(eq(MATH), any()))
                .thenThrow(new AgentRegistry.AgentNotFoundException("No active agent named 'math_specialist'"));

        assertThatThrownBy(() -> orchestrator.teach(request()))
                .isInstanceOf(TeachingOrchestrator.TurnFailedException.class);
        verify(generator, never()).generateStreaming(anyString(), any());
    }

    @Test
    void progressiveAudioIsReused() {
        SynthesisOutcome outcome = new SynthesisOutcome("progressive".getBytes(StandardCharsets.UTF_8),
                List.of("Three quarters."), 1, 0, false);
        AgentResponse progressive = new AgentResponse(reply(MATH, AgentResponse.Tier.PROGRESSIVE).response(),
                AgentResponse.Tier.PROGRESSIVE, outcome, 5);
        when(generator.generateProgressive(eq(MATH), any())).thenReturn(progressive);

        TurnResult result = orchestrator.teach(request());

        assertThat(new String(result.audio(), StandardCharsets.UTF_8)).isEqualTo("progressive");
        verify(speechService, never()).synthesizeFullText(anyString(), anyString());
    }

    @Test
    void speechFailureStillReplies() {
        when(generator.generateProgressive(eq(MATH), any())).thenReturn(reply(MATH, AgentResponse.Tier.PROGRESSIVE));
        when(speechService.synthesizeFullText(anyString(), anyString())).thenThrow(new IllegalStateException("tts down"));

        TurnResult result = orchestrator.teach(request());

        assertThat(result.hasAudio()).isFalse();
        assertThat(result.response().displayText()).isEqualTo("1/4 + 2/4 = 3/4");
    }

    // ── Handoffs ─────────────────────────────────────────────────────────────

    @Test
    void followsHandoffChain() {
        when(generator.generateProgressive(eq(MATH), any())).thenReturn(handoff(MATH, "science"));
        when(generator.generate(eq(SCIENCE), any())).thenReturn(reply(SCIENCE, AgentResponse.Tier.SYNC));

        TurnResult result = orchestrator.teach(request());

        assertThat(result.responder()).isEqualTo(SCIENCE);
        assertThat(result.handoffChain()).containsExactly(MATH, SCIENCE);
        assertThat(result.routingReason()).isEqualTo("Handoff chain: math_specialist → science_specialist");

        ArgumentCaptor<AgentContext> ctx = ArgumentCaptor.forClass(AgentContext.class);
        verify(generator).generate(eq(SCIENCE), ctx.capture());
        assertThat(ctx.getValue().previousAgent()).isEqualTo(MATH);
    }

    @Test
    void handoffChainIsCapped() {
        when(generator.generateProgressive(eq(MATH), any())).thenReturn(handoff(MATH, "science"));
        when(generator.generate(eq(SCIENCE), any())).thenReturn(handoff(SCIENCE, "math"));
        when(generator.generate(eq(MATH), any())).thenReturn(handoff(MATH, "science"));

        TurnResult result = orchestrator.teach(request());

        assertThat(result.handoffChain()).containsExactly(MATH, SCIENCE, MATH, SCIENCE);
        verify(generator, times(2)).generate(eq(SCIENCE), any());
        verify(generator, times(1)).generate(eq(MATH), any());
    }

    @Test
    void failedHandoffKeepsLastReply() {
        when(generator.generateProgressive(eq(MATH), any())).thenReturn(handoff(MATH, "science"));
        when(generator.generate(eq(SCIENCE), any())).thenThrow(new IllegalStateException("down"));

        TurnResult result = orchestrator.teach(request());

        assertThat(result.responder()).isEqualTo(MATH);
        assertThat(result.handoffChain()).containsExactly(MATH);
        assertThat(result.response().displayText()).isEqualTo("Passing you on");
    }

    // ── Mastery ──────────────────────────────────────────────────────────────

    private static MasteryResult mastery(boolean mastered) {
        return new MasteryResult(mastered, 0.9,
                new MasteryResult.Criteria(mastered, true, true, true, true, true),
                new MasteryResult.EvidenceSummary(4, 0, 1, 1, 0, 85, 12.0),
                MasteryRules.DEFAULTS);
    }

    private AgentResponse lessonComplete() {
        return new AgentResponse(reply(MATH, AgentResponse.Tier.PROGRESSIVE).response().toBuilder()
                .lessonComplete(true).build(), AgentResponse.Tier.PROGRESSIVE, null, 5);
    }

    @Test
    void masteredLessonGoesToAssessor() {
        when(generator.generateProgressive(eq(MATH), any())).thenReturn(lessonComplete());
        when(masteryDetector.determineMastery(eq(USER), eq(LESSON), eq("math"), eq(4), any())).thenReturn(mastery(true));
        when(generator.generate(eq(AgentNames.ASSESSOR), any())).thenReturn(reply(AgentNames.ASSESSOR, AgentResponse.Tier.SYNC));

        TurnResult result = orchestrator.teach(request());

        assertThat(result.responder()).isEqualTo(AgentNames.ASSESSOR);
        assertThat(result.handoffChain()).containsExactly(MATH, AgentNames.ASSESSOR);
        assertThat(result.routingReason()).isEqualTo(TeachingOrchestrator.ASSESSMENT_REASON);
        assertThat(result.response().handoffMessage()).isEqualTo(TeachingOrchestrator.ASSESSMENT_HANDOFF_MESSAGE);
        assertThat(result.mastery().hasMastered()).isTrue();
        verify(validator, never()).validateAsync(any(), any(), any());
    }

    @Test
    void notYetMasteredStaysWithSpecialist() {
        when(generator.generateProgressive(eq(MATH), any())).thenReturn(lessonComplete());
        when(masteryDetector.determineMastery(any(), any(), any(), anyInt(), any())).thenReturn(mastery(false));

        TurnResult result = orchestrator.teach(request());

        assertThat(result.responder()).isEqualTo(MATH);
        assertThat(result.mastery().hasMastered()).isFalse();
        verify(generator, never()).generate(eq(AgentNames.ASSESSOR), any());
    }

    // ── Post-reply ───────────────────────────────────────────────────────────

    @Test
    void injectedCorrectionIsMarkedDelivered() {
        PendingCorrection correction = PendingCorrection.builder().sessionId(SESSION).specialistName(MATH).build();
        correction.setId(7L);
        givenContext(correction);
        when(generator.generateProgressive(eq(MATH), any())).thenReturn(reply(MATH, AgentResponse.Tier.PROGRESSIVE));

        orchestrator.teach(request());

        verify(correctionService).markDelivered(7L);
    }

    @Test
    void rejectionQueuesCorrection() {
        ValidationResult rejected = new ValidationResult(false, 0.9, List.of("3/8 is wrong"), List.of("Say 3/4"));
        when(validator.validateAsync(any(), any(), any())).thenReturn(CompletableFuture.completedFuture(rejected));
        when(generator.generateProgressive(eq(MATH), any())).thenReturn(reply(MATH, AgentResponse.Tier.PROGRESSIVE));

        TurnResult result = orchestrator.teach(request());

        assertThat(result.validation().join().approved()).isFalse();
        verify(correctionService).recordRejection(eq(SESSION), eq(MATH), any(TeachingResponse.class), eq(rejected));
    }

    @Test
    void confidentEvidenceIsRecordedThenProfileEnriched() {
        when(generator.generateProgressive(eq(MATH), any())).thenReturn(reply(MATH, AgentResponse.Tier.PROGRESSIVE));

        orchestrator.teach(request());

        ArgumentCaptor<EvidenceRecord> record = ArgumentCaptor.forClass(EvidenceRecord.class);
        verify(masteryCalculator).recordEvidence(record.capture());
        assertThat(record.getValue().getEvidenceType()).isEqualTo(EvidenceType.CORRECT_ANSWER);
        assertThat(record.getValue().getQualityScore()).isEqualTo(85);
        assertThat(record.getValue().getContext()).isEqualTo("Adding Fractions");
        verify(profileEnricher).enrichIfNeeded(USER, SESSION);
        verify(adaptationLogger).log(eq(USER), eq(LESSON), eq(SESSION), any(), eq("visual"), eq("1/4 + 2/4 = 3/4"), eq(false));
    }

    @Test
    void lowConfidenceEvidenceIsDropped() {
        when(generator.generateProgressive(eq(MATH), any())).thenReturn(reply(MATH, AgentResponse.Tier.PROGRESSIVE));
        when(evidenceExtractor.extract(anyString(), anyString(), anyString()))
                .thenReturn(new EvidenceQuality("explanation", 50, 0.7, "unsure"));

        orchestrator.teach(request());

        verify(masteryCalculator, never()).recordEvidence(any());
        verify(profileEnricher).enrichIfNeeded(USER, SESSION);
    }

    @Test
    void audioOnlyTurnSkipsEvidence() {
        when(generator.generateProgressive(eq(MATH), any())).thenReturn(reply(MATH, AgentResponse.Tier.PROGRESSIVE));
        TurnRequest voice = new TurnRequest(USER, SESSION, LESSON,
                new StudentInput(null, "QUJD", "audio/webm", null, null));

        orchestrator.teach(voice);

        ArgumentCaptor<Interaction> saved = ArgumentCaptor.forClass(Interaction.class);
        verify(interactions).save(saved.capture());
        assertThat(saved.getValue().getUserMessage()).isEqualTo("[Audio/Media input]");
        verify(evidenceExtractor, never()).extract(any(), any(), any());
        verify(profileEnricher).enrichIfNeeded(USER, SESSION);
    }
}
