package com.openforge.tutor.context;

import com.openforge.tutor.adaptive.AdaptiveDirectives;
import com.openforge.tutor.adaptive.DirectiveFormatter;
import com.openforge.tutor.domain.Lesson;
import com.openforge.tutor.domain.PendingCorrection;
import com.openforge.tutor.mastery.MasteryCalculator;
import com.openforge.tutor.profile.LearnerProfile;
import com.openforge.tutor.profile.ProfileService;
import com.openforge.tutor.repository.InteractionRepository;
import com.openforge.tutor.repository.LessonRepository;
import com.openforge.tutor.routing.ResponderRouter;
import com.openforge.tutor.teaching.TeachingProperties;
import com.openforge.tutor.validation.CorrectionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Loads and assembles the context for one turn.
 *
 * Six independent reads run in parallel on the task executor: profile,
 * recent history, lesson, active responder, current mastery and the oldest
 * pending correction.  Only the lesson and the profile are required; every
 * other read degrades to an empty value.
 */
@Slf4j
@Service
public class ContextAssembler {

    private final ProfileService        profileService;
    private final InteractionRepository interactionRepository;
    private final LessonRepository      lessonRepository;
    private final ResponderRouter       router;
    private final MasteryCalculator     masteryCalculator;
    private final CorrectionService     correctionService;
    private final ExecutorService       executor;
    private final TeachingProperties    properties;

    public ContextAssembler(ProfileService profileService,
                            InteractionRepository interactionRepository,
                            LessonRepository lessonRepository,
                            ResponderRouter router,
                            MasteryCalculator masteryCalculator,
                            CorrectionService correctionService,
                            ExecutorService tutorTaskExecutor,
                            TeachingProperties properties) {
        this.profileService        = profileService;
        this.interactionRepository = interactionRepository;
        this.lessonRepository      = lessonRepository;
        this.router                = router;
        this.masteryCalculator     = masteryCalculator;
        this.correctionService     = correctionService;
        this.executor              = tutorTaskExecutor;
        this.properties            = properties;
    }

    // ── Load ─────────────────────────────────────────────────────────────────

    /**
     * @throws LessonNotFoundException  if the lesson does not exist or cannot be read
     * @throws ProfileNotFoundException if the student has no profile
     */
    public TeachingContext load(String userId, String sessionId, String lessonId) {
        CompletableFuture<LearnerProfile> profile = async(() -> profileService.find(userId)
                .orElseThrow(() -> new ProfileNotFoundException("Profile not found: " + userId)));

        CompletableFuture<List<ConversationTurn>> history = async(() -> recentHistory(sessionId))
                .exceptionally(e -> {
                    log.warn("[Context] Session history unavailable for {}, continuing with empty history: {}",
                            sessionId, rootMessage(e));
                    return List.of();
                });

        CompletableFuture<Lesson> lesson = async(() -> lessonRepository.findByLessonId(lessonId)
                .orElseThrow(() -> new LessonNotFoundException("Lesson not found: " + lessonId)));

        CompletableFuture<String> active = async(() -> router.activeResponder(sessionId).orElse(null))
                .exceptionally(e -> {
                    log.warn("[Context] Continuity lookup failed for {}: {}", sessionId, rootMessage(e));
                    return null;
                });

        CompletableFuture<Integer> mastery = async(() -> masteryCalculator.computeMastery(userId, lessonId));

        CompletableFuture<PendingCorrection> correction = async(() -> correctionService.nextPending(sessionId).orElse(null))
                .exceptionally(e -> {
                    log.warn("[Context] Pending correction lookup failed for {}: {}", sessionId, rootMessage(e));
                    return null;
                });

        Lesson loadedLesson;
        try {
            loadedLesson = await(lesson);
        } catch (LessonNotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LessonNotFoundException("Failed to fetch lesson " + lessonId + ": " + e.getMessage(), e);
        }

        TeachingContext context = new TeachingContext(
                await(profile),
                await(history),
                loadedLesson,
                await(active),
                await(mastery),
                await(correction));

        log.debug("[Context] Loaded session={} mastery={} history={} active={} correction={}",
                sessionId, context.currentMastery(), context.recentHistory().size(),
                context.activeResponder(), context.hasPendingCorrection());
        return context;
    }

    // ── Assemble ─────────────────────────────────────────────────────────────

    /**
     * Builds the agent-facing context for this turn.  At most one correction
     * is injected; the caller marks it delivered once a reply exists.
     */
    public AgentContext assemble(TeachingContext context,
                                 AdaptiveDirectives directives,
                                 String userId,
                                 String sessionId,
                                 String lessonId,
                                 StudentInput input) {
        return AgentContext.builder()
                .userId(userId)
                .sessionId(sessionId)
                .lessonId(lessonId)
                .profile(context.profile())
                .history(context.recentHistory())
                .lesson(context.lesson())
                .input(input)
                .instructions(instructionBlock(context, directives))
                .build();
    }

    /**
     * Mastery tag, then the self-correction block if a correction is pending,
     * then the formatted directives.
     */
    public String instructionBlock(TeachingContext context, AdaptiveDirectives directives) {
        StringBuilder block = new StringBuilder()
                .append(DirectiveFormatter.masteryTag(context.currentMastery()))
                .append('\n');
        if (context.hasPendingCorrection()) {
            PendingCorrection correction = context.pendingCorrection();
            block.append(correctionService.correctionBlock(correction));
            log.info("[Context] Injected self-correction for {} (correction {})",
                    correction.getSpecialistName(), correction.getId());
        }
        block.append(DirectiveFormatter.format(directives));
        return block.toString();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<ConversationTurn> recentHistory(String sessionId) {
        List<ConversationTurn> turns = new ArrayList<>();
        interactionRepository.findBySessionIdOrderByCreateTimeDescIdDesc(
                        sessionId, PageRequest.of(0, properties.historySize()))
                .forEach(interaction -> turns.add(ConversationTurn.of(interaction)));
        Collections.reverse(turns);
        return turns;
    }

    private <T> CompletableFuture<T> async(Supplier<T> supplier) {
        return CompletableFuture.supplyAsync(supplier, executor);
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        return cause.getMessage();
    }

    // ── Exceptions ───────────────────────────────────────────────────────────

    public static class LessonNotFoundException extends RuntimeException {
        public LessonNotFoundException(String message) { super(message); }
        public LessonNotFoundException(String message, Throwable cause) { super(message, cause); }
    }

    public static class ProfileNotFoundException extends RuntimeException {
        public ProfileNotFoundException(String message) { super(message); }
    }
}
