package com.openforge.tutor.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.tutor.agent.AgentNames;
import com.openforge.tutor.agent.AgentRegistry;
import com.openforge.tutor.domain.Agent;
import com.openforge.tutor.domain.Interaction;
import com.openforge.tutor.domain.Lesson;
import com.openforge.tutor.llm.LlmRouter;
import com.openforge.tutor.llm.model.ChatRequest;
import com.openforge.tutor.llm.model.Message;
import com.openforge.tutor.profile.LearnerProfile;
import com.openforge.tutor.repository.InteractionRepository;
import com.openforge.tutor.response.TeachingResponseParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the responder for a turn.
 *
 * Decision order:
 * <ol>
 *   <li>{@code [AUTO_START]} lesson introductions go to the coordinator.</li>
 *   <li>Continuity: if the session's last responder was anything but the
 *       coordinator, it answers again.  No model call.</li>
 *   <li>Audio/media-only turns map the lesson subject to a default specialist.</li>
 *   <li>Otherwise the coordinator model decides.  Unparseable output is read
 *       with a regex; if that fails too, a static fallback is returned.</li>
 * </ol>
 * Routing never throws to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResponderRouter {

    public static final String AUTO_START_PREFIX = "[AUTO_START]";

    static final Map<String, String> SUBJECT_DEFAULTS = Map.of(
            "math",    AgentNames.MATH_SPECIALIST,
            "science", AgentNames.SCIENCE_SPECIALIST,
            "english", AgentNames.ENGLISH_SPECIALIST,
            "history", AgentNames.HISTORY_SPECIALIST,
            "art",     AgentNames.ART_SPECIALIST
    );

    static final String DEFAULT_SUBJECT_RESPONDER = AgentNames.MATH_SPECIALIST;

    private static final Pattern ROUTE_TO = Pattern.compile("\"route_to\"\\s*:\\s*\"([^\"]+)\"");
    private static final Pattern REASON   = Pattern.compile("\"reason\"\\s*:\\s*\"([^\"]+)\"");

    private final InteractionRepository interactionRepository;
    private final AgentRegistry         agentRegistry;
    private final LlmRouter             llmRouter;
    private final ObjectMapper          objectMapper;

    // ── Continuity ───────────────────────────────────────────────────────────

    /**
     * The responder of the session's newest interaction, unless that was the
     * coordinator.  Empty for a new session.
     */
    public Optional<String> activeResponder(String sessionId) {
        return interactionRepository.findFirstBySessionIdOrderByCreateTimeDescIdDesc(sessionId)
                .map(Interaction::getAgentName)
                .filter(name -> !AgentNames.isCoordinator(name));
    }

    // ── Decision ─────────────────────────────────────────────────────────────

    /** Loads the active responder and decides. */
    public RoutingDecision route(String sessionId, String message, LearnerProfile profile, Lesson lesson) {
        Optional<String> active;
        try {
            active = activeResponder(sessionId);
        } catch (Exception e) {
            log.warn("[Router] Continuity lookup failed for session {}: {}", sessionId, e.getMessage());
            active = Optional.empty();
        }
        return decide(active.orElse(null), message, profile, lesson);
    }

    /**
     * Decides with an already-known active responder (null when there is none).
     */
    public RoutingDecision decide(String activeResponder, String message, LearnerProfile profile, Lesson lesson) {
        if (message != null && message.startsWith(AUTO_START_PREFIX)) {
            log.info("[Router] AUTO_START detected - coordinator handling directly");
            return RoutingDecision.autoStart();
        }

        if (activeResponder != null && !AgentNames.isCoordinator(activeResponder)) {
            log.info("[Router] Fast path: continuing with {}", activeResponder);
            return RoutingDecision.continuity(activeResponder);
        }

        if (message == null || message.isBlank()) {
            String responder = responderForSubject(lesson == null ? null : lesson.getSubject());
            log.info("[Router] No text message - routed to {} by subject", responder);
            return RoutingDecision.subjectDefault(responder);
        }

        return askCoordinator(message, profile, lesson);
    }

    /** Deterministic subject table; unknown or missing subjects get the math specialist. */
    public static String responderForSubject(String subject) {
        if (subject == null) return DEFAULT_SUBJECT_RESPONDER;
        return SUBJECT_DEFAULTS.getOrDefault(subject.trim().toLowerCase(Locale.ROOT), DEFAULT_SUBJECT_RESPONDER);
    }

    // ── Coordinator ──────────────────────────────────────────────────────────

    private RoutingDecision askCoordinator(String message, LearnerProfile profile, Lesson lesson) {
        try {
            Agent coordinator = agentRegistry.coordinator();
            String prompt = buildRoutingPrompt(coordinator, message, profile, lesson);
            String raw = llmRouter.chat(ChatRequest.simple(coordinator.getModel(), List.of(Message.user(prompt))))
                    .text();
            if (raw == null || raw.isBlank()) {
                throw new IllegalStateException("No response from coordinator");
            }

            CoordinatorDecision decision = parseDecision(raw);
            if (decision.routeTo() == null || decision.routeTo().isBlank()) {
                throw new IllegalStateException("Invalid routing decision: missing route_to");
            }
            return toRoutingDecision(decision);
        } catch (Exception e) {
            log.warn("[Router] Coordinator routing failed, using static fallback: {}", e.getMessage());
            return RoutingDecision.fallback();
        }
    }

    CoordinatorDecision parseDecision(String raw) {
        String json = TeachingResponseParser.stripMarkdownJson(raw);
        try {
            return objectMapper.readValue(json, CoordinatorDecision.class);
        } catch (Exception parseError) {
            log.warn("[Router] Routing JSON unparseable, trying regex: {}", preview(raw));
            Matcher route = ROUTE_TO.matcher(raw);
            if (!route.find()) {
                throw new IllegalStateException("Invalid JSON from coordinator: " + parseError.getMessage(), parseError);
            }
            Matcher reason = REASON.matcher(raw);
            return new CoordinatorDecision(route.group(1),
                    reason.find() ? reason.group(1) : "Extracted via fallback", null, null);
        }
    }

    private RoutingDecision toRoutingDecision(CoordinatorDecision decision) {
        String target = AgentNames.resolveAlias(decision.routeTo());

        if (AgentNames.SELF.equals(target) || AgentNames.COORDINATOR.equals(target)) {
            log.info("[Router] Coordinator handles directly: {}", decision.reason());
            return new RoutingDecision(AgentNames.COORDINATOR, decision.reason(),
                    decision.response(), decision.handoffMessage(), RoutingDecision.Source.COORDINATOR);
        }

        if (agentRegistry.find(target).isEmpty()) {
            throw new IllegalStateException("Coordinator routed to unknown agent '" + target + "'");
        }
        log.info("[Router] Coordinator routed to {}: {}", target, decision.reason());
        return new RoutingDecision(target, decision.reason(), null, decision.handoffMessage(),
                RoutingDecision.Source.COORDINATOR);
    }

    static String buildRoutingPrompt(Agent coordinator, String message, LearnerProfile profile, Lesson lesson) {
        StringBuilder info = new StringBuilder("STUDENT INFO:\n")
                .append("- Name: ").append(profile == null ? null : profile.name()).append('\n')
                .append("- Age: ").append(profile == null ? null : profile.age()).append('\n')
                .append("- Grade: ").append(profile == null ? null : profile.gradeLevel());
        if (lesson != null) {
            info.append("\n- Current Lesson: ").append(lesson.getTitle())
                    .append(" (").append(lesson.getSubject()).append(')');
        }

        return coordinator.getSystemPrompt() + "\n\n"
                + info + "\n\n"
                + "STUDENT MESSAGE: \"" + message + "\"\n\n"
                + "Analyze this message and respond with your routing decision in JSON format.";
    }

    private static String preview(String raw) {
        return raw.length() > 500 ? raw.substring(0, 500) : raw;
    }
}
