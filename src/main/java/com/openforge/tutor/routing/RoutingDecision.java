package com.openforge.tutor.routing;

import com.openforge.tutor.agent.AgentNames;

/**
 * Who answers this turn, and why.
 *
 * @param responder      canonical agent name
 * @param reason         logged with the interaction
 * @param directResponse when set, the coordinator's own reply; no agent is called
 * @param handoffMessage optional line the coordinator wants shown on handover
 * @param source         which routing step produced the decision
 */
public record RoutingDecision(
        String responder,
        String reason,
        String directResponse,
        String handoffMessage,
        Source source
) {

    public enum Source {
        CONTINUITY,
        AUTO_START,
        SUBJECT_DEFAULT,
        COORDINATOR,
        FALLBACK
    }

    static final String AUTO_START_REASON = "AUTO_START lesson introduction by Coordinator";
    static final String FALLBACK_REASON   = "Routing error - handling directly";
    static final String FALLBACK_RESPONSE = "I'm here to help! Could you tell me what you're to learn today?";

    public static RoutingDecision continuity(String responder) {
        return new RoutingDecision(responder, "Continuing with " + responder,
                null, null, Source.CONTINUITY);
    }

    public static RoutingDecision autoStart() {
        return new RoutingDecision(AgentNames.COORDINATOR, AUTO_START_REASON, null, null, Source.AUTO_START);
    }

    public static RoutingDecision subjectDefault(String responder) {
        return new RoutingDecision(responder,
                "Routed to " + responder + " based on lesson subject (audio/media input)",
                null, null, Source.SUBJECT_DEFAULT);
    }

    public static RoutingDecision fallback() {
        return new RoutingDecision(AgentNames.COORDINATOR, FALLBACK_REASON, FALLBACK_RESPONSE, null, Source.FALLBACK);
    }

    /** The coordinator answered itself; no specialist call is needed. */
    public boolean isDirect() {
        return directResponse != null && !directResponse.isBlank();
    }
}
