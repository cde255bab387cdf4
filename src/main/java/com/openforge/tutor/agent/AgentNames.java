package com.openforge.tutor.agent;

import java.util.Map;

/** Canonical agent names as stored in {@code ai_agents.name}. */
public final class AgentNames {

    public static final String COORDINATOR         = "coordinator";
    public static final String MATH_SPECIALIST     = "math_specialist";
    public static final String SCIENCE_SPECIALIST  = "science_specialist";
    public static final String ENGLISH_SPECIALIST  = "english_specialist";
    public static final String HISTORY_SPECIALIST  = "history_specialist";
    public static final String ART_SPECIALIST      = "art_specialist";
    public static final String ASSESSOR            = "assessor";
    public static final String MOTIVATOR           = "motivator";
    public static final String VALIDATOR           = "validator";

    /** Routing target meaning "the coordinator answers itself". */
    public static final String SELF = "self";

    /** Short names the coordinator model sometimes returns instead of the canonical ones. */
    static final Map<String, String> ALIASES = Map.of(
            "math",    MATH_SPECIALIST,
            "science", SCIENCE_SPECIALIST,
            "english", ENGLISH_SPECIALIST,
            "history", HISTORY_SPECIALIST,
            "art",     ART_SPECIALIST
    );

    private AgentNames() {}

    public static String resolveAlias(String name) {
        if (name == null) return null;
        String trimmed = name.trim();
        return ALIASES.getOrDefault(trimmed, trimmed);
    }

    public static boolean isCoordinator(String name) {
        return COORDINATOR.equals(name) || SELF.equals(name);
    }
}
