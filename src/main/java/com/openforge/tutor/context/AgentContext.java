package com.openforge.tutor.context;

import com.openforge.tutor.domain.Lesson;
import com.openforge.tutor.profile.LearnerProfile;
import lombok.Builder;

import java.util.List;

/**
 * The per-agent view of a turn handed to the response generator.
 *
 * {@code instructions} is the prepended block: mastery tag, then the
 * self-correction block when one is pending, then the adaptive directives.
 * {@code previousAgent} is set on handoffs so the new agent can pick up smoothly.
 */
@Builder(toBuilder = true)
public record AgentContext(
        String userId,
        String sessionId,
        String lessonId,
        LearnerProfile profile,
        List<ConversationTurn> history,
        Lesson lesson,
        StudentInput input,
        String instructions,
        String previousAgent
) {

    public AgentContext {
        history = history == null ? List.of() : List.copyOf(history);
    }

    public AgentContext handedOffFrom(String agentName) {
        return toBuilder().previousAgent(agentName).build();
    }
}
