package com.openforge.tutor.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * Append-only log of turns.  Ordered by create_time it is both the
 * conversation history and the continuity signal for routing.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "agent_interactions",
    indexes = @Index(name = "idx_interaction_session_time", columnList = "session_id, create_time")
)
public class Interaction extends BaseEntity {

    @Column(name = "session_id", nullable = false, length = 64)
    private String sessionId;

    /** Responder that produced {@link #agentResponse}. */
    @Column(name = "agent_name", nullable = false, length = 64)
    private String agentName;

    @Column(name = "user_message", columnDefinition = "TEXT")
    private String userMessage;

    @Column(name = "agent_response", columnDefinition = "TEXT")
    private String agentResponse;

    @Column(name = "routing_reason", length = 512)
    private String routingReason;

    @Column(name = "response_time_ms")
    private Long responseTimeMs;
}
