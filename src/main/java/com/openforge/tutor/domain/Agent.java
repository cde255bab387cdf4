package com.openforge.tutor.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * A teaching agent: the coordinator, a subject specialist, or a support role
 * (assessor, motivator, validator).
 *
 * Rows are read-only from the engine's point of view.  AgentRegistry loads
 * every ACTIVE row and keeps the set for a short TTL; edits show up on the
 * next refresh or after an explicit invalidate.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "ai_agents",
    uniqueConstraints = @UniqueConstraint(name = "uq_agent_name", columnNames = "name")
)
public class Agent extends BaseEntity {

    public enum AgentRole {
        COORDINATOR,
        SUBJECT,
        SUPPORT
    }

    public enum AgentStatus {
        ACTIVE,
        INACTIVE
    }

    /** Canonical name, e.g. "math_specialist". */
    @Column(nullable = false, length = 64)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private AgentRole role;

    /** Model identifier; agents sharing a model share one cached instruction set. */
    @Column(nullable = false, length = 128)
    private String model;

    @Column(name = "system_prompt", nullable = false, columnDefinition = "TEXT")
    private String systemPrompt;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AgentStatus status = AgentStatus.ACTIVE;

    /** Capability flag: the provider may ground this agent's answers in web search. */
    @Builder.Default
    @Column(name = "search_grounding", nullable = false)
    private boolean searchGrounding = false;
}
