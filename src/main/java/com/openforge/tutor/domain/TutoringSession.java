package com.openforge.tutor.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One tutoring conversation between a student and the agent team for a lesson.
 *
 * The active responder is deliberately NOT a column here.  It is derived
 * from the newest row in agent_interactions for the session, so there is
 * no second source of truth to keep in sync.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "tutoring_sessions",
    uniqueConstraints = @UniqueConstraint(name = "uq_tutoring_session_id", columnNames = "session_id")
)
public class TutoringSession extends BaseEntity {

    public enum SessionStatus {
        ACTIVE,
        COMPLETED,
        ABANDONED
    }

    /** External UUID passed in by the caller. */
    @Column(name = "session_id", nullable = false, length = 64)
    private String sessionId;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "lesson_id", nullable = false, length = 64)
    private String lessonId;

    /** Feeds the time-spent mastery criterion. */
    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SessionStatus status = SessionStatus.ACTIVE;
}
