package com.openforge.tutor.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

/**
 * One observation of student performance.
 *
 * Rows are never updated; Hibernate ignores dirty state on @Immutable
 * entities, so only INSERT ever reaches the table.  Mastery is always
 * an aggregate over these rows.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Immutable
@Entity
@Table(
    name = "mastery_evidence",
    indexes = {
        @Index(name = "idx_evidence_user_lesson", columnList = "user_id, lesson_id"),
        @Index(name = "idx_evidence_session", columnList = "session_id")
    }
)
public class EvidenceRecord extends BaseEntity {

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "lesson_id", nullable = false, length = 64)
    private String lessonId;

    @Column(name = "session_id", length = 64)
    private String sessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "evidence_type", nullable = false, length = 32)
    private EvidenceType evidenceType;

    @Column(columnDefinition = "TEXT")
    private String content;

    /** 0-100; null or 0 means "not quality-scored". */
    @Column(name = "quality_score")
    private Integer qualityScore;

    /** Classifier confidence 0-1. */
    private Double confidence;

    /** Topic the evidence was observed on (the lesson title). */
    @Column(length = 255)
    private String context;
}
