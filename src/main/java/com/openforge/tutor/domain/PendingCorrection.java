package com.openforge.tutor.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A specialist response the validator rejected, queued so the next turn
 * in the same session can acknowledge and fix it.
 *
 * Lifecycle: PENDING → DELIVERED, exactly once.  The transition is a
 * conditional UPDATE in PendingCorrectionRepository; rows are never deleted.
 *
 * JSON columns:
 *   original_response   snapshot {audioText, displayText, svg}
 *   validation_issues   List<String>
 *   required_fixes   List<String>
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "pending_corrections",
    indexes = @Index(name = "idx_correction_session_status", columnList = "session_id, status, create_time")
)
public class PendingCorrection extends BaseEntity {

    public enum CorrectionStatus {
        PENDING,
        DELIVERED
    }

    @Column(name = "session_id", nullable = false, length = 64)
    private String sessionId;

    @Column(name = "specialist_name", nullable = false, length = 64)
    private String specialistName;

    @Column(name = "original_response", nullable = false, columnDefinition = "TEXT")
    private String originalResponse;

    @Column(name = "validation_issues", nullable = false, columnDefinition = "TEXT")
    private String validationIssues;

    @Column(name = "required_fixes", nullable = false, columnDefinition = "TEXT")
    private String requiredFixes;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CorrectionStatus status = CorrectionStatus.PENDING;

    @Column(name = "delivered_at")
    private Instant deliveredAt;
}
