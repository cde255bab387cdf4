package com.openforge.tutor.domain;

import jakarta.persistence.*;
import lombok.*;

/** Audit trail of validator rejections, kept for review of agent prompts. */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "validation_failures")
public class ValidationFailure extends BaseEntity {

    @Column(name = "session_id", nullable = false, length = 64)
    private String sessionId;

    @Column(name = "agent_name", nullable = false, length = 64)
    private String agentName;

    @Column(name = "original_response", columnDefinition = "TEXT")
    private String originalResponse;

    @Column(name = "validation_issues", columnDefinition = "TEXT")
    private String validationIssues;

    @Column(name = "required_fixes", columnDefinition = "TEXT")
    private String requiredFixes;

    @Column(name = "confidence_score")
    private Double confidenceScore;

    @Builder.Default
    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "final_action", length = 64)
    private String finalAction;
}
