package com.openforge.tutor.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * Per subject and grade mastery thresholds.  Missing rows mean the
 * built-in defaults apply.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "subject_configurations",
    uniqueConstraints = @UniqueConstraint(name = "uq_subject_grade", columnNames = {"subject", "grade_level"})
)
public class SubjectConfiguration extends BaseEntity {

    @Column(nullable = false, length = 64)
    private String subject;

    @Column(name = "grade_level", nullable = false)
    private Integer gradeLevel;

    @Column(name = "min_correct_answers", nullable = false)
    private int minCorrectAnswers;

    @Column(name = "min_explanation_quality", nullable = false)
    private double minExplanationQuality;

    @Column(name = "min_application_attempts", nullable = false)
    private int minApplicationAttempts;

    @Column(name = "min_overall_quality", nullable = false)
    private double minOverallQuality;

    @Column(name = "max_struggle_ratio", nullable = false)
    private double maxStruggleRatio;

    @Column(name = "min_time_spent_minutes", nullable = false)
    private double minTimeSpentMinutes;
}
