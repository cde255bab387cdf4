package com.openforge.tutor.domain;

import jakarta.persistence.*;
import lombok.*;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Persistent learner profile.  Strengths and struggles grow over time as
 * ProfileEnricher spots patterns in the evidence stream.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "student_profiles",
    uniqueConstraints = @UniqueConstraint(name = "uq_profile_user", columnNames = "user_id")
)
public class StudentProfile extends BaseEntity {

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(nullable = false, length = 128)
    private String name;

    private Integer age;

    @Column(name = "grade_level")
    private Integer gradeLevel;

    /** visual | auditory | kinesthetic | reading-writing | logical | social | solitary */
    @Column(name = "learning_style", length = 32)
    private String learningStyle;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "student_strengths", joinColumns = @JoinColumn(name = "profile_id"))
    @Column(name = "topic", length = 255)
    private Set<String> strengths = new LinkedHashSet<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "student_struggles", joinColumns = @JoinColumn(name = "profile_id"))
    @Column(name = "topic", length = 255)
    private Set<String> struggles = new LinkedHashSet<>();
}
