package com.openforge.tutor.domain;

import jakarta.persistence.*;
import lombok.*;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "lessons",
    uniqueConstraints = @UniqueConstraint(name = "uq_lesson_id", columnNames = "lesson_id")
)
public class Lesson extends BaseEntity {

    @Column(name = "lesson_id", nullable = false, length = 64)
    private String lessonId;

    @Column(nullable = false, length = 255)
    private String title;

    /** math | science | english | history | art … */
    @Column(nullable = false, length = 64)
    private String subject;

    @Column(name = "grade_level", nullable = false)
    private Integer gradeLevel;

    @Column(name = "learning_objective", columnDefinition = "TEXT")
    private String learningObjective;

    /** Optional teaching plan baked into the cached instruction set. */
    @Column(columnDefinition = "TEXT")
    private String curriculum;
}
