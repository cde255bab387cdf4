package com.openforge.tutor.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * Stored progress snapshot for a (user, lesson).  Only a fallback source
 * for the mastery score when no evidence exists yet.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "lesson_progress")
public class LessonProgress extends BaseEntity {

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "lesson_id", nullable = false, length = 64)
    private String lessonId;

    @Column(name = "mastery_level", nullable = false)
    private Integer masteryLevel;
}
