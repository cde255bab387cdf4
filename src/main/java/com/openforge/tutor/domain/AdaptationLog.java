package com.openforge.tutor.domain;

import jakarta.persistence.*;
import lombok.*;

/** One row per generated turn recording which adaptations were in force. */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "adaptation_logs")
public class AdaptationLog extends BaseEntity {

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "lesson_id", nullable = false, length = 64)
    private String lessonId;

    @Column(name = "session_id", nullable = false, length = 64)
    private String sessionId;

    @Column(name = "mastery_level", nullable = false)
    private Integer masteryLevel;

    @Column(name = "learning_style", length = 32)
    private String learningStyle;

    /** simplified | standard | accelerated */
    @Column(name = "difficulty_level", nullable = false, length = 16)
    private String difficultyLevel;

    /** minimal | standard | high */
    @Column(name = "scaffolding_level", nullable = false, length = 16)
    private String scaffoldingLevel;

    @Column(name = "response_preview", length = 255)
    private String responsePreview;

    @Column(name = "has_svg", nullable = false)
    private boolean hasSvg;

    @Column(name = "directive_count", nullable = false)
    private int directiveCount;
}
