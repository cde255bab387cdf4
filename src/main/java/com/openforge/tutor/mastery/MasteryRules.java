package com.openforge.tutor.mastery;

import com.openforge.tutor.domain.SubjectConfiguration;

/**
 * Thresholds a student must meet, all at once, to be considered to have
 * mastered a lesson.  Quality values are on the 0-100 evidence scale.
 */
public record MasteryRules(
        int minCorrectAnswers,
        double minExplanationQuality,
        int minApplicationAttempts,
        double minOverallQuality,
        double maxStruggleRatio,
        double minTimeSpentMinutes
) {

    /** Applied when no subject_configurations row matches the subject and grade. */
    public static final MasteryRules DEFAULTS = new MasteryRules(3, 0, 0, 60, 0.4, 3);

    public static MasteryRules from(SubjectConfiguration config) {
        return new MasteryRules(
                config.getMinCorrectAnswers(),
                config.getMinExplanationQuality(),
                config.getMinApplicationAttempts(),
                config.getMinOverallQuality(),
                config.getMaxStruggleRatio(),
                config.getMinTimeSpentMinutes());
    }
}
