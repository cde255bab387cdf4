package com.openforge.tutor.profile;

import com.openforge.tutor.domain.StudentProfile;
import lombok.Builder;

import java.util.List;

/**
 * Immutable snapshot of a student profile, safe to share across the threads
 * of one turn and to keep in the profile read cache.
 */
@Builder
public record LearnerProfile(
        String userId,
        String name,
        Integer age,
        Integer gradeLevel,
        String learningStyle,
        List<String> strengths,
        List<String> struggles
) {

    public LearnerProfile {
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        struggles = struggles == null ? List.of() : List.copyOf(struggles);
    }

    public static LearnerProfile of(StudentProfile entity) {
        return new LearnerProfile(
                entity.getUserId(),
                entity.getName(),
                entity.getAge(),
                entity.getGradeLevel(),
                entity.getLearningStyle(),
                List.copyOf(entity.getStrengths()),
                List.copyOf(entity.getStruggles()));
    }

    public boolean hasLearningStyle() {
        return learningStyle != null && !learningStyle.isBlank();
    }
}
