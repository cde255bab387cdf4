package com.openforge.tutor.testutil;

import com.openforge.tutor.cache.CacheProperties;
import com.openforge.tutor.domain.Agent;
import com.openforge.tutor.domain.EvidenceRecord;
import com.openforge.tutor.domain.EvidenceType;
import com.openforge.tutor.domain.Lesson;
import com.openforge.tutor.llm.model.ChatResponse;
import com.openforge.tutor.llm.model.Message;
import com.openforge.tutor.profile.LearnerProfile;

import java.util.List;

/** Canned domain objects shared by the unit tests. */
public final class Fixtures {

    public static final String USER    = "user-1";
    public static final String SESSION = "session-1";
    public static final String LESSON  = "lesson-fractions";

    private Fixtures() {}

    public static CacheProperties cacheProperties() {
        return new CacheProperties("https://cache.test/v1beta", "key", 7200, 90, 5, 60, 5, 30);
    }

    public static Agent agent(String name, String model) {
        return Agent.builder()
                .name(name)
                .role(name.endsWith("_specialist") ? Agent.AgentRole.SUBJECT : Agent.AgentRole.SUPPORT)
                .model(model)
                .systemPrompt("You are " + name + ".")
                .build();
    }

    public static Lesson lesson() {
        return Lesson.builder()
                .lessonId(LESSON)
                .title("Adding Fractions")
                .subject("math")
                .gradeLevel(4)
                .learningObjective("Add fractions with like denominators")
                .build();
    }

    public static LearnerProfile profile(String learningStyle) {
        return LearnerProfile.builder()
                .userId(USER)
                .name("Sam")
                .age(9)
                .gradeLevel(4)
                .learningStyle(learningStyle)
                .strengths(List.of("counting"))
                .struggles(List.of())
                .build();
    }

    public static EvidenceRecord evidence(EvidenceType type, Integer quality) {
        return EvidenceRecord.builder()
                .userId(USER)
                .lessonId(LESSON)
                .sessionId(SESSION)
                .evidenceType(type)
                .content("student said something")
                .qualityScore(quality)
                .confidence(0.9)
                .build();
    }

    public static ChatResponse chatResponse(String text) {
        return new ChatResponse("resp-1", "chat.completion", 0L, "test-model",
                List.of(new ChatResponse.Choice(0, Message.assistantText(text), "stop")), null);
    }
}
