package com.openforge.tutor.agent;

import com.openforge.tutor.context.AgentContext;
import com.openforge.tutor.context.ConversationTurn;
import com.openforge.tutor.domain.Agent;
import com.openforge.tutor.domain.Lesson;
import com.openforge.tutor.llm.model.ContentPart;
import com.openforge.tutor.llm.model.Message;
import com.openforge.tutor.profile.LearnerProfile;
import com.openforge.tutor.teaching.TeachingProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the per-turn prompt for a teaching agent.
 *
 * With a cached instruction set the agent's system prompt already lives in
 * the provider cache, so the prompt only names the agent.  Without one the
 * system prompt is sent as a system message.
 */
@Component
public class PromptBuilder {

    private static final String JSON_GUIDANCE = """
            IMPORTANT: Respond using the structured JSON schema provided by the system.
            Key field guidance:
            - audioText: Natural spoken language (what you SAY to the student). No code or symbols.
            - displayText: Written board notes with markdown (what you WRITE). No SVG code here.
            - svg: Full SVG diagram string, or null. SVG code goes ONLY here.
            - teachingPhase: Your current Teaching Progression phase (1-5). Report accurately.
            - lessonComplete: Set to true ONLY when you have completed Phase 5 and the student has demonstrated mastery. The student will then take an MCQ assessment.
            - handoffRequest: Name of another agent to hand the student to, or null.

            Refer to your TRADITIONAL CLASSROOM FORMAT instructions for audioText vs displayText guidance.""";

    private final TeachingProperties properties;

    public PromptBuilder(TeachingProperties properties) {
        this.properties = properties;
    }

    /**
     * Messages for one agent call.
     *
     * @param cached true when the request will carry a cached instruction handle
     */
    public List<Message> messages(Agent agent, AgentContext context, boolean cached) {
        List<Message> messages = new ArrayList<>(2);
        if (!cached) {
            messages.add(Message.system(agent.getSystemPrompt()));
        }
        messages.add(userMessage(agent, context, cached));
        return messages;
    }

    String prompt(Agent agent, AgentContext context, boolean cached) {
        StringBuilder prompt = new StringBuilder();
        if (cached) {
            prompt.append("You are acting as the \"").append(agent.getName())
                    .append("\" agent. Use the system prompt for \"").append(agent.getName())
                    .append("\" from the cached content.\n\n");
        }

        prompt.append(studentSection(context.profile())).append("\n\n");

        if (context.instructions() != null && !context.instructions().isBlank()) {
            prompt.append(context.instructions()).append("\n\n");
        }

        String history = historySection(context.history());
        if (!history.isEmpty()) {
            prompt.append(history).append('\n');
        }

        if (context.lesson() != null) {
            prompt.append(lessonSection(context.lesson())).append("\n\n");
        }

        if (context.previousAgent() != null) {
            prompt.append("NOTE: Student was just handed off to you from ")
                    .append(context.previousAgent())
                    .append(". Make a smooth transition.\n\n");
        }

        prompt.append(JSON_GUIDANCE).append("\n\n");

        if (context.input() != null && context.input().hasAudio()) {
            prompt.append("Student (via voice):");
        } else {
            prompt.append("Student: ").append(context.input() == null ? "" : context.input().messageOrEmpty());
        }
        return prompt.toString();
    }

    // ── Sections ─────────────────────────────────────────────────────────────

    private Message userMessage(Agent agent, AgentContext context, boolean cached) {
        String text = prompt(agent, context, cached);
        if (context.input() == null || (!context.input().hasAudio() && !context.input().hasMedia())) {
            return Message.user(text);
        }

        List<ContentPart> parts = new ArrayList<>(3);
        parts.add(ContentPart.text(text));
        if (context.input().hasAudio()) {
            parts.add(ContentPart.audio(context.input().audioBase64(), context.input().audioMimeType()));
        }
        if (context.input().hasMedia()) {
            parts.add(ContentPart.image(context.input().mediaBase64(), context.input().mediaMimeType()));
        }
        return Message.user(parts);
    }

    private static String studentSection(LearnerProfile profile) {
        if (profile == null) return "STUDENT PROFILE: (unknown)";
        StringBuilder sb = new StringBuilder("STUDENT PROFILE:\n")
                .append("- Name: ").append(profile.name()).append('\n')
                .append("- Age: ").append(profile.age()).append(" years old\n")
                .append("- Grade Level: ").append(profile.gradeLevel());
        if (profile.hasLearningStyle()) {
            sb.append("\n- Learning Style: ").append(profile.learningStyle());
        }
        if (!profile.strengths().isEmpty()) {
            sb.append("\n- Strengths: ").append(String.join(", ", profile.strengths()));
        }
        if (!profile.struggles().isEmpty()) {
            sb.append("\n- Areas to improve: ").append(String.join(", ", profile.struggles()));
        }
        return sb.toString();
    }

    private String historySection(List<ConversationTurn> history) {
        if (history.isEmpty()) return "";
        int from = Math.max(0, history.size() - properties.promptHistorySize());
        StringBuilder sb = new StringBuilder("RECENT CONVERSATION:\n");
        for (ConversationTurn turn : history.subList(from, history.size())) {
            String reply = turn.agentResponse() == null ? "" : turn.agentResponse();
            if (reply.length() > properties.historyResponsePreview()) {
                reply = reply.substring(0, properties.historyResponsePreview());
            }
            sb.append("Student: ").append(turn.userMessage()).append('\n')
              .append("Teacher: ").append(reply).append("...\n\n");
        }
        return sb.toString();
    }

    private static String lessonSection(Lesson lesson) {
        return "CURRENT LESSON:\n"
                + "- Title: " + lesson.getTitle() + "\n"
                + "- Subject: " + lesson.getSubject() + "\n"
                + "- Objective: " + lesson.getLearningObjective();
    }
}
