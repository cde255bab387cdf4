package com.openforge.tutor.agent;

import com.openforge.tutor.context.AgentContext;
import com.openforge.tutor.context.ConversationTurn;
import com.openforge.tutor.context.StudentInput;
import com.openforge.tutor.domain.Agent;
import com.openforge.tutor.llm.model.ContentPart;
import com.openforge.tutor.llm.model.Message;
import com.openforge.tutor.teaching.TeachingProperties;
import com.openforge.tutor.testutil.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    private final PromptBuilder builder = new PromptBuilder(TeachingProperties.defaults());
    private final Agent math = Fixtures.agent(AgentNames.MATH_SPECIALIST, "gemini-2.5-flash");

    private AgentContext context(StudentInput input, List<ConversationTurn> history) {
        return AgentContext.builder()
                .userId(Fixtures.USER)
                .sessionId(Fixtures.SESSION)
                .lessonId(Fixtures.LESSON)
                .profile(Fixtures.profile("visual"))
                .lesson(Fixtures.lesson())
                .history(history)
                .input(input)
                .instructions("[CURRENT MASTERY: 40/100]")
                .build();
    }

    @Test
    void uncachedCallCarriesSystemPrompt() {
        List<Message> messages = builder.messages(math, context(StudentInput.text("What is 1/4 + 2/4?"), List.of()), false);

        assertThat(messages).hasSize(2);
        assertThat(messages.get(0).role()).isEqualTo("system");
        assertThat(messages.get(0).textContent()).isEqualTo("You are math_specialist.");
        assertThat(messages.get(1).textContent())
                .doesNotContain("cached content")
                .endsWith("Student: What is 1/4 + 2/4?");
    }

    @Test
    void cachedCallNamesTheAgentOnly() {
        List<Message> messages = builder.messages(math, context(StudentInput.text("hi"), List.of()), true);

        assertThat(messages).hasSize(1);
        assertThat(messages.get(0).textContent())
                .startsWith("You are acting as the \"math_specialist\" agent.")
                .doesNotContain("You are math_specialist.");
    }

    @Test
    void sectionsAppearInOrder() {
        String prompt = builder.prompt(math, context(StudentInput.text("hi"), List.of(
                new ConversationTurn("math_specialist", "first", "reply one"))), false);

        assertThat(prompt)
                .contains("- Name: Sam", "- Learning Style: visual", "- Strengths: counting")
                .doesNotContain("Areas to improve");
        assertThat(prompt.indexOf("STUDENT PROFILE"))
                .isLessThan(prompt.indexOf("[CURRENT MASTERY: 40/100]"));
        assertThat(prompt.indexOf("[CURRENT MASTERY"))
                .isLessThan(prompt.indexOf("RECENT CONVERSATION"));
        assertThat(prompt.indexOf("RECENT CONVERSATION"))
                .isLessThan(prompt.indexOf("CURRENT LESSON"));
        assertThat(prompt.indexOf("CURRENT LESSON"))
                .isLessThan(prompt.indexOf("IMPORTANT: Respond using the structured JSON schema"));
    }

    @Test
    void historyIsLimitedAndTruncated() {
        String longReply = "x".repeat(250);
        String prompt = builder.prompt(math, context(StudentInput.text("hi"), List.of(
                new ConversationTurn("math_specialist", "turn-1", "a"),
                new ConversationTurn("math_specialist", "turn-2", "b"),
                new ConversationTurn("math_specialist", "turn-3", "c"),
                new ConversationTurn("math_specialist", "turn-4", longReply))), false);

        assertThat(prompt).doesNotContain("turn-1").contains("turn-2", "turn-3", "turn-4");
        assertThat(prompt).contains("Teacher: " + "x".repeat(200) + "...\n");
        assertThat(prompt).doesNotContain("x".repeat(201));
    }

    @Test
    void handoffNoteNamesPreviousAgent() {
        AgentContext ctx = context(StudentInput.text("hi"), List.of()).handedOffFrom(AgentNames.COORDINATOR);

        assertThat(builder.prompt(math, ctx, false))
                .contains("NOTE: Student was just handed off to you from coordinator. Make a smooth transition.");
    }

    @Test
    void voiceInputBecomesMultipartMessage() {
        StudentInput input = new StudentInput(null, "QUJD", "audio/webm;codecs=opus", "SU1H", "image/png");

        List<Message> messages = builder.messages(math, context(input, List.of()), true);

        assertThat(messages.get(0).content()).isInstanceOf(List.class);
        @SuppressWarnings("unchecked")
        List<ContentPart> parts = (List<ContentPart>) messages.get(0).content();
        assertThat(parts).extracting(ContentPart::type).containsExactly("text", "input_audio", "image_url");
        assertThat(parts.get(0).text()).endsWith("Student (via voice):");
        assertThat(parts.get(1).inputAudio().format()).isEqualTo("webm");
        assertThat(parts.get(2).imageUrl().url()).isEqualTo("data:image/png;base64,SU1H");
    }
}
