package com.openforge.tutor.speech;

import com.openforge.tutor.agent.AgentNames;
import com.openforge.tutor.testutil.SyncExecutor;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpeechServiceTest {

    private final FakeSynthesizer synthesizer = new FakeSynthesizer();

    private SpeechService service(SpeechProperties properties) {
        return new SpeechService(synthesizer, new VoiceCatalog(properties), new SyncExecutor(), properties);
    }

    @Test
    void shortTextIsOneCall() {
        byte[] audio = service(SpeechProperties.defaults()).synthesizeFullText("Hi there. Welcome!", AgentNames.MATH_SPECIALIST);

        assertThat(synthesizer.texts).containsExactly("Hi there. Welcome!");
        assertThat(synthesizer.voices).containsExactly("en-US-Neural2-A");
        assertThat(FakeSynthesizer.decode(audio)).isEqualTo("[Hi there. Welcome!]");
    }

    @Test
    void longTextIsSynthesisedInOrderedGroups() {
        String text = "This is the first sentence. This is the second sentence. "
                + "This is the third sentence. This is the fourth sentence.";
        SpeechProperties defaults = SpeechProperties.defaults();
        SpeechProperties twoChunks = new SpeechProperties(defaults.baseUrl(), null, "en-US", "MP3",
                1.0, 0.0, 15, 2, 3, 200, Map.of());

        byte[] audio = service(twoChunks).synthesizeFullText(text, AgentNames.SCIENCE_SPECIALIST);

        assertThat(synthesizer.texts).containsExactly(
                "This is the first sentence. This is the second sentence.",
                "This is the third sentence. This is the fourth sentence.");
        assertThat(FakeSynthesizer.decode(audio)).isEqualTo(
                "[This is the first sentence. This is the second sentence.]"
                        + "[This is the third sentence. This is the fourth sentence.]");
    }

    @Test
    void unpunctuatedTailIsStillSpoken() {
        String text = "This is the first sentence. This is the second sentence. And here is the final thought";

        byte[] audio = service(SpeechProperties.defaults()).synthesizeFullText(text, AgentNames.MATH_SPECIALIST);

        assertThat(synthesizer.texts).containsExactly(
                "This is the first sentence.",
                "This is the second sentence.",
                "And here is the final thought");
        assertThat(FakeSynthesizer.decode(audio)).contains("final thought");
    }

    @Test
    void anyFailedGroupFailsTheCall() {
        synthesizer.failWhen = text -> text.contains("second");
        String text = "This is the first sentence. This is the second sentence.";

        assertThatThrownBy(() -> service(SpeechProperties.defaults()).synthesizeFullText(text, AgentNames.COORDINATOR))
                .isInstanceOf(SpeechSynthesizer.SpeechSynthesisException.class)
                .hasMessageContaining("Chunked synthesis failed");
    }

    @Test
    void blankTextIsRejected() {
        assertThatThrownBy(() -> service(SpeechProperties.defaults()).synthesizeFullText("  ", AgentNames.COORDINATOR))
                .isInstanceOf(SpeechSynthesizer.SpeechSynthesisException.class);
    }

    @Test
    void configuredVoiceOverridesBuiltIn() {
        SpeechProperties defaults = SpeechProperties.defaults();
        SpeechProperties custom = new SpeechProperties(defaults.baseUrl(), null, "en-US", "MP3",
                1.0, 0.0, 15, 6, 3, 200, Map.of(AgentNames.MATH_SPECIALIST, "en-GB-Neural2-B"));
        VoiceCatalog catalog = new VoiceCatalog(custom);

        assertThat(catalog.voiceFor(AgentNames.MATH_SPECIALIST)).isEqualTo("en-GB-Neural2-B");
        assertThat(catalog.voiceFor(AgentNames.ASSESSOR)).isEqualTo("en-US-Neural2-H");
        assertThat(catalog.voiceFor("unknown")).isEqualTo(VoiceCatalog.DEFAULT_VOICE);
    }

    @Test
    void pipelineSpeaksWithAgentVoice() {
        ProgressiveSynthesisPipeline pipeline = service(SpeechProperties.defaults()).newPipeline(AgentNames.HISTORY_SPECIALIST);

        pipeline.accept("{\"audioText\": \"Long ago.\"}");
        pipeline.finish(null);

        assertThat(synthesizer.voices).containsExactly("en-US-Neural2-D");
    }
}
