package com.openforge.tutor.speech;

import com.openforge.tutor.testutil.SyncExecutor;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProgressiveSynthesisPipelineTest {

    private final FakeSynthesizer synthesizer = new FakeSynthesizer();

    private ProgressiveSynthesisPipeline pipeline(java.util.concurrent.Executor executor, int maxParallel) {
        return new ProgressiveSynthesisPipeline(synthesizer, "voice-a", executor, maxParallel, 3, 200);
    }

    @Test
    void streamsTwoSentencesInOrder() {
        ProgressiveSynthesisPipeline pipeline = pipeline(new SyncExecutor(), 6);

        pipeline.accept("{\"audioText\": \"Hel");
        pipeline.accept("lo there. How");
        pipeline.accept(" are you today?\"");
        pipeline.accept(", \"displayText\": \"Hello\"}");
        SynthesisOutcome outcome = pipeline.finish("Hello there. How are you today?");

        assertThat(outcome.sentences()).containsExactly("Hello there.", "How are you today?");
        assertThat(outcome.fallbackRequired()).isFalse();
        assertThat(FakeSynthesizer.decode(outcome.audio())).isEqualTo("[Hello there.][How are you today?]");
        assertThat(synthesizer.voices).containsOnly("voice-a");
        assertThat(pipeline.phase()).isEqualTo(ProgressiveSynthesisPipeline.Phase.DONE);
    }

    @Test
    void reassemblesByIndexNotCompletionOrder() throws Exception {
        CountDownLatch secondDone = new CountDownLatch(1);
        SpeechSynthesizer outOfOrder = (text, voice) -> {
            if (text.startsWith("First")) {
                try {
                    secondDone.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            } else {
                secondDone.countDown();
            }
            return FakeSynthesizer.audioOf(text);
        };
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            ProgressiveSynthesisPipeline pipeline =
                    new ProgressiveSynthesisPipeline(outOfOrder, "v", executor, 2, 3, 200);

            pipeline.accept("{\"audioText\": \"First sentence here. Second sentence here.\"}");
            SynthesisOutcome outcome = pipeline.finish(null);

            assertThat(FakeSynthesizer.decode(outcome.audio()))
                    .isEqualTo("[First sentence here.][Second sentence here.]");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void neverExceedsParallelLimit() {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        SpeechSynthesizer slow = (text, voice) -> {
            int now = active.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(30);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            active.decrementAndGet();
            return FakeSynthesizer.audioOf(text);
        };
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            ProgressiveSynthesisPipeline pipeline = new ProgressiveSynthesisPipeline(slow, "v", executor, 2, 3, 200);

            pipeline.accept("{\"audioText\": \"One. Two. Three. Four. Five. Six.\"}");
            SynthesisOutcome outcome = pipeline.finish(null);

            assertThat(outcome.segments()).isEqualTo(6);
            assertThat(peak.get()).isLessThanOrEqualTo(2);
            assertThat(FakeSynthesizer.decode(outcome.audio())).isEqualTo("[One.][Two.][Three.][Four.][Five.][Six.]");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void trailingTextWithoutPunctuationIsSpokenOnFinish() {
        ProgressiveSynthesisPipeline pipeline = pipeline(new SyncExecutor(), 6);

        pipeline.accept("{\"audioText\": \"Let's count. One, two, three");
        pipeline.accept("\"}");
        SynthesisOutcome outcome = pipeline.finish("ignored because the field was streamed");

        assertThat(outcome.sentences()).containsExactly("Let's count.", "One, two, three");
        assertThat(FakeSynthesizer.decode(outcome.audio())).isEqualTo("[Let's count.][One, two, three]");
    }

    @Test
    void usesFinalTextWhenFieldNeverStreamed() {
        ProgressiveSynthesisPipeline pipeline = pipeline(new SyncExecutor(), 6);

        pipeline.accept("not json at all");
        SynthesisOutcome outcome = pipeline.finish("Recovered reply.");

        assertThat(outcome.sentences()).containsExactly("Recovered reply.");
        assertThat(FakeSynthesizer.decode(outcome.audio())).isEqualTo("[Recovered reply.]");
    }

    @Test
    void longSentencesAreCutBeforeDispatch() {
        ProgressiveSynthesisPipeline pipeline =
                new ProgressiveSynthesisPipeline(synthesizer, "v", new SyncExecutor(), 6, 3, 20);

        pipeline.accept("{\"audioText\": \"" + "a".repeat(15) + ", " + "b".repeat(15) + ".\"}");
        SynthesisOutcome outcome = pipeline.finish(null);

        assertThat(synthesizer.texts).containsExactly("a".repeat(15) + ",", "b".repeat(15) + ".");
        assertThat(outcome.segments()).isEqualTo(2);
    }

    @Test
    void isolatedFailuresAreSkipped() {
        synthesizer.failWhen = text -> text.startsWith("Two");
        ProgressiveSynthesisPipeline pipeline = pipeline(new SyncExecutor(), 6);

        pipeline.accept("{\"audioText\": \"One. Two. Three.\"}");
        SynthesisOutcome outcome = pipeline.finish(null);

        assertThat(outcome.fallbackRequired()).isFalse();
        assertThat(outcome.failures()).isEqualTo(1);
        assertThat(FakeSynthesizer.decode(outcome.audio())).isEqualTo("[One.][Three.]");
    }

    @Test
    void failureThresholdHaltsDispatchAndRequestsFallback() {
        synthesizer.failWhen = text -> true;
        ProgressiveSynthesisPipeline pipeline = pipeline(new SyncExecutor(), 6);

        pipeline.accept("{\"audioText\": \"One. Two. Three. Four. Five.\"}");
        SynthesisOutcome outcome = pipeline.finish(null);

        assertThat(pipeline.halted()).isTrue();
        assertThat(synthesizer.texts).hasSize(3);
        assertThat(outcome.fallbackRequired()).isTrue();
        assertThat(outcome.audio()).isNull();
        assertThat(outcome.hasAudio()).isFalse();
    }

    @Test
    void abandonDiscardsAudio() {
        ProgressiveSynthesisPipeline pipeline = pipeline(new SyncExecutor(), 6);
        pipeline.accept("{\"audioText\": \"One. Two.\"}");

        SynthesisOutcome outcome = pipeline.abandon();

        assertThat(outcome.fallbackRequired()).isTrue();
        assertThat(pipeline.halted()).isTrue();
    }

    @Test
    void rejectsFragmentsAfterFinish() {
        ProgressiveSynthesisPipeline pipeline = pipeline(new SyncExecutor(), 6);
        pipeline.finish("Done.");

        assertThatThrownBy(() -> pipeline.accept("more"))
                .isInstanceOf(IllegalStateException.class);
    }
}
