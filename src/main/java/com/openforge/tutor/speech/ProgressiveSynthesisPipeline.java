package com.openforge.tutor.speech;

import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Turns a streaming JSON reply into audio sentence by sentence, before the
 * reply has finished generating.
 *
 * <pre>
 *   ACCUMULATING ─► EXTRACTING ─► { CHUNKING ─► SYNTHESIZING }* ─► DRAINING ─► DONE
 * </pre>
 *
 * <ul>
 *   <li>Each fragment is fed to a {@link SentenceExtractor}; every newly finished
 *       sentence is cut to the chunk limit and each piece is dispatched at once.</li>
 *   <li>At most {@code maxParallel} synthesis calls are in flight.  When all permits
 *       are taken, {@link #accept} blocks the stream thread until one call returns.</li>
 *   <li>Every dispatched piece gets the next index; audio is reassembled by index,
 *       never by completion order.</li>
 *   <li>Once {@code failureThreshold} calls have failed, nothing further is dispatched
 *       and {@link #finish} reports that the caller must fall back to full-text
 *       synthesis.</li>
 * </ul>
 *
 * One instance per reply.  {@link #accept} is called from the stream thread only;
 * completions arrive on executor threads.
 */
@Slf4j
public class ProgressiveSynthesisPipeline implements Consumer<String> {

    public enum Phase {
        ACCUMULATING,
        EXTRACTING,
        CHUNKING,
        SYNTHESIZING,
        DRAINING,
        DONE
    }

    private final SpeechSynthesizer synthesizer;
    private final String            voice;
    private final Executor          executor;
    private final int               failureThreshold;
    private final int               maxChunkLength;
    private final Semaphore         permits;

    private final SentenceExtractor                 extractor = new SentenceExtractor();
    private final List<String>                      sentences = new ArrayList<>();
    private final List<CompletableFuture<byte[]>>   segments  = new ArrayList<>();
    private final AtomicInteger                     failures  = new AtomicInteger();

    private volatile Phase   phase = Phase.ACCUMULATING;
    private volatile boolean halted;

    public ProgressiveSynthesisPipeline(SpeechSynthesizer synthesizer,
                                        String voice,
                                        Executor executor,
                                        int maxParallel,
                                        int failureThreshold,
                                        int maxChunkLength) {
        this.synthesizer      = synthesizer;
        this.voice            = voice;
        this.executor         = executor;
        this.failureThreshold = failureThreshold;
        this.maxChunkLength   = maxChunkLength;
        this.permits          = new Semaphore(maxParallel);
    }

    // ── Stream side ──────────────────────────────────────────────────────────

    @Override
    public void accept(String fragment) {
        if (phase == Phase.DRAINING || phase == Phase.DONE) {
            throw new IllegalStateException("Pipeline already finishing; fragment rejected");
        }
        phase = Phase.ACCUMULATING;
        List<String> found = extractor.append(fragment);
        if (found.isEmpty()) return;

        phase = Phase.EXTRACTING;
        for (String sentence : found) {
            sentences.add(sentence);
            dispatchSentence(sentence);
        }
    }

    /**
     * Ends the stream: synthesises whatever trailing text never reached
     * terminal punctuation, waits for every in-flight call and assembles the
     * audio.
     *
     * @param finalAudioText the parsed reply's audioText; used as the trailing
     *                       text when the field never appeared in the stream
     */
    public SynthesisOutcome finish(String finalAudioText) {
        phase = Phase.DRAINING;

        String trailing = extractor.fieldSeen() ? extractor.remainder() : nullToEmpty(finalAudioText).trim();
        if (!trailing.isEmpty()) {
            sentences.add(trailing);
            dispatchSentence(trailing);
            phase = Phase.DRAINING;
        }

        List<byte[]> audio = new ArrayList<>(segments.size());
        for (CompletableFuture<byte[]> segment : segments) {
            audio.add(segment.join());
        }
        phase = Phase.DONE;

        int failed = failures.get();
        List<byte[]> valid = audio.stream().filter(a -> a != null && a.length > 0).toList();
        if (valid.isEmpty() || failed >= failureThreshold) {
            log.warn("[Progressive] {} of {} segments failed, full-text synthesis required",
                    failed, segments.size());
            return SynthesisOutcome.fallback(sentences, segments.size(), failed);
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        valid.forEach(out::writeBytes);
        log.info("[Progressive] Assembled {} segments ({} bytes), {} failures",
                valid.size(), out.size(), failed);
        return new SynthesisOutcome(out.toByteArray(), List.copyOf(sentences), segments.size(), failed, false);
    }

    /**
     * Drops the run without assembling audio, e.g. when the stream was replayed
     * by a fallback provider and the extracted sentences no longer match the reply.
     * In-flight calls are left to finish; their results are discarded.
     */
    public SynthesisOutcome abandon() {
        halted = true;
        phase  = Phase.DONE;
        return SynthesisOutcome.fallback(sentences, segments.size(), failures.get());
    }

    // ── Introspection ────────────────────────────────────────────────────────

    public Phase phase() {
        return phase;
    }

    /** Everything streamed so far. */
    public String streamedText() {
        return extractor.buffered();
    }

    public List<String> sentences() {
        return Collections.unmodifiableList(sentences);
    }

    public boolean halted() {
        return halted;
    }

    // ── Dispatch ─────────────────────────────────────────────────────────────

    private void dispatchSentence(String sentence) {
        if (halted) return;
        phase = Phase.CHUNKING;
        for (String chunk : SentenceChunker.splitLongSentence(sentence, maxChunkLength)) {
            if (halted) return;
            dispatch(chunk);
        }
    }

    private void dispatch(String chunk) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            halted = true;
            return;
        }

        int index = segments.size();
        phase = Phase.SYNTHESIZING;
        CompletableFuture<byte[]> segment;
        try {
            segment = CompletableFuture.supplyAsync(() -> synthesizer.synthesize(chunk, voice), executor);
        } catch (RejectedExecutionException e) {
            segment = CompletableFuture.failedFuture(e);
        }
        segments.add(segment
                .whenComplete((audio, error) -> permits.release())
                .exceptionally(error -> {
                    recordFailure(index, error);
                    return null;
                }));
    }

    private void recordFailure(int index, Throwable error) {
        int failed = failures.incrementAndGet();
        Throwable cause = error.getCause() != null ? error.getCause() : error;
        log.warn("[Progressive] Segment {} failed ({}/{}): {}",
                index, failed, failureThreshold, cause.getMessage());
        if (failed >= failureThreshold && !halted) {
            halted = true;
            log.warn("[Progressive] Failure threshold {} reached, no further segments will be dispatched",
                    failureThreshold);
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
