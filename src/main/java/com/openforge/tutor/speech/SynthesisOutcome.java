package com.openforge.tutor.speech;

import java.util.List;

/**
 * Result of one progressive synthesis run.
 *
 * @param audio            ordered concatenation of the successful segments; null when
 *                         {@code fallbackRequired}
 * @param sentences        sentences extracted from the stream, in arrival order
 * @param segments         synthesis calls issued
 * @param failures         synthesis calls that failed
 * @param fallbackRequired the caller must synthesise the whole reply in one pass
 */
public record SynthesisOutcome(
        byte[] audio,
        List<String> sentences,
        int segments,
        int failures,
        boolean fallbackRequired
) {

    public static SynthesisOutcome fallback(List<String> sentences, int segments, int failures) {
        return new SynthesisOutcome(null, List.copyOf(sentences), segments, failures, true);
    }

    public boolean hasAudio() {
        return audio != null && audio.length > 0;
    }
}
