package com.openforge.tutor.speech;

/**
 * Text → audio.  One call synthesises one bounded chunk of text.
 *
 * Implementations must be safe to call from several threads at once;
 * the progressive pipeline keeps up to {@link SpeechProperties#maxParallelChunks()}
 * calls in flight.
 */
public interface SpeechSynthesizer {

    /**
     * @param text  plain text, already cut to at most the configured chunk length
     * @param voice provider voice name, e.g. "en-US-Neural2-F"
     * @return encoded audio bytes
     * @throws SpeechSynthesisException if the provider fails or returns no audio
     */
    byte[] synthesize(String text, String voice);

    class SpeechSynthesisException extends RuntimeException {
        public SpeechSynthesisException(String message) { super(message); }
        public SpeechSynthesisException(String message, Throwable cause) { super(message, cause); }
    }
}
