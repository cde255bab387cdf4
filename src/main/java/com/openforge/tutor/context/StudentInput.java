package com.openforge.tutor.context;

/**
 * What the student sent this turn: text, recorded audio, an image, or a mix.
 * Binary payloads are base64.
 */
public record StudentInput(
        String message,
        String audioBase64,
        String audioMimeType,
        String mediaBase64,
        String mediaMimeType
) {

    public static StudentInput text(String message) {
        return new StudentInput(message, null, null, null, null);
    }

    public boolean hasText() {
        return message != null && !message.isBlank();
    }

    public boolean hasAudio() {
        return audioBase64 != null && !audioBase64.isBlank() && audioMimeType != null;
    }

    public boolean hasMedia() {
        return mediaBase64 != null && !mediaBase64.isBlank() && mediaMimeType != null;
    }

    /** Message text, or an empty string for audio/media-only turns. */
    public String messageOrEmpty() {
        return message == null ? "" : message;
    }
}
