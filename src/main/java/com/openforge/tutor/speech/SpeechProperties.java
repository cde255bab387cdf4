package com.openforge.tutor.speech;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.Map;

/**
 * Binds tutor.speech.* from application.yml.
 *
 * maxParallelChunks   synthesis calls allowed in flight per turn
 * failureThreshold   failed chunks after which a turn stops synthesising progressively
 * maxChunkLength   longest text sent in one synthesis call
 * voices   per-agent voice overrides, merged over the built-in table
 */
@Validated
@ConfigurationProperties(prefix = "tutor.speech")
public record SpeechProperties(
        @DefaultValue("https://texttospeech.googleapis.com/v1") String baseUrl,
        String apiKey,
        @DefaultValue("en-US") String languageCode,
        @DefaultValue("MP3")   String audioEncoding,
        @DefaultValue("1.0")   double speakingRate,
        @DefaultValue("0.0")   double pitch,
        @DefaultValue("15")    int timeoutSeconds,
        @DefaultValue("6")     @Min(1) int maxParallelChunks,
        @DefaultValue("3")     @Min(1) int failureThreshold,
        @DefaultValue("200")   @Min(20) int maxChunkLength,
        Map<String, String> voices
) {

    public static SpeechProperties defaults() {
        return new SpeechProperties("https://texttospeech.googleapis.com/v1", null,
                "en-US", "MP3", 1.0, 0.0, 15, 6, 3, 200, Map.of());
    }
}
