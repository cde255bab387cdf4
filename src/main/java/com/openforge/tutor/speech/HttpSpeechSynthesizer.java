package com.openforge.tutor.speech;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Base64;
import java.util.function.Supplier;

/**
 * Google Cloud Text-to-Speech over REST ({@code POST {base}/text:synthesize}).
 *
 * Request:
 * <pre>
 * { "input": {"text": ...},
 *   "voice": {"languageCode": "en-US", "name": "en-US-Neural2-F"},
 *   "audioConfig": {"audioEncoding": "MP3", "speakingRate": 1.0, "pitch": 0.0} }
 * </pre>
 * Response carries base64 audio in {@code audioContent}.
 *
 * Every call goes through the "speech" circuit breaker and retry.
 */
@Slf4j
@Component
public class HttpSpeechSynthesizer implements SpeechSynthesizer {

    private final HttpClient       httpClient;
    private final ObjectMapper     objectMapper;
    private final SpeechProperties properties;
    private final CircuitBreaker   circuitBreaker;
    private final Retry            retry;

    public HttpSpeechSynthesizer(HttpClient httpClient,
                                 ObjectMapper objectMapper,
                                 SpeechProperties properties,
                                 CircuitBreaker speechCircuitBreaker,
                                 Retry speechRetry) {
        this.httpClient     = httpClient;
        this.objectMapper   = objectMapper;
        this.properties     = properties;
        this.circuitBreaker = speechCircuitBreaker;
        this.retry          = speechRetry;
    }

    @Override
    public byte[] synthesize(String text, String voice) {
        if (text == null || text.isBlank()) {
            throw new SpeechSynthesisException("Text input is required and must be non-empty");
        }
        Supplier<byte[]> decorated = CircuitBreaker.decorateSupplier(circuitBreaker,
                Retry.decorateSupplier(retry, () -> call(text, voice)));
        try {
            return decorated.get();
        } catch (SpeechSynthesisException e) {
            throw e;
        } catch (Exception e) {
            throw new SpeechSynthesisException("Speech synthesis failed: " + e.getMessage(), e);
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private byte[] call(String text, String voice) {
        ObjectNode body = objectMapper.createObjectNode();
        body.putObject("input").put("text", text);
        body.putObject("voice")
                .put("languageCode", properties.languageCode())
                .put("name", voice);
        body.putObject("audioConfig")
                .put("audioEncoding", properties.audioEncoding())
                .put("speakingRate", properties.speakingRate())
                .put("pitch", properties.pitch());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(properties.baseUrl() + "/text:synthesize"))
                .header("Content-Type", "application/json")
                .header("x-goog-api-key", properties.apiKey() == null ? "" : properties.apiKey())
                .timeout(Duration.ofSeconds(properties.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SpeechSynthesisException("Interrupted while calling speech endpoint", e);
        } catch (IOException e) {
            throw new SpeechSynthesisException("Network error calling speech endpoint", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new SpeechSynthesisException("Speech endpoint returned HTTP %d: %s"
                    .formatted(response.statusCode(), response.body()));
        }

        String audio;
        try {
            JsonNode json = objectMapper.readTree(response.body());
            audio = json.path("audioContent").asText("");
        } catch (IOException e) {
            throw new SpeechSynthesisException("Unreadable speech response", e);
        }
        if (audio.isEmpty()) {
            throw new SpeechSynthesisException("No audio content received from speech service");
        }
        log.debug("[Speech] Synthesised {} chars with {}", text.length(), voice);
        return Base64.getDecoder().decode(audio);
    }
}
