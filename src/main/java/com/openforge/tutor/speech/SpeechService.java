package com.openforge.tutor.speech;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for everything audio.
 *
 *   synthesize()   one call, short text
 *   synthesizeFullText()   whole reply: sentence split, grouped, parallel, ordered
 *   newPipeline()   progressive synthesis for a reply that is still streaming
 */
@Slf4j
@Service
public class SpeechService {

    private final SpeechSynthesizer synthesizer;
    private final VoiceCatalog      voices;
    private final ExecutorService   executor;
    private final SpeechProperties  properties;

    public SpeechService(SpeechSynthesizer synthesizer,
                         VoiceCatalog voices,
                         ExecutorService tutorTaskExecutor,
                         SpeechProperties properties) {
        this.synthesizer = synthesizer;
        this.voices      = voices;
        this.executor    = tutorTaskExecutor;
        this.properties  = properties;
    }

    public byte[] synthesize(String text, String agentName) {
        return synthesizer.synthesize(text, voices.voiceFor(agentName));
    }

    /**
     * Full-text synthesis used when no progressive audio is available.
     * Short or single-sentence text goes out as one call; longer text is split
     * into at most {@code maxParallelChunks} groups synthesised in parallel and
     * concatenated in order.  Any failed group fails the whole call.
     */
    public byte[] synthesizeFullText(String text, String agentName) {
        if (text == null || text.isBlank()) {
            throw new SpeechSynthesizer.SpeechSynthesisException("Text input is required and must be non-empty");
        }

        List<String> sentences = SentenceChunker.splitIntoSentences(text);
        if (sentences.size() <= 1 || text.length() < SentenceChunker.MIN_CHUNK_LENGTH * 2) {
            return synthesize(text, agentName);
        }

        String voice = voices.voiceFor(agentName);
        List<String> chunks = SentenceChunker.group(sentences, properties.maxParallelChunks());
        log.debug("[Speech] Synthesising {} chunks in parallel for {}", chunks.size(), agentName);

        List<CompletableFuture<byte[]>> calls = chunks.stream()
                .map(chunk -> CompletableFuture.supplyAsync(() -> synthesizer.synthesize(chunk, voice), executor))
                .toList();

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            for (CompletableFuture<byte[]> call : calls) {
                out.writeBytes(call.join());
            }
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new SpeechSynthesizer.SpeechSynthesisException(
                    "Chunked synthesis failed: " + cause.getMessage(), cause);
        }
        return out.toByteArray();
    }

    /** A fresh pipeline for one streamed reply spoken by {@code agentName}. */
    public ProgressiveSynthesisPipeline newPipeline(String agentName) {
        return new ProgressiveSynthesisPipeline(
                synthesizer,
                voices.voiceFor(agentName),
                executor,
                properties.maxParallelChunks(),
                properties.failureThreshold(),
                properties.maxChunkLength());
    }
}
