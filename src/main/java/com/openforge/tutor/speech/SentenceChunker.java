package com.openforge.tutor.speech;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sentence splitting for speech synthesis.
 *
 * Two consumers:
 *   - the progressive pipeline cuts each extracted sentence to the chunk limit
 *   - full-text synthesis splits a whole reply, merges short fragments and
 *     groups the result into a bounded number of parallel calls
 */
public final class SentenceChunker {

    /** Fragments shorter than this sound choppy on their own and are merged. */
    public static final int MIN_CHUNK_LENGTH = 20;

    private static final Pattern SENTENCE = Pattern.compile("[^.!?]+[.!?]+\\s*");

    /** A natural break must sit at or beyond this share of the limit. */
    private static final double NATURAL_BREAK_RATIO = 0.7;

    private SentenceChunker() {}

    /**
     * Cuts {@code sentence} into pieces of at most {@code maxLength} characters,
     * preferring the last comma, semicolon or " - " past 70 % of the limit, then
     * the last space, then a hard cut.
     */
    public static List<String> splitLongSentence(String sentence, int maxLength) {
        List<String> chunks = new ArrayList<>();
        if (sentence.length() <= maxLength) {
            chunks.add(sentence);
            return chunks;
        }

        String remaining = sentence;
        while (remaining.length() > maxLength) {
            String window = remaining.substring(0, maxLength);
            int split = Math.max(window.lastIndexOf(','),
                    Math.max(window.lastIndexOf(';'), window.lastIndexOf(" - ")));

            if (split == -1 || split < maxLength * NATURAL_BREAK_RATIO) {
                split = window.lastIndexOf(' ');
            }
            if (split <= 0) {
                // no usable space either
                split = maxLength - 1;
            }

            String head = remaining.substring(0, split + 1).trim();
            if (!head.isEmpty()) chunks.add(head);
            remaining = remaining.substring(split + 1).trim();
        }
        if (!remaining.isEmpty()) {
            chunks.add(remaining);
        }
        return chunks;
    }

    /**
     * Splits text at terminal punctuation and merges neighbours until every
     * piece is at least {@link #MIN_CHUNK_LENGTH} long.  An unpunctuated tail
     * is kept as its own sentence, so text without any terminal punctuation
     * comes back as a single piece.
     */
    public static List<String> splitIntoSentences(String text) {
        List<String> merged = new ArrayList<>();
        if (text == null || text.isBlank()) return merged;

        List<String> sentences = new ArrayList<>();
        Matcher m = SENTENCE.matcher(text);
        int lastEnd = 0;
        while (m.find()) {
            String s = m.group().trim();
            if (!s.isEmpty()) sentences.add(s);
            lastEnd = m.end();
        }
        // trailing words after the last terminal punctuation
        String tail = text.substring(lastEnd).trim();
        if (!tail.isEmpty()) sentences.add(tail);

        StringBuilder buffer = new StringBuilder();
        for (String sentence : sentences) {
            if (buffer.length() > 0) buffer.append(' ');
            buffer.append(sentence);
            if (buffer.length() >= MIN_CHUNK_LENGTH) {
                merged.add(buffer.toString());
                buffer.setLength(0);
            }
        }
        if (buffer.length() > 0) {
            if (!merged.isEmpty()) {
                int last = merged.size() - 1;
                merged.set(last, merged.get(last) + " " + buffer);
            } else {
                merged.add(buffer.toString());
            }
        }
        return merged;
    }

    /**
     * Joins consecutive sentences so that at most {@code maxGroups} pieces
     * remain, keeping their order.
     */
    public static List<String> group(List<String> sentences, int maxGroups) {
        if (sentences.size() <= maxGroups) {
            return new ArrayList<>(sentences);
        }
        int perGroup = (sentences.size() + maxGroups - 1) / maxGroups;
        List<String> groups = new ArrayList<>();
        for (int i = 0; i < sentences.size(); i += perGroup) {
            groups.add(String.join(" ", sentences.subList(i, Math.min(i + perGroup, sentences.size()))));
        }
        return groups;
    }
}
