package com.openforge.tutor.speech;

import com.openforge.tutor.response.TeachingResponseParser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls finished sentences out of the {@code audioText} field of a JSON
 * reply while the reply is still streaming in.
 *
 * The buffer grows with every fragment.  On each append the (possibly
 * unterminated) field value is located, unescaped, and scanned for
 * sentences past the point already consumed.  Consumption only moves
 * forward, so each sentence is returned exactly once.
 *
 * Not thread-safe: one instance per streamed reply, fed from the stream thread.
 */
public class SentenceExtractor {

    // group 1: the value so far; group 2: the closing quote once it has arrived
    private static final Pattern AUDIO_TEXT_FIELD = Pattern.compile(
            "\"audioText\"\\s*+:\\s*+\"([^\"\\\\]*+(?:\\\\.[^\"\\\\]*+)*+)(\")?");

    private static final Pattern SENTENCE = Pattern.compile("[^.!?]+[.!?]+");

    private final StringBuilder buffer = new StringBuilder();
    private int     consumed;
    private boolean fieldSeen;
    private boolean fieldComplete;
    private String  fieldText = "";

    /**
     * Adds a stream fragment and returns the sentences it completed, trimmed,
     * in order.
     */
    public List<String> append(String fragment) {
        buffer.append(fragment);
        List<String> sentences = new ArrayList<>();
        if (fieldComplete) return sentences;

        Matcher field = AUDIO_TEXT_FIELD.matcher(buffer);
        if (!field.find()) return sentences;

        fieldSeen     = true;
        fieldComplete = field.group(2) != null;
        fieldText     = TeachingResponseParser.unescapeJsonString(field.group(1));

        if (consumed >= fieldText.length()) return sentences;

        Matcher m = SENTENCE.matcher(fieldText);
        m.region(consumed, fieldText.length());
        int end = consumed;
        while (m.find()) {
            String sentence = m.group().trim();
            if (!sentence.isEmpty()) sentences.add(sentence);
            end = m.end();
        }
        consumed = end;
        return sentences;
    }

    /** Unescaped field text that has not been returned as a sentence yet. */
    public String remainder() {
        return consumed >= fieldText.length() ? "" : fieldText.substring(consumed).trim();
    }

    public boolean fieldSeen() {
        return fieldSeen;
    }

    public boolean fieldComplete() {
        return fieldComplete;
    }

    /** Everything streamed so far, verbatim. */
    public String buffered() {
        return buffer.toString();
    }
}
