package com.openforge.tutor.response;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw model output into a normalized {@link TeachingResponse}.
 *
 * Strategies, first success wins:
 *   1. strict   markdown fences stripped, parsed as-is
 *   2. sanitized   raw newlines/tabs inside string literals escaped, parsed again
 *   3. regex   individual fields pulled out of whatever text arrived
 *
 * Every successful parse is then normalized: literal escape sequences in
 * displayText are converted (LaTeX kept intact), embedded SVG is moved into
 * the svg field, and SVG never survives in audioText.
 *
 * Never throws; an unparseable payload comes back as {@link ParseResult#err}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TeachingResponseParser {

    private static final Pattern JSON_BLOCK = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```", Pattern.CASE_INSENSITIVE);

    /** A complete JSON string literal, escapes included. */
    private static final Pattern STRING_LITERAL = Pattern.compile("\"([^\"\\\\]*+(?:\\\\.[^\"\\\\]*+)*+)\"");

    private static final Pattern LESSON_COMPLETE = Pattern.compile("\"lessonComplete\"\\s*:\\s*(true|false)");
    private static final Pattern TEACHING_PHASE  = Pattern.compile("\"teachingPhase\"\\s*:\\s*(\\d+)");

    private final ObjectMapper objectMapper;

    // ── Public API ───────────────────────────────────────────────────────────

    public ParseResult<TeachingResponse> parse(String raw, String agentName) {
        if (raw == null || raw.isBlank()) {
            return ParseResult.err("empty response from " + agentName);
        }
        String cleaned = stripMarkdownJson(raw);

        ParseResult<TeachingResponse> result = strict(cleaned)
                .orElseTry(() -> sanitized(cleaned))
                .orElseTry(() -> regexFields(cleaned));

        if (!result.isOk()) {
            log.warn("[Parser] All strategies failed for {}: {} (raw head: {})",
                    agentName, result.error(), preview(raw));
            return result;
        }
        if (!"strict".equals(result.strategy())) {
            log.warn("[Parser] Recovered {} response via '{}' strategy", agentName, result.strategy());
        }
        return ParseResult.ok(normalize(result.value(), agentName), result.strategy());
    }

    /**
     * Applies escape repair and SVG relocation to an already-structured response.
     */
    public TeachingResponse normalize(TeachingResponse response, String agentName) {
        String svg         = response.svg();
        String displayText = LatexSafeUnescaper.unescape(nullToEmpty(response.displayText()));
        String audioText   = nullToEmpty(response.audioText());

        if ((svg == null || svg.isBlank()) && SvgExtractor.containsSvg(displayText)) {
            SvgExtractor.Extraction extraction = SvgExtractor.extract(displayText);
            if (extraction.found()) {
                svg         = extraction.svg();
                displayText = extraction.cleanedText();
            }
        }
        if (SvgExtractor.containsSvg(audioText)) {
            audioText = SvgExtractor.extract(audioText).cleanedText();
        }

        Integer phase = response.teachingPhase();
        if (phase != null && (phase < 1 || phase > 5)) {
            phase = null;
        }

        return response.toBuilder()
                .audioText(audioText)
                .displayText(displayText)
                .svg(svg == null || svg.isBlank() ? null : svg)
                .teachingPhase(phase)
                .agentName(agentName)
                .build();
    }

    // ── Strategies ───────────────────────────────────────────────────────────

    private ParseResult<TeachingResponse> strict(String json) {
        try {
            TeachingResponse response = objectMapper.readValue(json, TeachingResponse.class);
            return requireText(response, "strict");
        } catch (Exception e) {
            return ParseResult.err("strict: " + e.getMessage());
        }
    }

    private ParseResult<TeachingResponse> sanitized(String json) {
        String sanitized = STRING_LITERAL.matcher(json).replaceAll(m -> Matcher.quoteReplacement(
                m.group()
                        .replace("\n", "\\n")
                        .replace("\r", "\\r")
                        .replace("\t", "\\t")));
        if (sanitized.equals(json)) {
            return ParseResult.err("sanitized: nothing to repair");
        }
        try {
            return requireText(objectMapper.readValue(sanitized, TeachingResponse.class), "sanitized");
        } catch (Exception e) {
            return ParseResult.err("sanitized: " + e.getMessage());
        }
    }

    private ParseResult<TeachingResponse> regexFields(String text) {
        String audioText   = stringField(text, "audioText");
        String displayText = stringField(text, "displayText");
        if (audioText == null && displayText == null) {
            return ParseResult.err("regex: no audioText or displayText found");
        }

        Matcher complete = LESSON_COMPLETE.matcher(text);
        Matcher phase    = TEACHING_PHASE.matcher(text);

        TeachingResponse response = TeachingResponse.builder()
                .audioText(audioText != null ? audioText : displayText)
                .displayText(displayText != null ? displayText : audioText)
                .svg(stringField(text, "svg"))
                .lessonComplete(complete.find() && Boolean.parseBoolean(complete.group(1)))
                .teachingPhase(phase.find() ? Integer.valueOf(phase.group(1)) : null)
                .handoffRequest(stringField(text, "handoffRequest"))
                .handoffMessage(stringField(text, "handoffMessage"))
                .build();
        return ParseResult.ok(response, "regex");
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static ParseResult<TeachingResponse> requireText(TeachingResponse response, String strategy) {
        if (response == null || (response.audioText() == null && response.displayText() == null)) {
            return ParseResult.err(strategy + ": neither audioText nor displayText present");
        }
        return ParseResult.ok(response, strategy);
    }

    /** Extracts and unescapes {@code "name": "..."}; null when absent. */
    static String stringField(String text, String name) {
        Pattern pattern = Pattern.compile("\"" + Pattern.quote(name) + "\"\\s*:\\s*\"([^\"\\\\]*+(?:\\\\.[^\"\\\\]*+)*+)\"");
        Matcher m = pattern.matcher(text);
        return m.find() ? unescapeJsonString(m.group(1)) : null;
    }

    /**
     * Decodes JSON string escapes.  Tolerates a truncated tail (a lone
     * backslash or a short {@code \\u} escape at the end of a partial
     * stream), which is dropped rather than rejected.
     */
    public static String unescapeJsonString(String s) {
        if (s == null || s.indexOf('\\') < 0) return s;
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != '\\') {
                out.append(c);
                continue;
            }
            if (i + 1 >= s.length()) break;
            char next = s.charAt(++i);
            switch (next) {
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                case 't' -> out.append('\t');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case '"', '\\', '/' -> out.append(next);
                case 'u' -> {
                    if (i + 4 >= s.length()) {
                        i = s.length();
                        break;
                    }
                    try {
                        out.append((char) Integer.parseInt(s.substring(i + 1, i + 5), 16));
                    } catch (NumberFormatException e) {
                        out.append("\\u").append(s, i + 1, i + 5);
                    }
                    i += 4;
                }
                default -> out.append('\\').append(next);
            }
        }
        return out.toString();
    }

    public static String stripMarkdownJson(String raw) {
        Matcher m = JSON_BLOCK.matcher(raw);
        if (m.find()) return m.group(1).trim();
        return raw.trim();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static String preview(String raw) {
        return raw.length() > 200 ? raw.substring(0, 200) + "..." : raw;
    }
}
