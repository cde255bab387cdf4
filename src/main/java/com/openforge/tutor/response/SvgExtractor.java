package com.openforge.tutor.response;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls an SVG diagram out of free text.  Models sometimes leave the
 * {@code svg} field empty and embed the drawing in displayText, either inside
 * an {@code [SVG]...[/SVG]} wrapper or as a bare {@code <svg>} element.
 */
public final class SvgExtractor {

    private static final Pattern WRAPPED = Pattern.compile(
            "\\[SVG\\]\\s*([\\s\\S]*?)\\s*\\[/SVG\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern RAW = Pattern.compile(
            "<svg[\\s\\S]*?</svg>", Pattern.CASE_INSENSITIVE);

    private SvgExtractor() {}

    public record Extraction(String svg, String cleanedText) {
        public boolean found() {
            return svg != null;
        }
    }

    public static Extraction extract(String text) {
        if (text == null || text.isEmpty()) {
            return new Extraction(null, text);
        }

        Matcher wrapped = WRAPPED.matcher(text);
        if (wrapped.find()) {
            String inner = wrapped.group(1).trim();
            Matcher raw = RAW.matcher(inner);
            String svg = raw.find() ? raw.group().trim() : inner;
            return new Extraction(svg, WRAPPED.matcher(text).replaceAll("").trim());
        }

        Matcher raw = RAW.matcher(text);
        if (raw.find()) {
            return new Extraction(raw.group().trim(), RAW.matcher(text).replaceAll("").trim());
        }
        return new Extraction(null, text);
    }

    public static boolean containsSvg(String text) {
        return text != null && (text.contains("[SVG]") || text.toLowerCase().contains("<svg"));
    }
}
