package com.openforge.tutor.response;

import com.openforge.tutor.config.AppConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TeachingResponseParserTest {

    private final TeachingResponseParser parser = new TeachingResponseParser(new AppConfig().objectMapper());

    @Test
    void parsesStrictJsonAndStampsAgent() {
        ParseResult<TeachingResponse> result = parser.parse("""
                {"audioText": "Let's add.", "displayText": "1/4 + 2/4", "svg": null,
                 "lessonComplete": false, "teachingPhase": 2, "handoffRequest": null}""", "math_specialist");

        assertThat(result.isOk()).isTrue();
        assertThat(result.strategy()).isEqualTo("strict");
        assertThat(result.value().agentName()).isEqualTo("math_specialist");
        assertThat(result.value().teachingPhase()).isEqualTo(2);
        assertThat(result.value().wantsHandoff()).isFalse();
    }

    @Test
    void stripsMarkdownFence() {
        ParseResult<TeachingResponse> result = parser.parse(
                "```json\n{\"audioText\": \"Hi.\", \"displayText\": \"Hi\"}\n```", "coordinator");

        assertThat(result.value().audioText()).isEqualTo("Hi.");
    }

    @Test
    void repairsRawNewlinesInsideStrings() {
        ParseResult<TeachingResponse> result = parser.parse(
                "{\"audioText\": \"Line one.\nLine two.\", \"displayText\": \"Step 1\n\tStep 2\"}", "math_specialist");

        assertThat(result.strategy()).isEqualTo("sanitized");
        assertThat(result.value().audioText()).isEqualTo("Line one.\nLine two.");
        assertThat(result.value().displayText()).isEqualTo("Step 1\n\tStep 2");
    }

    @Test
    void fallsBackToRegexFields() {
        ParseResult<TeachingResponse> result = parser.parse(
                "Here you go: \"audioText\": \"Great job!\", \"lessonComplete\": true, \"teachingPhase\": 5 and more",
                "math_specialist");

        assertThat(result.strategy()).isEqualTo("regex");
        assertThat(result.value().audioText()).isEqualTo("Great job!");
        assertThat(result.value().displayText()).isEqualTo("Great job!");
        assertThat(result.value().lessonComplete()).isTrue();
        assertThat(result.value().teachingPhase()).isEqualTo(5);
    }

    @Test
    void unparseableInputIsAnError() {
        assertThat(parser.parse("I cannot answer that", "x").isOk()).isFalse();
        assertThat(parser.parse("   ", "x").error()).contains("empty response");
    }

    @Test
    void movesSvgOutOfDisplayTextAndAudio() {
        TeachingResponse raw = TeachingResponse.builder()
                .audioText("Look <svg width=\"10\"></svg> here.")
                .displayText("Diagram: [SVG]<svg><circle r=\"4\"/></svg>[/SVG] done")
                .build();

        TeachingResponse normalized = parser.normalize(raw, "math_specialist");

        assertThat(normalized.svg()).isEqualTo("<svg><circle r=\"4\"/></svg>");
        assertThat(normalized.displayText()).isEqualTo("Diagram:  done");
        assertThat(normalized.audioText()).doesNotContain("<svg");
        assertThat(normalized.hasSvg()).isTrue();
    }

    @Test
    void keepsLatexWhileUnescapingNewlines() {
        TeachingResponse raw = TeachingResponse.builder()
                .audioText("x")
                .displayText("Line\\nNext: $\\frac{1}{2} \\neq \\theta$")
                .build();

        TeachingResponse normalized = parser.normalize(raw, "math_specialist");

        assertThat(normalized.displayText()).isEqualTo("Line\nNext: $\\frac{1}{2} \\neq \\theta$");
    }

    @Test
    void dropsOutOfRangePhase() {
        TeachingResponse raw = TeachingResponse.builder().audioText("a").displayText("b").teachingPhase(9).build();

        assertThat(parser.normalize(raw, "m").teachingPhase()).isNull();
    }

    @Test
    void unescapeToleratesTruncatedTail() {
        assertThat(TeachingResponseParser.unescapeJsonString("ok \\\"quoted\\\" \\u00e9 end\\")).isEqualTo("ok \"quoted\" é end");
        assertThat(TeachingResponseParser.unescapeJsonString("cut \\u00")).isEqualTo("cut ");
    }
}
