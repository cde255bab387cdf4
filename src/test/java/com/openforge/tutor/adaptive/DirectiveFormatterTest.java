package com.openforge.tutor.adaptive;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DirectiveFormatterTest {

    @Test
    void rendersSectionsInOrderAndSkipsEmptyOnes() {
        AdaptiveDirectives directives = new AdaptiveDirectives(
                List.of(),
                List.of("DIFFICULTY"),
                List.of("SCAFFOLD"),
                List.of("PHASE"),
                EncouragementLevel.HIGH,
                42,
                0.5);

        String block = DirectiveFormatter.format(directives);

        assertThat(block).contains("ADAPTIVE TEACHING DIRECTIVES");
        assertThat(block.indexOf("DIFFICULTY")).isLessThan(block.indexOf("SCAFFOLD"));
        assertThat(block.indexOf("SCAFFOLD")).isLessThan(block.indexOf("PHASE"));
        assertThat(block).contains("ENCOURAGEMENT LEVEL: HIGH");
        assertThat(block).contains("celebrate every small success");
        assertThat(block).contains("Current Mastery: 42%");
        assertThat(block).doesNotContain("\n\n\n");
    }

    @Test
    void standardEncouragementHasNoExtraLine() {
        AdaptiveDirectives directives = new AdaptiveDirectives(
                List.of(), List.of(), List.of(), List.of(), EncouragementLevel.STANDARD, 60, 0.3);

        String block = DirectiveFormatter.format(directives);

        assertThat(block).contains("ENCOURAGEMENT LEVEL: STANDARD");
        assertThat(block).doesNotContain("celebrate every small success").doesNotContain("not overbearing");
    }

    @Test
    void masteryTag() {
        assertThat(DirectiveFormatter.masteryTag(73)).isEqualTo("[CURRENT MASTERY: 73/100]");
    }
}
