package com.openforge.tutor.adaptive;

import java.util.ArrayList;
import java.util.List;

/** Renders {@link AdaptiveDirectives} as the instruction block injected into the agent prompt. */
public final class DirectiveFormatter {

    private static final String RULE = "═══════════════════════════════════════════════════════════";

    private DirectiveFormatter() {}

    public static String format(AdaptiveDirectives directives) {
        List<String> lines = new ArrayList<>();
        lines.add(RULE);
        lines.add("         🎯 ADAPTIVE TEACHING DIRECTIVES 🎯");
        lines.add("  CRITICAL: Follow these instructions to personalize teaching");
        lines.add(RULE);

        appendSection(lines, directives.styleAdjustments());
        appendSection(lines, directives.difficultyAdjustments());
        appendSection(lines, directives.scaffoldingNeeds());
        appendSection(lines, directives.phaseGuidance());

        lines.add("");
        lines.add("🎭 ENCOURAGEMENT LEVEL: " + directives.encouragementLevel().name());
        lines.add("- Adjust your tone and enthusiasm accordingly");
        if (directives.encouragementLevel() == EncouragementLevel.HIGH) {
            lines.add("- Be VERY encouraging, celebrate every small success");
        } else if (directives.encouragementLevel() == EncouragementLevel.MINIMAL) {
            lines.add("- Be supportive but not overbearing - student is doing well");
        }

        lines.add("");
        lines.add(RULE);
        lines.add("📊 Current Mastery: " + directives.currentMastery() + "% | Directives applied successfully");
        lines.add(RULE);
        return String.join("\n", lines);
    }

    /** The one-line mastery tag that opens every agent prompt. */
    public static String masteryTag(int mastery) {
        return "[CURRENT MASTERY: " + mastery + "/100]";
    }

    private static void appendSection(List<String> lines, List<String> section) {
        if (section.isEmpty()) return;
        lines.add("");
        lines.addAll(section);
    }
}
