package com.openforge.tutor.adaptive;

import java.util.List;

/**
 * Per-turn teaching instructions derived from profile, recent history and
 * mastery.  Recomputed every turn and never persisted as state; only a
 * summary reaches adaptation_logs.
 */
public record AdaptiveDirectives(
        List<String> styleAdjustments,
        List<String> difficultyAdjustments,
        List<String> scaffoldingNeeds,
        List<String> phaseGuidance,
        EncouragementLevel encouragementLevel,
        int currentMastery,
        double struggleRatio
) {

    public AdaptiveDirectives {
        styleAdjustments      = List.copyOf(styleAdjustments);
        difficultyAdjustments = List.copyOf(difficultyAdjustments);
        scaffoldingNeeds      = List.copyOf(scaffoldingNeeds);
        phaseGuidance         = List.copyOf(phaseGuidance);
    }

    /** Number of directive lines across the style, difficulty and scaffolding axes. */
    public int directiveCount() {
        return styleAdjustments.size() + difficultyAdjustments.size() + scaffoldingNeeds.size();
    }
}
