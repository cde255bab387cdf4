package com.openforge.tutor.adaptive;

import com.openforge.tutor.context.ConversationTurn;
import com.openforge.tutor.profile.LearnerProfile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns (profile, recent history, mastery) into explicit teaching directives.
 *
 * Four independent axes:
 *   style   one bundle per declared learning style, none when undeclared
 *   difficulty   mastery < 50 simplify, 50..79 standard, ≥ 80 accelerate
 *   scaffolding   struggle ratio of recent replies: > 0.4 max, > 0.2 standard, else minimal
 *   phase   pacing through the five-phase teaching progression
 *
 * Known strengths and struggles are appended to the scaffolding block
 * regardless of the other axes.  Pure function; holds no state.
 */
@Component
public class AdaptiveDirectiveGenerator {

    static final List<String> STRUGGLE_INDICATORS = List.of(
            "not quite",
            "incorrect",
            "try again",
            "let me explain again",
            "let's break this down",
            "having trouble",
            "struggling"
    );

    public AdaptiveDirectives generate(LearnerProfile profile,
                                       List<ConversationTurn> recentHistory,
                                       int currentMastery) {
        List<String> style       = styleAdjustments(profile.learningStyle());
        List<String> difficulty  = difficultyAdjustments(currentMastery);
        List<String> scaffolding = new ArrayList<>();
        List<String> phase       = new ArrayList<>();

        // ── Scaffolding ──────────────────────────────────────────────────────
        double ratio = struggleRatio(recentHistory);
        EncouragementLevel encouragement;
        if (ratio > 0.4) {
            scaffolding.addAll(List.of(
                    "🆘 HIGH STRUGGLE DETECTED - MAXIMUM SCAFFOLDING:",
                    "- Follow Teaching Progression Protocol strictly - NO phase compression allowed",
                    "- Phase 2 (I DO): Show COMPLETE worked examples, minimum 2 before moving on",
                    "- Phase 3 (WE DO): Guide EVERY step explicitly, provide sentence starters and templates",
                    "- Phase 4 (YOU DO): Start with an easier problem than expected, build confidence first",
                    "- CORRECTION LOOP: On 2nd failure, drop back one phase immediately",
                    "- Celebrate small wins at EVERY phase transition",
                    "- If stuck in any phase for 5+ turns, suggest a break (handoff to motivator)",
                    "- Be extremely patient and encouraging - confidence is more important than speed"));
            encouragement = EncouragementLevel.HIGH;
        } else if (ratio > 0.2) {
            scaffolding.addAll(List.of(
                    "🤝 MODERATE STRUGGLE - STANDARD SCAFFOLDING:",
                    "- Provide hints when student gets stuck (not full solutions)",
                    "- Ask guiding questions to prompt thinking: \"What do you know?\", \"What's the first step?\"",
                    "- Offer partial examples or analogies",
                    "- Check in regularly but don't over-help",
                    "- Balance independence with support"));
            encouragement = EncouragementLevel.STANDARD;
        } else {
            scaffolding.addAll(List.of(
                    "🚀 LOW STRUGGLE - MINIMAL SCAFFOLDING:",
                    "- Student is confident and capable - reduce scaffolding",
                    "- Let student work independently and discover solutions",
                    "- Only intervene if they explicitly ask for help",
                    "- Pose open-ended questions that encourage exploration",
                    "- Trust their process and problem-solving abilities"));
            encouragement = EncouragementLevel.MINIMAL;
        }

        // ── Known strengths & struggles ──────────────────────────────────────
        if (!profile.strengths().isEmpty()) {
            scaffolding.addAll(List.of(
                    "💪 LEVERAGE STRENGTHS: Student excels at " + String.join(", ", profile.strengths()) + ".",
                    "- Connect new concepts to these strengths as bridges to understanding",
                    "- Use their strong areas as foundation for building new knowledge",
                    "- Reference their expertise: \"You're good at " + profile.strengths().get(0) + ", this is similar...\""));
        }
        if (!profile.struggles().isEmpty()) {
            scaffolding.addAll(List.of(
                    "⚠️ KNOWN STRUGGLES: Student has difficulty with " + String.join(", ", profile.struggles()) + ".",
                    "- Anticipate confusion in these areas and pre-explain connections",
                    "- Provide extra support when these topics appear",
                    "- Avoid assuming prior knowledge in struggle areas - review basics first",
                    "- Be patient and encouraging when these topics come up"));
        }

        // ── Phase progression ────────────────────────────────────────────────
        if (currentMastery >= 80 && ratio < 0.2) {
            phase.addAll(List.of(
                    "⚡ PHASE ACCELERATION ENABLED:",
                    "- Student qualifies for Mastery Acceleration mode",
                    "- Compress Phases 1-3 per the Teaching Progression Protocol",
                    "- Move quickly to Phase 4 and Phase 5",
                    "- Focus time on challenging transfer questions in Phase 5"));
        } else if (currentMastery < 30) {
            phase.addAll(List.of(
                    "🐢 EXTENDED PHASE MODE:",
                    "- Student needs maximum time in each phase",
                    "- Phase 2: Use 3+ worked examples before moving on",
                    "- Phase 3: Guide through 2-3 problems before Phase 4",
                    "- Phase 4: Start with the simplest possible problem",
                    "- Do NOT rush any phase transition",
                    "- Watch for frustration signals - hand off to Motivator if needed"));
        } else if (ratio > 0.4 && currentMastery >= 50) {
            phase.addAll(List.of(
                    "🔄 CORRECTION-HEAVY MODE:",
                    "- Student knows some material but makes frequent errors",
                    "- Extra emphasis on CORRECTION LOOP verification (Step 3)",
                    "- In Phase 3, verify each step before proceeding to next",
                    "- In Phase 4, after each error, return to guided practice briefly",
                    "- Phase 5: Dedicate extra time to circle-back on struggle points"));
        }

        return new AdaptiveDirectives(style, difficulty, scaffolding, phase, encouragement, currentMastery, ratio);
    }

    /** Fraction of turns whose reply contains a struggle phrase; 0 for an empty history. */
    public static double struggleRatio(List<ConversationTurn> recentHistory) {
        if (recentHistory == null || recentHistory.isEmpty()) return 0;
        long struggling = recentHistory.stream()
                .map(ConversationTurn::agentResponse)
                .filter(response -> response != null && containsIndicator(response.toLowerCase(Locale.ROOT)))
                .count();
        return (double) struggling / recentHistory.size();
    }

    private static boolean containsIndicator(String lowerResponse) {
        return STRUGGLE_INDICATORS.stream().anyMatch(lowerResponse::contains);
    }

    // ── Style axis ───────────────────────────────────────────────────────────

    private static List<String> styleAdjustments(String learningStyle) {
        if (learningStyle == null) return List.of();
        return switch (learningStyle.trim().toLowerCase(Locale.ROOT)) {
            case "visual" -> List.of(
                    "🎨 VISUAL LEARNER ADAPTATIONS:",
                    "- CRITICAL: Generate an SVG diagram for EVERY major concept explained",
                    "- Use visual metaphors and spatial descriptions (top/bottom, left/right, inside/outside)",
                    "- Reference colors, shapes, sizes, and visual patterns frequently",
                    "- Organize information spatially (lists, tables, visual hierarchies)",
                    "- Use phrases like \"picture this\", \"imagine\", \"visualize\", \"see how\"");
            case "auditory" -> List.of(
                    "🎵 AUDITORY LEARNER ADAPTATIONS:",
                    "- Use conversational, rhythmic language with natural flow",
                    "- Include sound-based metaphors (rhythm, melody, echoes, harmony)",
                    "- Repeat key concepts in different phrasings for reinforcement",
                    "- Use verbal cues like \"listen to this\", \"hear how\", \"sounds like\"",
                    "- Structure explanations like a spoken story with clear verbal signposts");
            case "kinesthetic" -> List.of(
                    "🤸 KINESTHETIC LEARNER ADAPTATIONS:",
                    "- Describe physical actions and hands-on activities (\"try this\", \"move\", \"build\")",
                    "- Use movement-based metaphors (walking, touching, building, manipulating)",
                    "- Suggest concrete manipulatives or physical demonstrations",
                    "- Encourage active engagement (\"draw it out\", \"act it out\", \"use your fingers\")",
                    "- Connect concepts to body sensations and physical experiences");
            case "reading/writing", "reading-writing" -> List.of(
                    "📚 READING/WRITING LEARNER ADAPTATIONS:",
                    "- Provide detailed written explanations with rich text descriptions",
                    "- Use lists, bullet points, and well-organized text structures",
                    "- Encourage note-taking and written summaries",
                    "- Include vocabulary definitions and written examples",
                    "- Suggest writing exercises or journaling about the concept");
            case "logical", "mathematical" -> List.of(
                    "🧮 LOGICAL/MATHEMATICAL LEARNER ADAPTATIONS:",
                    "- Present information in logical sequences with clear cause-effect relationships",
                    "- Use numbered steps, formulas, and systematic problem-solving approaches",
                    "- Include patterns, classifications, and categorical organization",
                    "- Emphasize reasoning chains: \"if...then\", \"therefore\", \"because\"",
                    "- Connect concepts to logic puzzles, equations, or systematic thinking");
            case "social", "interpersonal" -> List.of(
                    "👥 SOCIAL/INTERPERSONAL LEARNER ADAPTATIONS:",
                    "- Frame concepts through human interactions and group scenarios",
                    "- Use dialogue, conversations, and collaborative examples",
                    "- Reference how concepts apply to working with others",
                    "- Encourage \"teach it to someone else\" or \"explain it to a friend\"",
                    "- Connect learning to social contexts and interpersonal relationships");
            case "solitary", "intrapersonal" -> List.of(
                    "🧘 SOLITARY/INTRAPERSONAL LEARNER ADAPTATIONS:",
                    "- Support independent reflection and self-paced discovery",
                    "- Encourage personal connections: \"How does this relate to your experience?\"",
                    "- Provide time for internal processing before asking for responses",
                    "- Frame learning as personal growth and self-understanding",
                    "- Use introspective prompts: \"What do you think?\", \"In your own words\"");
            default -> List.of();
        };
    }

    // ── Difficulty axis ──────────────────────────────────────────────────────

    private static List<String> difficultyAdjustments(int mastery) {
        if (mastery < 50) {
            return List.of(
                    "📉 LOW MASTERY (<50%) - SIMPLIFICATION MODE:",
                    "- SLOW DOWN: Break every concept into the smallest possible steps",
                    "- Use ONLY simple vocabulary appropriate for grade level (avoid technical jargon)",
                    "- Provide MORE examples (minimum 3 concrete examples per concept)",
                    "- Check understanding after EVERY step before proceeding (\"Got it?\")",
                    "- Use analogies from everyday life that the student can relate to",
                    "- If they struggle with a step, break it down even further",
                    "- PHASE GUIDANCE: Do NOT compress any phases. Use maximum turns per phase.",
                    "- In Phase 2, provide at least 2 worked examples before moving to Phase 3",
                    "- In Phase 3, guide every single step explicitly");
        }
        if (mastery < 80) {
            return List.of(
                    "📊 MEDIUM MASTERY (50-80%) - STANDARD TEACHING:",
                    "- Balanced pace: Explain clearly with 1-2 examples per concept",
                    "- Introduce concepts progressively with logical connections",
                    "- Check understanding periodically (not after every step)",
                    "- Use appropriate grade-level vocabulary with occasional challenges",
                    "- Build on previous knowledge systematically");
        }
        return List.of(
                "📈 HIGH MASTERY (>80%) - ACCELERATION MODE:",
                "- ACCELERATE: Student is ready for more complexity and depth",
                "- Introduce advanced vocabulary and more sophisticated concepts",
                "- Ask deeper questions that require synthesis and critical thinking",
                "- Provide challenging extensions: \"What if...\", \"How would you...\", \"Can you apply this to...\"",
                "- Move faster through basics, spend more time on nuances and applications",
                "- Trust the student to connect dots independently",
                "- PHASE GUIDANCE: Compress Phases 1-3 per Mastery Acceleration in Teaching Progression Protocol.",
                "- In Phase 2, recap briefly and follow up with a challenging question",
                "- In Phase 3, one guided problem maximum, then move to Phase 4 if correct",
                "- Phases 4 and 5 CANNOT be compressed");
    }
}
