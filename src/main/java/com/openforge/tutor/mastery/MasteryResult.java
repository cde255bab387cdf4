package com.openforge.tutor.mastery;

/**
 * Deterministic mastery verdict.  Confidence is always 1.0: no model is
 * involved, the same evidence and rules always give the same answer.
 */
public record MasteryResult(
        boolean hasMastered,
        double confidence,
        Criteria criteriaMet,
        EvidenceSummary evidence,
        MasteryRules rulesApplied
) {

    public record Criteria(
            boolean correctAnswers,
            boolean explanationQuality,
            boolean applicationAttempts,
            boolean overallQuality,
            boolean struggleRatio,
            boolean timeSpent
    ) {
        public boolean all() {
            return correctAnswers && explanationQuality && applicationAttempts
                    && overallQuality && struggleRatio && timeSpent;
        }

        public int count() {
            int n = 0;
            if (correctAnswers)      n++;
            if (explanationQuality)  n++;
            if (applicationAttempts) n++;
            if (overallQuality)      n++;
            if (struggleRatio)       n++;
            if (timeSpent)           n++;
            return n;
        }
    }

    public record EvidenceSummary(
            int correctAnswers,
            int incorrectAnswers,
            int explanations,
            int applications,
            int struggles,
            long avgQuality,
            double timeSpentMinutes
    ) {}

    /** Conservative verdict used when the evidence could not be read. */
    static MasteryResult notMastered() {
        return new MasteryResult(false, 1.0,
                new Criteria(false, false, false, false, false, false),
                new EvidenceSummary(0, 0, 0, 0, 0, 0, 0),
                MasteryRules.DEFAULTS);
    }
}
