package com.openforge.tutor.mastery;

import com.openforge.tutor.domain.EvidenceRecord;
import com.openforge.tutor.domain.EvidenceType;
import com.openforge.tutor.repository.SubjectConfigurationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Predicate;

/**
 * Rules-based mastery verdict, the authoritative trigger for moving a student
 * on to assessment.  A teaching agent claiming the lesson is complete is only
 * a hint; this decides.
 *
 * All six criteria must hold at the same time.  The struggle ratio divides
 * struggles by every evidence record of the lesson, correct answers included.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MasteryDetector {

    private final EvidenceStore                  evidenceStore;
    private final SubjectConfigurationRepository subjectConfigurationRepository;
    private final Clock                          clock;

    public MasteryResult determineMastery(String userId,
                                          String lessonId,
                                          String subject,
                                          int gradeLevel,
                                          Instant sessionStart) {
        try {
            List<EvidenceRecord> evidence = evidenceStore.forLesson(userId, lessonId);
            MasteryRules rules = rulesFor(subject, gradeLevel);
            MasteryResult result = evaluate(evidence, rules, sessionStart, clock.instant());

            log.info("[Mastery] Determination for lesson {}: mastered={} ({}/6 criteria)",
                    lessonId, result.hasMastered(), result.criteriaMet().count());
            return result;
        } catch (Exception e) {
            log.error("[Mastery] Determination failed for lesson {}: {}", lessonId, e.getMessage());
            return MasteryResult.notMastered();
        }
    }

    public MasteryRules rulesFor(String subject, int gradeLevel) {
        return subjectConfigurationRepository.findBySubjectIgnoreCaseAndGradeLevel(subject, gradeLevel)
                .map(MasteryRules::from)
                .orElseGet(() -> {
                    log.debug("[Mastery] No config for {} grade {}, using defaults", subject, gradeLevel);
                    return MasteryRules.DEFAULTS;
                });
    }

    // ── Evaluation ───────────────────────────────────────────────────────────

    static MasteryResult evaluate(List<EvidenceRecord> evidence,
                                  MasteryRules rules,
                                  Instant sessionStart,
                                  Instant now) {
        int correct      = count(evidence, is(EvidenceType.CORRECT_ANSWER));
        int incorrect    = count(evidence, is(EvidenceType.INCORRECT_ANSWER));
        int explanations = count(evidence, is(EvidenceType.EXPLANATION));
        int applications = count(evidence, is(EvidenceType.APPLICATION));
        int struggles    = count(evidence, is(EvidenceType.STRUGGLE));

        double avgExplanationQuality = averageQuality(evidence, is(EvidenceType.EXPLANATION));
        double avgOverallQuality     = averageQuality(evidence, e -> true);

        double struggleRatio = evidence.isEmpty() ? 0 : (double) struggles / evidence.size();
        double minutesSpent  = Duration.between(sessionStart, now).toMillis() / 60_000.0;

        MasteryResult.Criteria criteria = new MasteryResult.Criteria(
                correct >= rules.minCorrectAnswers(),
                avgExplanationQuality >= rules.minExplanationQuality(),
                applications >= rules.minApplicationAttempts(),
                avgOverallQuality >= rules.minOverallQuality(),
                struggleRatio <= rules.maxStruggleRatio(),
                minutesSpent >= rules.minTimeSpentMinutes());

        MasteryResult.EvidenceSummary summary = new MasteryResult.EvidenceSummary(
                correct, incorrect, explanations, applications, struggles,
                Math.round(avgOverallQuality),
                Math.round(minutesSpent * 10) / 10.0);

        return new MasteryResult(criteria.all(), 1.0, criteria, summary, rules);
    }

    private static Predicate<EvidenceRecord> is(EvidenceType type) {
        return e -> e.getEvidenceType() == type;
    }

    private static int count(List<EvidenceRecord> evidence, Predicate<EvidenceRecord> filter) {
        return (int) evidence.stream().filter(filter).count();
    }

    /** Mean of non-zero quality scores, 0 when there are none. */
    private static double averageQuality(List<EvidenceRecord> evidence, Predicate<EvidenceRecord> filter) {
        return evidence.stream()
                .filter(filter)
                .map(EvidenceRecord::getQualityScore)
                .filter(q -> q != null && q > 0)
                .mapToInt(Integer::intValue)
                .average()
                .orElse(0);
    }
}
