package com.openforge.tutor.mastery;

import com.openforge.tutor.cache.CacheProperties;
import com.openforge.tutor.cache.ClockTicker;
import com.openforge.tutor.domain.EvidenceRecord;
import com.openforge.tutor.domain.EvidenceType;
import com.openforge.tutor.repository.LessonProgressRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Current mastery score (0-100) for a (user, lesson) pair.
 *
 * Sources, in priority order:
 *   1. answers   round(correct / (correct + incorrect) * 100)
 *   2. quality   mean of non-zero quality scores when no answers exist
 *   3. progress  latest stored lesson_progress.mastery_level
 *   4. neutral   50, never assume mastery or struggle without data
 *
 * Scores are cached briefly for read performance.  Every evidence write goes
 * through {@link #recordEvidence} so the pair's entry is dropped immediately.
 */
@Slf4j
@Service
public class MasteryCalculator {

    public static final int NEUTRAL_MASTERY = 50;

    private final EvidenceStore            evidenceStore;
    private final LessonProgressRepository progressRepository;
    private final Cache<String, Integer>   cache;

    public MasteryCalculator(EvidenceStore evidenceStore,
                             LessonProgressRepository progressRepository,
                             CacheProperties cacheProperties,
                             Clock clock) {
        this.evidenceStore      = evidenceStore;
        this.progressRepository = progressRepository;
        this.cache              = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(Duration.ofSeconds(cacheProperties.masteryTtlSeconds()))
                .ticker(new ClockTicker(clock))
                .build();
    }

    public int computeMastery(String userId, String lessonId) {
        String key = key(userId, lessonId);
        Integer cached = cache.getIfPresent(key);
        if (cached != null) return cached;

        try {
            int score = calculate(userId, lessonId);
            cache.put(key, score);
            return score;
        } catch (Exception e) {
            log.error("[Mastery] Failed to compute mastery for lesson {}: {}", lessonId, e.getMessage());
            return NEUTRAL_MASTERY;
        }
    }

    /** Appends evidence and invalidates the cached score for its pair. */
    public EvidenceRecord recordEvidence(EvidenceRecord record) {
        EvidenceRecord saved = evidenceStore.append(record);
        invalidate(record.getUserId(), record.getLessonId());
        return saved;
    }

    public void invalidate(String userId, String lessonId) {
        cache.invalidate(key(userId, lessonId));
    }

    // ── Calculation ──────────────────────────────────────────────────────────

    private int calculate(String userId, String lessonId) {
        List<EvidenceRecord> evidence = evidenceStore.forLesson(userId, lessonId);

        if (!evidence.isEmpty()) {
            long correct   = count(evidence, EvidenceType.CORRECT_ANSWER);
            long incorrect = count(evidence, EvidenceType.INCORRECT_ANSWER);
            if (correct + incorrect > 0) {
                int score = (int) Math.round(correct * 100.0 / (correct + incorrect));
                log.debug("[Mastery] Answer-based score for lesson {}: {} ({} correct, {} incorrect)",
                        lessonId, score, correct, incorrect);
                return score;
            }

            double avgQuality = evidence.stream()
                    .map(EvidenceRecord::getQualityScore)
                    .filter(q -> q != null && q > 0)
                    .mapToInt(Integer::intValue)
                    .average()
                    .orElse(-1);
            if (avgQuality >= 0) {
                int score = (int) Math.round(avgQuality);
                log.debug("[Mastery] Quality-based score for lesson {}: {}", lessonId, score);
                return score;
            }
        }

        return progressRepository.findFirstByUserIdAndLessonIdOrderByCreateTimeDesc(userId, lessonId)
                .map(progress -> {
                    log.debug("[Mastery] Progress fallback for lesson {}: {}", lessonId, progress.getMasteryLevel());
                    return progress.getMasteryLevel();
                })
                .orElseGet(() -> {
                    log.debug("[Mastery] No data for lesson {}, defaulting to {}", lessonId, NEUTRAL_MASTERY);
                    return NEUTRAL_MASTERY;
                });
    }

    private static long count(List<EvidenceRecord> evidence, EvidenceType type) {
        return evidence.stream().filter(e -> e.getEvidenceType() == type).count();
    }

    private static String key(String userId, String lessonId) {
        return userId + "|" + lessonId;
    }
}
