package com.openforge.tutor.profile;

import com.openforge.tutor.domain.EvidenceRecord;
import com.openforge.tutor.domain.EvidenceType;
import com.openforge.tutor.mastery.EvidenceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Promotes recurring evidence patterns into the profile.
 *
 * Over the newest records of a session, grouped by topic:
 *   - 3 or more incorrect/struggle records  → topic joins struggles
 *   - 2 or more correct answers scoring ≥ 80 → topic joins strengths
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileEnricher {

    static final int WINDOW               = 10;
    static final int STRUGGLE_THRESHOLD   = 3;
    static final int STRENGTH_THRESHOLD   = 2;
    static final int HIGH_QUALITY         = 80;

    private final EvidenceStore  evidenceStore;
    private final ProfileService profileService;

    public record Patterns(List<String> newStruggles, List<String> newStrengths) {
        public boolean isEmpty() {
            return newStruggles.isEmpty() && newStrengths.isEmpty();
        }
    }

    public Patterns enrichIfNeeded(String userId, String sessionId) {
        Patterns patterns = analyze(evidenceStore.recentForSession(sessionId, WINDOW));
        if (patterns.isEmpty()) {
            return patterns;
        }
        if (profileService.addTopics(userId, patterns.newStruggles(), patterns.newStrengths())) {
            log.info("[Profile] Enriched profile of {}: struggles={} strengths={}",
                    userId, patterns.newStruggles(), patterns.newStrengths());
        }
        return patterns;
    }

    static Patterns analyze(List<EvidenceRecord> evidence) {
        Map<String, int[]> byTopic = new LinkedHashMap<>();
        for (EvidenceRecord record : evidence) {
            String topic = record.getContext();
            if (topic == null || topic.isBlank()) continue;

            // [0] struggles, [1] high-quality correct answers
            int[] stats = byTopic.computeIfAbsent(topic, t -> new int[2]);
            EvidenceType type = record.getEvidenceType();
            if (type == EvidenceType.INCORRECT_ANSWER || type == EvidenceType.STRUGGLE) {
                stats[0]++;
            }
            int quality = record.getQualityScore() == null ? 0 : record.getQualityScore();
            if (type == EvidenceType.CORRECT_ANSWER && quality >= HIGH_QUALITY) {
                stats[1]++;
            }
        }

        List<String> struggles = new ArrayList<>();
        List<String> strengths = new ArrayList<>();
        byTopic.forEach((topic, stats) -> {
            if (stats[0] >= STRUGGLE_THRESHOLD) struggles.add(topic);
            if (stats[1] >= STRENGTH_THRESHOLD) strengths.add(topic);
        });
        return new Patterns(struggles, strengths);
    }
}
