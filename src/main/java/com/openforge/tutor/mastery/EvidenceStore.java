package com.openforge.tutor.mastery;

import com.openforge.tutor.domain.EvidenceRecord;
import com.openforge.tutor.repository.EvidenceRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Append-only access to mastery evidence.  Rows are inserted and read,
 * never updated.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EvidenceStore {

    private final EvidenceRecordRepository repository;

    public EvidenceRecord append(EvidenceRecord record) {
        EvidenceRecord saved = repository.save(record);
        log.info("[Evidence] Recorded {} (quality={}) for lesson {}",
                record.getEvidenceType().wire(), record.getQualityScore(), record.getLessonId());
        return saved;
    }

    /** All evidence for the pair, oldest first. */
    public List<EvidenceRecord> forLesson(String userId, String lessonId) {
        return repository.findByUserIdAndLessonIdOrderByCreateTimeAsc(userId, lessonId);
    }

    /** Newest {@code limit} records of one session. */
    public List<EvidenceRecord> recentForSession(String sessionId, int limit) {
        return repository.findBySessionIdOrderByCreateTimeDescIdDesc(sessionId, PageRequest.of(0, limit));
    }
}
