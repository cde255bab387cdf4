package com.openforge.tutor.repository;

import com.openforge.tutor.domain.EvidenceRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EvidenceRecordRepository extends JpaRepository<EvidenceRecord, Long> {

    List<EvidenceRecord> findByUserIdAndLessonIdOrderByCreateTimeAsc(String userId, String lessonId);

    List<EvidenceRecord> findBySessionIdOrderByCreateTimeDescIdDesc(String sessionId, Pageable pageable);
}
