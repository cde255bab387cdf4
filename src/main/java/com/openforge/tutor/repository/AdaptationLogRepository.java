package com.openforge.tutor.repository;

import com.openforge.tutor.domain.AdaptationLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AdaptationLogRepository extends JpaRepository<AdaptationLog, Long> {
}
