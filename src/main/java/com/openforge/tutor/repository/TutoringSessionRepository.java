package com.openforge.tutor.repository;

import com.openforge.tutor.domain.TutoringSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TutoringSessionRepository extends JpaRepository<TutoringSession, Long> {

    Optional<TutoringSession> findBySessionId(String sessionId);
}
