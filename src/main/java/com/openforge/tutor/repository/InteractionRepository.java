package com.openforge.tutor.repository;

import com.openforge.tutor.domain.Interaction;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface InteractionRepository extends JpaRepository<Interaction, Long> {

    /** Newest turn of the session: the continuity signal for routing. */
    Optional<Interaction> findFirstBySessionIdOrderByCreateTimeDescIdDesc(String sessionId);

    /** Newest-first page; callers reverse it to chronological order. */
    List<Interaction> findBySessionIdOrderByCreateTimeDescIdDesc(String sessionId, Pageable pageable);
}
