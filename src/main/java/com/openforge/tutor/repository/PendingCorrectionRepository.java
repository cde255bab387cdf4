package com.openforge.tutor.repository;

import com.openforge.tutor.domain.PendingCorrection;
import com.openforge.tutor.domain.PendingCorrection.CorrectionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface PendingCorrectionRepository extends JpaRepository<PendingCorrection, Long> {

    /** Oldest correction in the given state; the id breaks create_time ties. */
    Optional<PendingCorrection> findFirstBySessionIdAndStatusOrderByCreateTimeAscIdAsc(
            String sessionId, CorrectionStatus status);

    long countBySessionIdAndStatus(String sessionId, CorrectionStatus status);

    /**
     * Compare-and-set status transition.  Returns 1 when this caller won the
     * transition and 0 when the row was no longer in {@code from}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update PendingCorrection c
               set c.status = :to, c.deliveredAt = :at, c.version = c.version + 1
             where c.id = :id and c.status = :from
            """)
    int transition(@Param("id") Long id,
                   @Param("from") CorrectionStatus from,
                   @Param("to") CorrectionStatus to,
                   @Param("at") Instant at);
}
