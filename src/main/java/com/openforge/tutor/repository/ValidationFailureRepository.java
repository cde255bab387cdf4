package com.openforge.tutor.repository;

import com.openforge.tutor.domain.ValidationFailure;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ValidationFailureRepository extends JpaRepository<ValidationFailure, Long> {

    List<ValidationFailure> findBySessionIdOrderByCreateTimeAsc(String sessionId);
}
