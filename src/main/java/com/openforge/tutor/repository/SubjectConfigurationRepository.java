package com.openforge.tutor.repository;

import com.openforge.tutor.domain.SubjectConfiguration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SubjectConfigurationRepository extends JpaRepository<SubjectConfiguration, Long> {

    Optional<SubjectConfiguration> findBySubjectIgnoreCaseAndGradeLevel(String subject, Integer gradeLevel);
}
