package com.openforge.tutor.repository;

import com.openforge.tutor.domain.LessonProgress;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LessonProgressRepository extends JpaRepository<LessonProgress, Long> {

    Optional<LessonProgress> findFirstByUserIdAndLessonIdOrderByCreateTimeDesc(String userId, String lessonId);
}
