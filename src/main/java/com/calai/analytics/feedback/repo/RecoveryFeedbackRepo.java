package com.calai.analytics.feedback.repo;

import com.calai.analytics.feedback.entity.RecoveryFeedback;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface RecoveryFeedbackRepo extends JpaRepository<RecoveryFeedback, Long> {
    Optional<RecoveryFeedback> findFirstBySessionIdOrderByIdAsc(Long sessionId);
}
