package com.calai.analytics.workout.repo;

import com.calai.analytics.workout.entity.WorkoutSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.Optional;

public interface WorkoutSessionRepo extends JpaRepository<WorkoutSession, Long> {

    @Query("""
        select ws from WorkoutSession ws
        where ws.id = ?1 and ws.userId = ?2
        """)
    Optional<WorkoutSession> findByIdAndUserId(Long sessionId, Long userId);
}
