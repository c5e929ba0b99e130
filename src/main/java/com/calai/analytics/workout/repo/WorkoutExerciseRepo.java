package com.calai.analytics.workout.repo;

import com.calai.analytics.workout.entity.WorkoutExercise;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface WorkoutExerciseRepo extends JpaRepository<WorkoutExercise, Long> {

    @Query("""
        select we from WorkoutExercise we
        where we.sessionId = ?1 and we.completed = true
        order by we.orderIndex asc, we.id asc
        """)
    List<WorkoutExercise> findCompletedBySessionId(Long sessionId);
}
