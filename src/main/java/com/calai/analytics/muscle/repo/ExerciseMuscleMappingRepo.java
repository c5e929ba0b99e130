package com.calai.analytics.muscle.repo;

import com.calai.analytics.muscle.entity.ExerciseMuscleMapping;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface ExerciseMuscleMappingRepo extends JpaRepository<ExerciseMuscleMapping, Long> {
    List<ExerciseMuscleMapping> findByExerciseIdIn(Collection<Long> exerciseIds);
}
