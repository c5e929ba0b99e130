package com.calai.analytics.muscle.repo;

import com.calai.analytics.muscle.entity.MuscleGroup;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MuscleGroupRepo extends JpaRepository<MuscleGroup, Long> {
}
