package com.calai.analytics.landmark.repo;

import com.calai.analytics.landmark.entity.VolumeLandmark;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface VolumeLandmarkRepo extends JpaRepository<VolumeLandmark, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select l from VolumeLandmark l where l.userId = :userId order by l.muscleGroupId asc")
    List<VolumeLandmark> findAllForUpdate(@Param("userId") Long userId);

    List<VolumeLandmark> findByUserIdOrderByMuscleGroupIdAsc(Long userId);
}
