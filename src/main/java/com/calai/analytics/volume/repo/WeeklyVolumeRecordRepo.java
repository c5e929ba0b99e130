package com.calai.analytics.volume.repo;

import com.calai.analytics.volume.entity.WeeklyVolumeRecord;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface WeeklyVolumeRecordRepo extends JpaRepository<WeeklyVolumeRecord, Long> {

    /** 累加前先鎖列（SELECT ... FOR UPDATE），避免併發 session 互相覆蓋 */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        select w from WeeklyVolumeRecord w
        where w.userId = :userId and w.muscleGroupId = :muscleGroupId and w.weekStartDate = :weekStart
        """)
    Optional<WeeklyVolumeRecord> findForUpdate(@Param("userId") Long userId,
                                               @Param("muscleGroupId") Long muscleGroupId,
                                               @Param("weekStart") LocalDate weekStart);

    Optional<WeeklyVolumeRecord> findByUserIdAndMuscleGroupIdAndWeekStartDate(
            Long userId, Long muscleGroupId, LocalDate weekStartDate);

    List<WeeklyVolumeRecord> findByUserIdAndWeekStartDateBetweenOrderByWeekStartDateAscMuscleGroupIdAsc(
            Long userId, LocalDate from, LocalDate to);
}
