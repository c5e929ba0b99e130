package com.calai.analytics.progression.repo;

import com.calai.analytics.progression.entity.LoadProgressionRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface LoadProgressionRecordRepo extends JpaRepository<LoadProgressionRecord, Long> {

    /** 同一 (user, exercise) 最近一筆；同一 sessionDate 時以 id 較大者為準 */
    Optional<LoadProgressionRecord> findFirstByUserIdAndExerciseIdOrderBySessionDateDescIdDesc(
            Long userId, Long exerciseId);

    @Query("""
        select r from LoadProgressionRecord r
        where r.userId = :userId and r.exerciseId = :exerciseId
        order by r.sessionDate desc, r.id desc
        """)
    List<LoadProgressionRecord> findRecent(@Param("userId") Long userId,
                                           @Param("exerciseId") Long exerciseId,
                                           Pageable pageable);
}
