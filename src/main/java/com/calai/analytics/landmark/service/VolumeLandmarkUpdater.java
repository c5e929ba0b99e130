package com.calai.analytics.landmark.service;

import com.calai.analytics.feedback.entity.RecoveryFeedback;
import com.calai.analytics.feedback.repo.RecoveryFeedbackRepo;
import com.calai.analytics.landmark.entity.VolumeLandmark;
import com.calai.analytics.landmark.repo.VolumeLandmarkRepo;
import com.calai.analytics.volume.entity.WeeklyVolumeRecord;
import com.calai.analytics.volume.repo.WeeklyVolumeRecordRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * 有恢復回饋才更新 landmark（沒有回饋 = 維持原狀，這是業務規則）。
 * 不做 MEV/MAV/MRV 判斷，留給下游。
 */
@Slf4j
@Service
public class VolumeLandmarkUpdater {

    private final RecoveryFeedbackRepo feedbackRepo;
    private final VolumeLandmarkRepo landmarkRepo;
    private final WeeklyVolumeRecordRepo weeklyRepo;
    private final Clock clock;

    public VolumeLandmarkUpdater(RecoveryFeedbackRepo feedbackRepo,
                                 VolumeLandmarkRepo landmarkRepo,
                                 WeeklyVolumeRecordRepo weeklyRepo,
                                 Clock clock) {
        this.feedbackRepo = feedbackRepo;
        this.landmarkRepo = landmarkRepo;
        this.weeklyRepo = weeklyRepo;
        this.clock = clock;
    }

    /** @return 實際更新的 landmark 數 */
    @Transactional
    public int update(Long userId, Long sessionId, LocalDate weekStart) {
        Optional<RecoveryFeedback> feedbackOpt = feedbackRepo.findFirstBySessionIdOrderByIdAsc(sessionId);
        if (feedbackOpt.isEmpty()) {
            log.debug("[volume-landmark] no feedback, landmarks unchanged: userId={}, sessionId={}", userId, sessionId);
            return 0;
        }

        RecoveryFeedback feedback = feedbackOpt.get();
        int recovery = RecoveryScoring.recoveryLevel(feedback);
        int adaptation = RecoveryScoring.adaptationLevel(feedback);
        Instant now = Instant.now(clock);

        List<VolumeLandmark> landmarks = landmarkRepo.findAllForUpdate(userId);
        int updated = 0;
        for (VolumeLandmark lm : landmarks) {
            Optional<WeeklyVolumeRecord> weekly = weeklyRepo
                    .findByUserIdAndMuscleGroupIdAndWeekStartDate(userId, lm.getMuscleGroupId(), weekStart);
            if (weekly.isEmpty()) continue;

            lm.setCurrentVolume((int) Math.round((double) weekly.get().getTotalSets()));
            lm.setRecoveryLevel(recovery);
            lm.setAdaptationLevel(adaptation);
            lm.setLastUpdated(now);
            landmarkRepo.save(lm);
            updated++;
        }

        log.info("[volume-landmark] userId={}, sessionId={}, weekStart={}, updated={}, recovery={}, adaptation={}",
                userId, sessionId, weekStart, updated, recovery, adaptation);
        return updated;
    }
}
