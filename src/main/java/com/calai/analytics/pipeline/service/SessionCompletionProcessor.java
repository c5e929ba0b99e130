package com.calai.analytics.pipeline.service;

import com.calai.analytics.common.error.NotFoundException;
import com.calai.analytics.common.error.StoreException;
import com.calai.analytics.config.AnalyticsProperties;
import com.calai.analytics.landmark.service.VolumeLandmarkUpdater;
import com.calai.analytics.progression.service.LoadProgressionTracker;
import com.calai.analytics.volume.WeekStartKey;
import com.calai.analytics.volume.entity.WeeklyVolumeRecord;
import com.calai.analytics.volume.service.WeeklyVolumeAggregator;
import com.calai.analytics.workout.entity.WorkoutExercise;
import com.calai.analytics.workout.entity.WorkoutSession;
import com.calai.analytics.workout.repo.WorkoutExerciseRepo;
import com.calai.analytics.workout.repo.WorkoutSessionRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * session 完成後的分析管線：
 * 1) 每個完成的動作 → LoadProgressionRecord
 * 2) 整個 session → 各肌群本週 volume 累加
 * 3) 有恢復回饋 → 更新 volume landmark
 * 三步不包成同一個交易；中途失敗由呼叫端整個 session 重跑（progression 需 at-most-once）。
 */
@Slf4j
@Service
public class SessionCompletionProcessor {

    private final WorkoutSessionRepo sessionRepo;
    private final WorkoutExerciseRepo exerciseRepo;
    private final LoadProgressionTracker tracker;
    private final WeeklyVolumeAggregator aggregator;
    private final VolumeLandmarkUpdater landmarkUpdater;
    private final AnalyticsProperties props;

    public SessionCompletionProcessor(WorkoutSessionRepo sessionRepo,
                                      WorkoutExerciseRepo exerciseRepo,
                                      LoadProgressionTracker tracker,
                                      WeeklyVolumeAggregator aggregator,
                                      VolumeLandmarkUpdater landmarkUpdater,
                                      AnalyticsProperties props) {
        this.sessionRepo = sessionRepo;
        this.exerciseRepo = exerciseRepo;
        this.tracker = tracker;
        this.aggregator = aggregator;
        this.landmarkUpdater = landmarkUpdater;
        this.props = props;
    }

    public SessionCompletionReport processSessionCompletion(Long sessionId, Long userId) {
        return processSessionCompletion(sessionId, userId, props.weekZoneId());
    }

    public SessionCompletionReport processSessionCompletion(Long sessionId, Long userId, ZoneId zone) {
        ZoneId weekZone = (zone == null) ? props.weekZoneId() : zone;
        try {
            WorkoutSession session = sessionRepo.findByIdAndUserId(sessionId, userId)
                    .orElseThrow(() -> NotFoundException.session(sessionId, userId));

            List<WorkoutExercise> completed = exerciseRepo.findCompletedBySessionId(sessionId);

            int progressionRecords = 0;
            for (WorkoutExercise we : completed) {
                if (!we.hasLoadData()) continue;
                if (tracker.track(userId, session, we) != null) progressionRecords++;
            }

            Map<Long, WeeklyVolumeRecord> weekly = aggregator.aggregate(userId, session, completed, weekZone);

            LocalDate weekStart = WeekStartKey.weekStart(session.getStartedAt(), weekZone);
            int landmarksUpdated = landmarkUpdater.update(userId, sessionId, weekStart);

            log.info("[session-completion] sessionId={}, userId={}, weekStart={}@{}, progression={}, muscles={}, landmarks={}",
                    sessionId, userId, weekStart, weekZone.getId(), progressionRecords, weekly.size(), landmarksUpdated);

            return new SessionCompletionReport(sessionId, userId, weekStart, progressionRecords,
                    new LinkedHashSet<>(weekly.keySet()), landmarksUpdated);

        } catch (NotFoundException e) {
            log.warn("[session-completion] {}: {}", e.code(), e.getMessage());
            throw e;
        } catch (DataAccessException | TransactionException e) {
            // 交易開不起來（連線池逾時）或 commit 失敗，一律視為 store 失敗
            log.warn("[session-completion] store failure: sessionId={}, userId={}", sessionId, userId, e);
            throw new StoreException("store failure while processing session " + sessionId, e);
        }
    }
}
