package com.calai.analytics.progression.service;

import com.calai.analytics.progression.calc.ProgressionClassifier;
import com.calai.analytics.progression.calc.RpeOneRepMaxEstimator;
import com.calai.analytics.progression.entity.LoadProgressionRecord;
import com.calai.analytics.progression.entity.ProgressionStatus;
import com.calai.analytics.progression.repo.LoadProgressionRecordRepo;
import com.calai.analytics.workout.entity.WorkoutExercise;
import com.calai.analytics.workout.entity.WorkoutSession;
import com.calai.analytics.workout.parse.RepNotationParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 每個完成的動作表現寫一筆 LoadProgressionRecord，並和同 (user, exercise) 最近一筆比較。
 * 不做去重：同一筆表現只能呼叫一次（由上游保證 at-most-once）。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoadProgressionTracker {

    private final LoadProgressionRecordRepo repo;

    @Transactional
    public LoadProgressionRecord track(Long userId, WorkoutSession session, WorkoutExercise performance) {
        if (!performance.hasLoadData()) {
            log.debug("[load-progression] skip exercise without reps/weight: sessionId={}, exerciseId={}",
                    session.getId(), performance.getExerciseId());
            return null;
        }

        double weight = performance.getWeight();
        List<Integer> reps = RepNotationParser.parse(performance.getActualReps());
        long totalReps = RepNotationParser.sum(reps);
        double volume = weight * totalReps;

        Double estimatedOneRepMax = null;
        if (performance.getRpe() != null) {
            double repsPerSet = RpeOneRepMaxEstimator.representativeReps(totalReps, performance.getSets(), reps.size());
            estimatedOneRepMax = RpeOneRepMaxEstimator.estimate(weight, performance.getRpe(), repsPerSet);
        }

        LoadProgressionRecord prior = repo
                .findFirstByUserIdAndExerciseIdOrderBySessionDateDescIdDesc(userId, performance.getExerciseId())
                .orElse(null);
        ProgressionStatus status = ProgressionClassifier.classify(volume, weight, prior);

        LoadProgressionRecord rec = new LoadProgressionRecord();
        rec.setUserId(userId);
        rec.setExerciseId(performance.getExerciseId());
        rec.setSessionId(session.getId());
        rec.setSessionDate(session.getStartedAt());
        rec.setWeight(weight);
        rec.setReps(RepNotationParser.format(reps));
        rec.setVolume(volume);
        rec.setEstimatedOneRepMax(estimatedOneRepMax);
        rec.setRpe(performance.getRpe());
        rec.setRir(performance.getRir());
        rec.setProgressionStatus(status);

        LoadProgressionRecord saved = repo.save(rec);
        log.debug("[load-progression] userId={}, exerciseId={}, volume={}, e1rm={}, status={}",
                userId, performance.getExerciseId(), volume, estimatedOneRepMax, status);
        return saved;
    }
}
