package com.calai.analytics.volume.service;

import com.calai.analytics.muscle.entity.ExerciseMuscleMapping;
import com.calai.analytics.muscle.repo.ExerciseMuscleMappingRepo;
import com.calai.analytics.volume.WeekStartKey;
import com.calai.analytics.volume.entity.WeeklyVolumeRecord;
import com.calai.analytics.workout.entity.WorkoutExercise;
import com.calai.analytics.workout.entity.WorkoutSession;
import com.calai.analytics.workout.parse.RepNotationParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.*;
import java.util.stream.Collectors;

/**
 * session 完成後，把每個 (表現, 肌群 mapping) 的加權 volume 累加進該週的 WeeklyVolumeRecord。
 * 只累加、不覆寫；同週多個 session 會落在同一列。
 */
@Slf4j
@Service
public class WeeklyVolumeAggregator {

    /** 首次插入撞 unique key 或 gap lock 死結時的總嘗試次數 */
    static final int MAX_ATTEMPTS = 5;

    private final ExerciseMuscleMappingRepo mappingRepo;
    private final WeeklyVolumeLedger ledger;

    public WeeklyVolumeAggregator(ExerciseMuscleMappingRepo mappingRepo, WeeklyVolumeLedger ledger) {
        this.mappingRepo = mappingRepo;
        this.ledger = ledger;
    }

    /** 單一肌群在這個 session 的加權 volume 與組數 */
    public record MuscleContribution(double volume, int sets) {
        MuscleContribution plus(double v, int s) { return new MuscleContribution(volume + v, sets + s); }
    }

    public Map<Long, WeeklyVolumeRecord> aggregate(Long userId, WorkoutSession session,
                                                   List<WorkoutExercise> completed, ZoneId zone) {
        Map<Long, MuscleContribution> byMuscle = contributions(completed);
        if (byMuscle.isEmpty()) return Map.of();

        LocalDate weekStart = WeekStartKey.weekStart(session.getStartedAt(), zone);
        Map<Long, WeeklyVolumeRecord> out = new LinkedHashMap<>();

        for (var e : byMuscle.entrySet()) {
            Long muscleGroupId = e.getKey();
            MuscleContribution c = e.getValue();
            WeeklyVolumeRecord rec = accumulateWithRetry(userId, muscleGroupId, weekStart, zone, c);
            out.put(muscleGroupId, rec);
        }

        log.debug("[weekly-volume] userId={}, sessionId={}, weekStart={}, muscles={}",
                userId, session.getId(), weekStart, out.keySet());
        return out;
    }

    private WeeklyVolumeRecord accumulateWithRetry(Long userId, Long muscleGroupId, LocalDate weekStart,
                                                   ZoneId zone, MuscleContribution c) {
        for (int attempt = 1; ; attempt++) {
            try {
                return ledger.accumulate(userId, muscleGroupId, weekStart, zone, c.volume(), c.sets());
            } catch (DataIntegrityViolationException | ConcurrencyFailureException ex) {
                // 併發首次插入：另一筆已寫入（或 MySQL 判死結），重來會走鎖列累加
                if (attempt >= MAX_ATTEMPTS) throw ex;
                log.info("[weekly-volume] insert race, retry with row lock: userId={}, muscleGroupId={}, weekStart={}, attempt={}, cause={}",
                        userId, muscleGroupId, weekStart, attempt, ex.getClass().getSimpleName());
            }
        }
    }

    /**
     * 純計算：依肌群彙總加權 volume 與組數。
     * 組數只算真的貢獻到該肌群的表現（有 reps、有重量）。
     */
    public Map<Long, MuscleContribution> contributions(List<WorkoutExercise> completed) {
        List<WorkoutExercise> eligible = completed.stream()
                .filter(WorkoutExercise::isCompleted)
                .filter(WorkoutExercise::hasLoadData)
                .toList();
        if (eligible.isEmpty()) return Map.of();

        Set<Long> exerciseIds = eligible.stream()
                .map(WorkoutExercise::getExerciseId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Map<Long, List<ExerciseMuscleMapping>> mappingsByExercise = mappingRepo.findByExerciseIdIn(exerciseIds)
                .stream()
                .collect(Collectors.groupingBy(ExerciseMuscleMapping::getExerciseId));

        Map<Long, MuscleContribution> byMuscle = new TreeMap<>();
        for (WorkoutExercise we : eligible) {
            List<ExerciseMuscleMapping> mappings = mappingsByExercise.getOrDefault(we.getExerciseId(), List.of());
            if (mappings.isEmpty()) continue;

            double rawVolume = we.getWeight() * RepNotationParser.sum(RepNotationParser.parse(we.getActualReps()));
            int sets = we.getSets() == null ? 0 : we.getSets();

            for (ExerciseMuscleMapping m : mappings) {
                double weighted = rawVolume * m.contributionOrDefault();
                byMuscle.merge(m.getMuscleGroupId(), new MuscleContribution(weighted, sets),
                        (a, b) -> a.plus(b.volume(), b.sets()));
            }
        }
        return byMuscle;
    }
}
