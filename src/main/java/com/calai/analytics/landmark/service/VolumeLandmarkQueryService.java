package com.calai.analytics.landmark.service;

import com.calai.analytics.landmark.entity.VolumeLandmark;
import com.calai.analytics.landmark.repo.VolumeLandmarkRepo;
import com.calai.analytics.muscle.entity.MuscleGroup;
import com.calai.analytics.muscle.repo.MuscleGroupRepo;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class VolumeLandmarkQueryService {

    private final VolumeLandmarkRepo landmarkRepo;
    private final MuscleGroupRepo muscleGroupRepo;

    public record LandmarkView(
            Long muscleGroupId,
            String muscleGroupName,
            int mv, int mev, int mav, int mrv,
            int currentVolume,
            int targetVolume,
            int recoveryLevel,
            int adaptationLevel,
            Instant lastUpdated
    ) {}

    @Transactional(readOnly = true)
    public List<LandmarkView> landmarks(Long userId) {
        List<VolumeLandmark> rows = landmarkRepo.findByUserIdOrderByMuscleGroupIdAsc(userId);
        if (rows.isEmpty()) return List.of();

        Map<Long, MuscleGroup> groups = muscleGroupRepo
                .findAllById(rows.stream().map(VolumeLandmark::getMuscleGroupId).toList())
                .stream()
                .collect(Collectors.toMap(MuscleGroup::getId, Function.identity()));

        return rows.stream().map(l -> {
            MuscleGroup g = groups.get(l.getMuscleGroupId());
            return new LandmarkView(
                    l.getMuscleGroupId(),
                    g == null ? null : g.getName(),
                    l.getMv(), l.getMev(), l.getMav(), l.getMrv(),
                    l.getCurrentVolume(),
                    l.getTargetVolume(),
                    l.getRecoveryLevel(),
                    l.getAdaptationLevel(),
                    l.getLastUpdated());
        }).toList();
    }
}
