package com.calai.analytics.volume.service;

import com.calai.analytics.volume.WeekStartKey;
import com.calai.analytics.volume.entity.WeeklyVolumeRecord;
import com.calai.analytics.volume.repo.WeeklyVolumeRecordRepo;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

@Service
@RequiredArgsConstructor
public class WeeklyVolumeQueryService {

    private final WeeklyVolumeRecordRepo repo;

    /** 涵蓋 [from, to] 的所有週（含頭尾所在的週） */
    @Transactional(readOnly = true)
    public List<WeeklyVolumeRecord> weeks(Long userId, LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to: from=" + from + ", to=" + to);
        }
        LocalDate firstWeek = WeekStartKey.weekStart(from);
        LocalDate lastWeek = WeekStartKey.weekStart(to);
        return repo.findByUserIdAndWeekStartDateBetweenOrderByWeekStartDateAscMuscleGroupIdAsc(
                userId, firstWeek, lastWeek);
    }

    @Transactional(readOnly = true)
    public List<WeeklyVolumeRecord> week(Long userId, LocalDate anyDayInWeek) {
        return weeks(userId, anyDayInWeek, anyDayInWeek);
    }
}
