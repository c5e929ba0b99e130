package com.calai.analytics.volume.service;

import com.calai.analytics.volume.entity.WeeklyVolumeRecord;
import com.calai.analytics.volume.repo.WeeklyVolumeRecordRepo;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.ZoneId;

/**
 * 單一 (user, muscleGroup, weekStart) 的 read-modify-write。
 * 每次呼叫獨立交易：列鎖只持有到這筆累加完成。
 */
@Component
@RequiredArgsConstructor
public class WeeklyVolumeLedger {

    private final WeeklyVolumeRecordRepo repo;

    /**
     * 已有列 → 鎖列後累加；沒有 → 插入新列。
     * 兩個首次寫入同時插入時，後到者會收到 DataIntegrityViolationException（unique key），
     * MySQL 下也可能是 gap lock 死結；呼叫端重呼即可走到鎖列累加路徑。
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public WeeklyVolumeRecord accumulate(Long userId, Long muscleGroupId, LocalDate weekStart, ZoneId zone,
                                         double volume, int sets) {
        var existing = repo.findForUpdate(userId, muscleGroupId, weekStart);
        if (existing.isPresent()) {
            WeeklyVolumeRecord rec = existing.get();
            rec.accumulate(volume, sets);
            return repo.save(rec);
        }

        WeeklyVolumeRecord rec = new WeeklyVolumeRecord();
        rec.setUserId(userId);
        rec.setMuscleGroupId(muscleGroupId);
        rec.setWeekStartDate(weekStart);
        rec.setWeekZone(zone.getId());
        rec.setTotalVolume(volume);
        rec.setTotalSets(sets);
        rec.setAverageIntensity(null);
        return repo.saveAndFlush(rec);
    }
}
