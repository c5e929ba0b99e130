package com.calai.analytics.volume.service;

import com.calai.analytics.volume.entity.WeeklyVolumeRecord;
import com.calai.analytics.volume.repo.WeeklyVolumeRecordRepo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ledger 每次呼叫自己開交易（REQUIRES_NEW），所以測試本身不包交易，結束後自己清表
 */
@ActiveProfiles("test")
@DataJpaTest
@Import(WeeklyVolumeLedger.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class WeeklyVolumeLedgerJpaTest {

    private static final ZoneId UTC = ZoneId.of("UTC");
    private static final LocalDate WEEK = LocalDate.of(2026, 3, 2);

    @Autowired WeeklyVolumeLedger ledger;
    @Autowired WeeklyVolumeRecordRepo repo;

    @AfterEach
    void cleanup() {
        repo.deleteAll();
    }

    @Test
    void first_contribution_creates_the_week_row() {
        WeeklyVolumeRecord rec = ledger.accumulate(1L, 10L, WEEK, UTC, 3000.0, 3);

        assertThat(rec.getId()).isNotNull();
        assertThat(rec.getTotalVolume()).isEqualTo(3000.0);
        assertThat(rec.getTotalSets()).isEqualTo(3);
        assertThat(rec.getWeekZone()).isEqualTo("UTC");
        assertThat(rec.getAverageIntensity()).isNull();
        assertThat(rec.getCreatedAt()).isNotNull();
    }

    @Test
    void later_contributions_in_the_same_week_accumulate_into_one_row() {
        ledger.accumulate(1L, 10L, WEEK, UTC, 3000.0, 3);
        ledger.accumulate(1L, 10L, WEEK, UTC, 1500.0, 4);

        List<WeeklyVolumeRecord> rows = repo.findAll();
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).getTotalVolume()).isEqualTo(4500.0);
        assertThat(rows.get(0).getTotalSets()).isEqualTo(7);
    }

    @Test
    void different_week_muscle_or_user_gets_its_own_row() {
        ledger.accumulate(1L, 10L, WEEK, UTC, 100.0, 1);
        ledger.accumulate(1L, 10L, WEEK.plusWeeks(1), UTC, 100.0, 1);
        ledger.accumulate(1L, 11L, WEEK, UTC, 100.0, 1);
        ledger.accumulate(2L, 10L, WEEK, UTC, 100.0, 1);

        assertThat(repo.count()).isEqualTo(4);
    }

    @Test
    void unique_key_rejects_a_second_row_for_the_same_week() {
        ledger.accumulate(1L, 10L, WEEK, UTC, 100.0, 1);

        WeeklyVolumeRecord dup = new WeeklyVolumeRecord();
        dup.setUserId(1L);
        dup.setMuscleGroupId(10L);
        dup.setWeekStartDate(WEEK);
        dup.setWeekZone("UTC");

        assertThatThrownBy(() -> repo.saveAndFlush(dup)).isInstanceOf(DataIntegrityViolationException.class);
    }
}
