package com.calai.analytics.progression.repo;

import com.calai.analytics.progression.entity.LoadProgressionRecord;
import com.calai.analytics.progression.entity.ProgressionStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@ActiveProfiles("test")
@DataJpaTest
class LoadProgressionRecordRepoTest {

    @Autowired LoadProgressionRecordRepo repo;

    private LoadProgressionRecord save(long userId, long exerciseId, long sessionId, String date, double volume) {
        LoadProgressionRecord r = new LoadProgressionRecord();
        r.setUserId(userId);
        r.setExerciseId(exerciseId);
        r.setSessionId(sessionId);
        r.setSessionDate(Instant.parse(date));
        r.setWeight(100.0);
        r.setReps("10");
        r.setVolume(volume);
        r.setProgressionStatus(ProgressionStatus.BASELINE);
        return repo.save(r);
    }

    @Test
    void latest_is_ordered_by_session_date_not_insert_order() {
        save(1L, 7L, 2L, "2026-03-10T10:00:00Z", 2000);
        save(1L, 7L, 1L, "2026-03-03T10:00:00Z", 1000); // 補登較舊的 session
        save(1L, 8L, 3L, "2026-03-20T10:00:00Z", 9999); // 其他動作
        save(2L, 7L, 4L, "2026-03-20T10:00:00Z", 9999); // 其他使用者

        var latest = repo.findFirstByUserIdAndExerciseIdOrderBySessionDateDescIdDesc(1L, 7L);

        assertThat(latest).isPresent();
        assertThat(latest.get().getSessionId()).isEqualTo(2L);
        assertThat(latest.get().getCreatedAt()).isNotNull();
    }

    @Test
    void recent_returns_newest_first_and_honours_limit() {
        save(1L, 7L, 1L, "2026-03-01T10:00:00Z", 1);
        save(1L, 7L, 2L, "2026-03-08T10:00:00Z", 2);
        save(1L, 7L, 3L, "2026-03-15T10:00:00Z", 3);

        List<LoadProgressionRecord> recent = repo.findRecent(1L, 7L, PageRequest.of(0, 2));

        assertThat(recent).extracting(LoadProgressionRecord::getSessionId).containsExactly(3L, 2L);
    }

    @Test
    void no_history_is_empty() {
        assertThat(repo.findFirstByUserIdAndExerciseIdOrderBySessionDateDescIdDesc(1L, 7L)).isEmpty();
    }
}
