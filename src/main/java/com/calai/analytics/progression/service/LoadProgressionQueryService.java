package com.calai.analytics.progression.service;

import com.calai.analytics.config.AnalyticsProperties;
import com.calai.analytics.progression.entity.LoadProgressionRecord;
import com.calai.analytics.progression.repo.LoadProgressionRecordRepo;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
public class LoadProgressionQueryService {

    private static final int MAX_LIMIT = 200;

    private final LoadProgressionRecordRepo repo;
    private final AnalyticsProperties props;

    public LoadProgressionQueryService(LoadProgressionRecordRepo repo, AnalyticsProperties props) {
        this.repo = repo;
        this.props = props;
    }

    /** 新到舊；limit 為 null 或 ≤0 時用設定的預設筆數 */
    @Transactional(readOnly = true)
    public List<LoadProgressionRecord> history(Long userId, Long exerciseId, Integer limit) {
        int n = (limit == null || limit <= 0) ? props.getHistoryLimit() : Math.min(limit, MAX_LIMIT);
        return repo.findRecent(userId, exerciseId, PageRequest.of(0, n));
    }

    @Transactional(readOnly = true)
    public Optional<LoadProgressionRecord> latest(Long userId, Long exerciseId) {
        return repo.findFirstByUserIdAndExerciseIdOrderBySessionDateDescIdDesc(userId, exerciseId);
    }
}
