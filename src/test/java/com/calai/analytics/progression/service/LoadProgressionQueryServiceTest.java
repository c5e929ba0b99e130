package com.calai.analytics.progression.service;

import com.calai.analytics.config.AnalyticsProperties;
import com.calai.analytics.progression.repo.LoadProgressionRecordRepo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.domain.Pageable;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class LoadProgressionQueryServiceTest {

    private LoadProgressionRecordRepo repo;
    private LoadProgressionQueryService service;

    @BeforeEach
    void setUp() {
        repo = mock(LoadProgressionRecordRepo.class);
        when(repo.findRecent(eq(1L), eq(7L), any(Pageable.class))).thenReturn(List.of());
        AnalyticsProperties props = new AnalyticsProperties();
        props.setHistoryLimit(20);
        service = new LoadProgressionQueryService(repo, props);
    }

    private int requestedSize(Integer limit) {
        service.history(1L, 7L, limit);
        ArgumentCaptor<Pageable> captor = ArgumentCaptor.forClass(Pageable.class);
        verify(repo, atLeastOnce()).findRecent(eq(1L), eq(7L), captor.capture());
        return captor.getValue().getPageSize();
    }

    @Test
    void default_limit_comes_from_config() {
        assertEquals(20, requestedSize(null));
    }

    @Test
    void non_positive_limit_uses_default() {
        assertEquals(20, requestedSize(0));
    }

    @Test
    void explicit_limit_is_capped() {
        assertEquals(5, requestedSize(5));
        assertEquals(200, requestedSize(10_000));
    }
}
