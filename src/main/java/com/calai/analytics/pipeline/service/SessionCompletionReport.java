package com.calai.analytics.pipeline.service;

import java.time.LocalDate;
import java.util.Set;

public record SessionCompletionReport(
        Long sessionId,
        Long userId,
        LocalDate weekStart,
        int progressionRecords,
        Set<Long> muscleGroupsTouched,
        int landmarksUpdated
) {}
