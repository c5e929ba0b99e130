package com.calai.analytics.pipeline.event;

import java.time.ZoneId;

/** 外部在 session 完成時發布；zone 可為 null（用預設週時區） */
public record WorkoutSessionCompletedEvent(Long sessionId, Long userId, ZoneId zone) {}
