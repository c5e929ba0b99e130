package com.calai.analytics.volume;

import java.time.*;
import java.time.temporal.TemporalAdjusters;

/**
 * 週分桶：以指定時區換算當地日期，再取「當天或之前最近的週一」。
 * 時區一定要明確傳入，不依賴 JVM 預設。
 */
public final class WeekStartKey {

    private WeekStartKey() {}

    public static LocalDate weekStart(Instant at, ZoneId zone) {
        return weekStart(ZonedDateTime.ofInstant(at, zone).toLocalDate());
    }

    public static LocalDate weekStart(LocalDate localDate) {
        return localDate.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }
}
