package com.calai.analytics.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DateTimeException;
import java.time.ZoneId;

@Slf4j
@ConfigurationProperties(prefix = "app.analytics")
public class AnalyticsProperties {

    /** 週分桶用的預設時區（呼叫端沒帶 zone 時使用） */
    private String weekZone = "UTC";

    /** progression history 預設回傳筆數 */
    private int historyLimit = 20;

    public String getWeekZone() { return weekZone; }
    public void setWeekZone(String weekZone) { this.weekZone = weekZone; }

    public int getHistoryLimit() { return historyLimit; }
    public void setHistoryLimit(int historyLimit) { this.historyLimit = historyLimit; }

    public ZoneId weekZoneId() {
        try {
            return (weekZone == null || weekZone.isBlank()) ? ZoneId.of("UTC") : ZoneId.of(weekZone.trim());
        } catch (DateTimeException e) {
            log.warn("[analytics-config] invalid week-zone '{}', fallback to UTC", weekZone);
            return ZoneId.of("UTC");
        }
    }
}
