package com.calai.analytics.volume.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

@Getter
@Setter
@Entity
@Table(name = "weekly_volume_record",
        uniqueConstraints = @UniqueConstraint(name = "uq_user_muscle_week",
                columnNames = {"user_id", "muscle_group_id", "week_start_date"}))
public class WeeklyVolumeRecord {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "muscle_group_id", nullable = false)
    private Long muscleGroupId;

    /** 一定是週一 */
    @Column(name = "week_start_date", nullable = false)
    private LocalDate weekStartDate;

    @Column(name = "week_zone", nullable = false, length = 64)
    private String weekZone;

    @Column(name = "total_volume", nullable = false)
    private double totalVolume;

    @Column(name = "total_sets", nullable = false)
    private int totalSets;

    /** 保留欄位，目前不計算 */
    @Column(name = "average_intensity")
    private Double averageIntensity;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public void accumulate(double volume, int sets) {
        this.totalVolume += volume;
        this.totalSets += sets;
    }

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }
}
