package com.calai.analytics.progression.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * append-only：建立後不再修改或刪除，tracker 用它當歷史比較基準。
 */
@Getter
@Setter
@Entity
@Table(name = "load_progression_record",
        indexes = @Index(name = "idx_lpr_user_exercise_date", columnList = "user_id,exercise_id,session_date"))
public class LoadProgressionRecord {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "exercise_id", nullable = false, updatable = false)
    private Long exerciseId;

    @Column(name = "session_id", nullable = false, updatable = false)
    private Long sessionId;

    @Column(name = "session_date", nullable = false, updatable = false)
    private Instant sessionDate;

    @Column(name = "weight", nullable = false, updatable = false)
    private Double weight;

    /** 解析後的次數序列，逗號分隔 */
    @Column(name = "reps", nullable = false, length = 128, updatable = false)
    private String reps;

    @Column(name = "volume", nullable = false, updatable = false)
    private Double volume;

    @Column(name = "estimated_one_rep_max", updatable = false)
    private Double estimatedOneRepMax;

    @Column(name = "rpe", updatable = false)
    private Double rpe;

    @Column(name = "rir", updatable = false)
    private Integer rir;

    @Enumerated(EnumType.STRING)
    @Column(name = "progression_status", nullable = false, length = 16, updatable = false)
    private ProgressionStatus progressionStatus;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
