package com.calai.analytics.feedback.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/** 使用者對單一 session 的主觀恢復回饋，各項 1-10 */
@Data
@Entity
@Table(name = "recovery_feedback",
        uniqueConstraints = @UniqueConstraint(name = "uq_feedback_session", columnNames = {"session_id"}))
public class RecoveryFeedback {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "pump_quality")
    private Integer pumpQuality;

    @Column(name = "muscle_soreness")
    private Integer muscleSoreness;

    @Column(name = "perceived_effort")
    private Integer perceivedEffort;

    @Column(name = "energy_level")
    private Integer energyLevel;

    @Column(name = "sleep_quality")
    private Integer sleepQuality;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();
}
