package com.calai.analytics.workout.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Data
@Entity
@Table(name = "workout_session")
public class WorkoutSession {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name="user_id", nullable=false)
    private Long userId;

    @Column(name="name", nullable=false, length=128)
    private String name;

    @Column(name="started_at", nullable=false)
    private Instant startedAt;

    @Column(name="completed", nullable=false)
    private boolean completed;

    @Column(name="created_at", nullable=false, updatable=false)
    private Instant createdAt = Instant.now();
}
