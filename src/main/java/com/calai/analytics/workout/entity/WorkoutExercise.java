package com.calai.analytics.workout.entity;

import jakarta.persistence.*;
import lombok.Data;

/**
 * session 內單一動作的實際表現（唯讀輸入）。
 * actualReps 為次數記法字串："8,10,12" / "8-12" / "10"
 */
@Data
@Entity
@Table(name = "workout_exercise",
        indexes = @Index(name = "idx_workout_exercise_session", columnList = "session_id"))
public class WorkoutExercise {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name="session_id", nullable=false)
    private Long sessionId;

    @Column(name="exercise_id", nullable=false)
    private Long exerciseId;

    @Column(name="order_index", nullable=false)
    private Integer orderIndex = 0;

    /** 預定組數 */
    @Column(name="sets", nullable=false)
    private Integer sets;

    @Column(name="actual_reps", length=64)
    private String actualReps;

    @Column(name="weight")
    private Double weight;

    @Column(name="rpe")
    private Double rpe;

    @Column(name="rir")
    private Integer rir;

    @Column(name="completed", nullable=false)
    private boolean completed;

    /** 有次數、有正重量才算可分析的表現 */
    public boolean hasLoadData() {
        return actualReps != null && !actualReps.isBlank()
                && weight != null && weight > 0;
    }
}
