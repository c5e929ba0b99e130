package com.calai.analytics.muscle.entity;

import jakarta.persistence.*;
import lombok.Data;

@Data
@Entity
@Table(name = "exercise_muscle_mapping",
        uniqueConstraints = @UniqueConstraint(name="uq_exercise_muscle", columnNames={"exercise_id","muscle_group_id"}))
public class ExerciseMuscleMapping {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name="exercise_id", nullable=false)
    private Long exerciseId;

    @Column(name="muscle_group_id", nullable=false)
    private Long muscleGroupId;

    /** (0, 1]；同一動作的多筆 mapping 不要求加總為 1 */
    @Column(name="volume_contribution")
    private Double volumeContribution;

    public double contributionOrDefault() {
        return volumeContribution == null ? 1.0 : volumeContribution;
    }
}
