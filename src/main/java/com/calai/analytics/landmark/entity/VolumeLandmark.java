package com.calai.analytics.landmark.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * 每個 (user, muscleGroup) 一列。
 * MV/MEV/MAV/MRV 由外部維護；這裡只會寫 currentVolume / recoveryLevel / adaptationLevel / lastUpdated。
 */
@Getter
@Setter
@Entity
@Table(name = "volume_landmark",
        uniqueConstraints = @UniqueConstraint(name = "uq_landmark_user_muscle", columnNames = {"user_id", "muscle_group_id"}))
public class VolumeLandmark {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "muscle_group_id", nullable = false, updatable = false)
    private Long muscleGroupId;

    /** maintenance volume */
    @Column(name = "mv", nullable = false)
    private int mv;

    /** minimum effective volume */
    @Column(name = "mev", nullable = false)
    private int mev;

    /** maximum adaptive volume */
    @Column(name = "mav", nullable = false)
    private int mav;

    /** maximum recoverable volume */
    @Column(name = "mrv", nullable = false)
    private int mrv;

    @Column(name = "current_volume", nullable = false)
    private int currentVolume;

    @Column(name = "target_volume", nullable = false)
    private int targetVolume;

    @Column(name = "recovery_level", nullable = false)
    private int recoveryLevel = 5;

    @Column(name = "adaptation_level", nullable = false)
    private int adaptationLevel = 5;

    @Column(name = "last_updated")
    private Instant lastUpdated;
}
