package com.calai.analytics.muscle.entity;

import jakarta.persistence.*;
import lombok.Data;

@Data
@Entity
@Table(name = "muscle_group")
public class MuscleGroup {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name="name", unique=true, nullable=false, length=64)
    private String name;

    @Column(name="category", nullable=false, length=32)
    private String category;

    @Column(name="body_region", nullable=false, length=32)
    private String bodyRegion;

    @Column(name="priority", nullable=false)
    private Integer priority = 0;
}
