package com.calai.analytics.progression.entity;

public enum ProgressionStatus {
    BASELINE,
    IMPROVED,
    MAINTAINED,
    DECLINED
}
