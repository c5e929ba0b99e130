package com.calai.analytics.landmark.service;

import com.calai.analytics.feedback.entity.RecoveryFeedback;

/**
 * 由恢復回饋算出兩個 1-10 分數。
 * 任何極端輸入（0、11 以上）都會夾回 [1, 10]；缺值當 5。
 */
public final class RecoveryScoring {
    private RecoveryScoring() {}

    private static final int NEUTRAL = 5;

    /** sleep×0.3 + energy×0.3 + (11−soreness)×0.4 */
    public static int recoveryLevel(RecoveryFeedback f) {
        double sleep = orNeutral(f.getSleepQuality());
        double energy = orNeutral(f.getEnergyLevel());
        double soreness = orNeutral(f.getMuscleSoreness());
        return clampRound(sleep * 0.3 + energy * 0.3 + (11 - soreness) * 0.4);
    }

    /** pump×0.5 + (11−effort)×0.3 + energy×0.2 */
    public static int adaptationLevel(RecoveryFeedback f) {
        double pump = orNeutral(f.getPumpQuality());
        double effort = orNeutral(f.getPerceivedEffort());
        double energy = orNeutral(f.getEnergyLevel());
        return clampRound(pump * 0.5 + (11 - effort) * 0.3 + energy * 0.2);
    }

    static int clampRound(double score) {
        return (int) Math.round(Math.max(1.0, Math.min(10.0, score)));
    }

    private static int orNeutral(Integer v) {
        return v == null ? NEUTRAL : v;
    }
}
