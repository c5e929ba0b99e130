package com.calai.analytics.landmark.service;

import com.calai.analytics.feedback.entity.RecoveryFeedback;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RecoveryScoringTest {

    private static RecoveryFeedback fb(Integer pump, Integer soreness, Integer effort, Integer energy, Integer sleep) {
        RecoveryFeedback f = new RecoveryFeedback();
        f.setPumpQuality(pump);
        f.setMuscleSoreness(soreness);
        f.setPerceivedEffort(effort);
        f.setEnergyLevel(energy);
        f.setSleepQuality(sleep);
        return f;
    }

    @Test
    void typical_feedback() {
        // 8×0.3 + 7×0.3 + (11−3)×0.4 = 7.7 → 8
        RecoveryFeedback f = fb(8, 3, 6, 7, 8);
        assertEquals(8, RecoveryScoring.recoveryLevel(f));
        // 8×0.5 + (11−6)×0.3 + 7×0.2 = 6.9 → 7
        assertEquals(7, RecoveryScoring.adaptationLevel(f));
    }

    @Test
    void best_possible_inputs_hit_ten() {
        RecoveryFeedback f = fb(10, 1, 1, 10, 10);
        assertEquals(10, RecoveryScoring.recoveryLevel(f));
        assertEquals(10, RecoveryScoring.adaptationLevel(f));
    }

    @Test
    void out_of_range_inputs_are_clamped() {
        assertEquals(10, RecoveryScoring.recoveryLevel(fb(null, 0, null, 20, 20)));
        assertEquals(1, RecoveryScoring.recoveryLevel(fb(null, 30, null, 0, 0)));
        assertEquals(1, RecoveryScoring.adaptationLevel(fb(0, null, 30, 0, null)));
        assertEquals(10, RecoveryScoring.adaptationLevel(fb(30, null, 0, 30, null)));
    }

    @Test
    void missing_values_count_as_five() {
        RecoveryFeedback empty = fb(null, null, null, null, null);
        // 1.5 + 1.5 + 2.4 = 5.4
        assertEquals(5, RecoveryScoring.recoveryLevel(empty));
        // 2.5 + 1.8 + 1.0 = 5.3
        assertEquals(5, RecoveryScoring.adaptationLevel(empty));
    }

    @Test
    void clamp_round() {
        assertEquals(1, RecoveryScoring.clampRound(-3.6));
        assertEquals(10, RecoveryScoring.clampRound(16.4));
        assertEquals(6, RecoveryScoring.clampRound(5.5));
    }
}
