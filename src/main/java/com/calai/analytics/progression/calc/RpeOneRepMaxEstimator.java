package com.calai.analytics.progression.calc;

import java.util.Map;

/**
 * RPE 表估算 1RM：1RM = weight / fraction(rpe, repsBucket)。
 * 純函式，任何輸入都回傳數值。
 */
public final class RpeOneRepMaxEstimator {
    private RpeOneRepMaxEstimator() {}

    static final double FALLBACK_FRACTION = 0.75;

    // rpe -> (reps bucket -> 該組重量佔 1RM 的比例)
    private static final Map<Integer, Map<Integer, Double>> RPE_TABLE = Map.of(
            6,  Map.of(1, 0.89, 2, 0.86, 3, 0.83, 5, 0.77, 8, 0.71, 10, 0.65),
            7,  Map.of(1, 0.92, 2, 0.89, 3, 0.86, 5, 0.81, 8, 0.75, 10, 0.69),
            8,  Map.of(1, 0.96, 2, 0.92, 3, 0.89, 5, 0.84, 8, 0.78, 10, 0.72),
            9,  Map.of(1, 1.00, 2, 0.96, 3, 0.92, 5, 0.87, 8, 0.81, 10, 0.75),
            10, Map.of(1, 1.00, 2, 1.00, 3, 0.96, 5, 0.91, 8, 0.84, 10, 0.78)
    );

    public static double estimate(double weight, double rpe, double reps) {
        return weight / fraction(rpe, reps);
    }

    public static double fraction(double rpe, double reps) {
        if (Double.isNaN(rpe) || Double.isInfinite(rpe)) return FALLBACK_FRACTION;
        int row = (int) Math.round(Math.max(6.0, Math.min(10.0, rpe)));
        Map<Integer, Double> byReps = RPE_TABLE.get(row);
        if (byReps == null) return FALLBACK_FRACTION;
        Double f = byReps.get(repsBucket(reps));
        return f == null ? FALLBACK_FRACTION : f;
    }

    /** 取不超過的最近 bucket：≤1→1, ≤2→2, ≤3→3, ≤5→5, ≤8→8, 其餘→10 */
    public static int repsBucket(double reps) {
        if (reps <= 1) return 1;
        if (reps <= 2) return 2;
        if (reps <= 3) return 3;
        if (reps <= 5) return 5;
        if (reps <= 8) return 8;
        return 10;
    }

    /** 平均每組次數；組數沒填時退回解析出來的組數 */
    public static double representativeReps(long totalReps, Integer sets, int parsedSetCount) {
        int divisor = (sets != null && sets > 0) ? sets : Math.max(1, parsedSetCount);
        return (double) totalReps / divisor;
    }
}
