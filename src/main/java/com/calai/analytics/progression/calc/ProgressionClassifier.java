package com.calai.analytics.progression.calc;

import com.calai.analytics.progression.entity.LoadProgressionRecord;
import com.calai.analytics.progression.entity.ProgressionStatus;

public final class ProgressionClassifier {
    private ProgressionClassifier() {}

    static final double VOLUME_IMPROVED_RATIO = 1.05;
    static final double WEIGHT_IMPROVED_RATIO = 1.025;
    static final double VOLUME_DECLINED_RATIO = 0.95;

    /** 順序有意義：先看 volume 進步，再看重量進步，最後才判退步 */
    public static ProgressionStatus classify(double volume, double weight, LoadProgressionRecord prior) {
        if (prior == null) return ProgressionStatus.BASELINE;

        double prevVolume = prior.getVolume() == null ? 0.0 : prior.getVolume();
        double prevWeight = prior.getWeight() == null ? 0.0 : prior.getWeight();

        if (volume > prevVolume * VOLUME_IMPROVED_RATIO) return ProgressionStatus.IMPROVED;
        if (weight > prevWeight * WEIGHT_IMPROVED_RATIO) return ProgressionStatus.IMPROVED;
        if (volume < prevVolume * VOLUME_DECLINED_RATIO) return ProgressionStatus.DECLINED;
        return ProgressionStatus.MAINTAINED;
    }
}
