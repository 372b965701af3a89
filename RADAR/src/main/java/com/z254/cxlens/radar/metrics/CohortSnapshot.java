package com.z254.cxlens.radar.metrics;

import lombok.Value;

/**
 * Aggregate of a metric for one cohort over one window.
 */
@Value
public class CohortSnapshot {
    double value;
    double stdDev;
    long orderCount;

    public static CohortSnapshot empty() {
        return new CohortSnapshot(Double.NaN, Double.NaN, 0);
    }

    public boolean isEmpty() {
        return orderCount == 0;
    }
}
