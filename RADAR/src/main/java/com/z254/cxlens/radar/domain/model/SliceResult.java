package com.z254.cxlens.radar.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Baseline versus current comparison of a metric restricted to one cohort slice.
 */
@Value
@Builder
public class SliceResult {
    Cohort cohort;
    double baselineValue;
    double currentValue;
    double delta;
    double deltaPercent;
    long orderCount;
    long baselineOrderCount;
    Double testStatistic;
    Double pValue;
    SignificanceLevel significance;

    public String label() {
        return cohort.label();
    }
}
