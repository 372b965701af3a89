package com.z254.cxlens.radar.metrics;

import com.z254.cxlens.radar.domain.model.Cohort;
import com.z254.cxlens.radar.domain.model.TimeRange;

import java.util.List;

/**
 * Per-cohort aggregates used by the slicing engine.
 */
public interface CohortMetricsProvider {

    /**
     * Distinct values of a dimension among orders of the given cohort in the window, sorted.
     */
    List<String> dimensionValues(String dimension, Cohort within, TimeRange window);

    CohortSnapshot snapshot(String metricName, Cohort cohort, TimeRange window);
}
