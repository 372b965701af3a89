package com.z254.cxlens.radar.metrics;

import com.z254.cxlens.radar.domain.model.Cohort;
import com.z254.cxlens.radar.domain.model.MetricSeries;
import com.z254.cxlens.radar.domain.model.TimeRange;

/**
 * Supplies ordered metric series per {@code (metric, cohort)}.
 */
public interface MetricSeriesProvider {

    /**
     * @throws com.z254.cxlens.radar.exception.UnknownMetricException if the metric is not supported
     */
    MetricSeries fetchSeries(String metricName, Cohort cohort, TimeRange range);
}
