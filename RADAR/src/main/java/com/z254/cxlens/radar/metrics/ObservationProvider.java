package com.z254.cxlens.radar.metrics;

import com.z254.cxlens.radar.domain.model.Cohort;
import com.z254.cxlens.radar.domain.model.OrderObservation;
import com.z254.cxlens.radar.domain.model.TimeRange;

import java.util.List;

/**
 * Order-level rows for evidence computation.
 */
public interface ObservationProvider {

    /**
     * Orders of the cohort inside the range, ordered by timestamp then order id.
     */
    List<OrderObservation> observations(Cohort cohort, TimeRange range);
}
