package com.z254.cxlens.radar.domain.model;

import lombok.Value;

import java.time.Instant;

/**
 * Identity of an incident: one per {@code (metric, cohort, detection window)}.
 */
@Value
public class IncidentKey {
    String metricName;
    String cohortKey;
    Instant windowStart;
    Instant windowEnd;

    public static IncidentKey of(String metricName, Cohort cohort, TimeRange window) {
        return new IncidentKey(metricName, cohort.key(), window.getStart(), window.getEnd());
    }

    public String asString() {
        return metricName + "|" + cohortKey + "|" + windowStart + "|" + windowEnd;
    }

    @Override
    public String toString() {
        return asString();
    }
}
