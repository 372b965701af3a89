package com.z254.cxlens.radar.domain.model;

import lombok.Value;

import java.time.Instant;

/**
 * One observation of a metric at a point in time.
 */
@Value
public class MetricPoint {
    Instant timestamp;
    double value;
}
