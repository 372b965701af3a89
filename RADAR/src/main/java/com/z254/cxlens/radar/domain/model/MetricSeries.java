package com.z254.cxlens.radar.domain.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ordered sequence of metric points for one {@code (metric, cohort)} key.
 * <p>
 * Points are sorted by timestamp on construction and the series is immutable.
 */
@Value
public class MetricSeries {

    String metricName;
    Cohort cohort;
    List<MetricPoint> points;

    public MetricSeries(String metricName, Cohort cohort, List<MetricPoint> points) {
        this.metricName = metricName;
        this.cohort = cohort;
        this.points = points.stream()
                .sorted(Comparator.comparing(MetricPoint::getTimestamp))
                .toList();
    }

    public static MetricSeries ofValues(String metricName, Cohort cohort, Instant start,
                                        Duration step, double... values) {
        List<MetricPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(new MetricPoint(start.plus(step.multipliedBy(i)), values[i]));
        }
        return new MetricSeries(metricName, cohort, points);
    }

    public double[] values() {
        return points.stream().mapToDouble(MetricPoint::getValue).toArray();
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public MetricPoint latest() {
        return points.get(points.size() - 1);
    }
}
