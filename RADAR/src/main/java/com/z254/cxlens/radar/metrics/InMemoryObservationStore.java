package com.z254.cxlens.radar.metrics;

import com.z254.cxlens.radar.config.RadarProperties;
import com.z254.cxlens.radar.domain.model.Cohort;
import com.z254.cxlens.radar.domain.model.CxMetric;
import com.z254.cxlens.radar.domain.model.MetricPoint;
import com.z254.cxlens.radar.domain.model.MetricSeries;
import com.z254.cxlens.radar.domain.model.OrderObservation;
import com.z254.cxlens.radar.domain.model.TimeRange;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory metrics layer computing CX metrics from ingested order observations.
 * <p>
 * Observations are keyed by order id, so re-ingesting an order replaces it.
 * Series points are the metric mean per time bucket; empty buckets are skipped.
 */
@Slf4j
@Component
public class InMemoryObservationStore implements MetricSeriesProvider, CohortMetricsProvider, ObservationProvider {

    private static final Comparator<OrderObservation> ORDERING = Comparator
            .comparing(OrderObservation::getTimestamp)
            .thenComparing(OrderObservation::getOrderId);

    private final Map<String, OrderObservation> orders = new ConcurrentHashMap<>();
    private final Duration bucket;

    @Autowired
    public InMemoryObservationStore(RadarProperties properties) {
        this(properties.getDetection().getBucket());
    }

    public InMemoryObservationStore(Duration bucket) {
        if (bucket == null || bucket.isZero() || bucket.isNegative()) {
            throw new IllegalArgumentException("Bucket must be positive: " + bucket);
        }
        this.bucket = bucket;
    }

    /**
     * Add or replace observations.
     *
     * @return number of observations accepted
     */
    public int ingest(Collection<OrderObservation> observations) {
        int accepted = 0;
        for (OrderObservation observation : observations) {
            if (observation.getOrderId() == null || observation.getTimestamp() == null) {
                log.debug("Skipping observation without order id or timestamp: {}", observation);
                continue;
            }
            orders.put(observation.getOrderId(), observation);
            accepted++;
        }
        log.info("Ingested {} order observations ({} stored)", accepted, orders.size());
        return accepted;
    }

    public int size() {
        return orders.size();
    }

    public void clear() {
        orders.clear();
    }

    @Override
    public List<OrderObservation> observations(Cohort cohort, TimeRange range) {
        return orders.values().stream()
                .filter(o -> range.contains(o.getTimestamp()))
                .filter(o -> o.belongsTo(cohort))
                .sorted(ORDERING)
                .toList();
    }

    @Override
    public MetricSeries fetchSeries(String metricName, Cohort cohort, TimeRange range) {
        CxMetric metric = CxMetric.fromName(metricName);
        Map<Instant, SummaryStatistics> buckets = new TreeMap<>();
        for (OrderObservation order : observations(cohort, range)) {
            buckets.computeIfAbsent(bucketStart(order.getTimestamp()), b -> new SummaryStatistics())
                    .addValue(metric.perOrderValue(order));
        }
        List<MetricPoint> points = new ArrayList<>(buckets.size());
        buckets.forEach((start, stats) -> points.add(new MetricPoint(start, stats.getMean())));
        return new MetricSeries(metric.metricName(), cohort, points);
    }

    @Override
    public List<String> dimensionValues(String dimension, Cohort within, TimeRange window) {
        return observations(within, window).stream()
                .map(o -> o.getDimensions().get(dimension))
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .toList();
    }

    @Override
    public CohortSnapshot snapshot(String metricName, Cohort cohort, TimeRange window) {
        CxMetric metric = CxMetric.fromName(metricName);
        SummaryStatistics stats = new SummaryStatistics();
        observations(cohort, window).forEach(o -> stats.addValue(metric.perOrderValue(o)));
        if (stats.getN() == 0) {
            return CohortSnapshot.empty();
        }
        double stdDev = stats.getN() > 1 ? stats.getStandardDeviation() : 0.0;
        return new CohortSnapshot(stats.getMean(), stdDev, stats.getN());
    }

    private Instant bucketStart(Instant timestamp) {
        long size = bucket.toMillis();
        long millis = timestamp.toEpochMilli();
        return Instant.ofEpochMilli(millis - Math.floorMod(millis, size));
    }
}
