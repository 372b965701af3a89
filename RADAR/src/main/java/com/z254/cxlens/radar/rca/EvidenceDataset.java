package com.z254.cxlens.radar.rca;

import com.z254.cxlens.radar.domain.model.Cohort;
import com.z254.cxlens.radar.domain.model.CxMetric;
import com.z254.cxlens.radar.domain.model.Incident;
import com.z254.cxlens.radar.domain.model.OrderObservation;
import com.z254.cxlens.radar.domain.model.TimeRange;
import com.z254.cxlens.radar.metrics.ObservationProvider;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.OptionalDouble;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable order-level data for one incident, shared by every hypothesis test.
 * <p>
 * The detection window is split at the evaluated bucket: orders before it form the
 * baseline, orders from it onwards the current period.
 */
@Getter
public class EvidenceDataset {

    private final String incidentId;
    private final CxMetric metric;
    private final Cohort cohort;
    private final TimeRange window;
    private final Instant splitAt;
    private final Duration bucket;
    private final List<OrderObservation> cohortOrders;
    private final List<OrderObservation> populationOrders;
    private final List<OrderObservation> baselineOrders;
    private final List<OrderObservation> currentOrders;

    public EvidenceDataset(String incidentId, CxMetric metric, Cohort cohort, TimeRange window,
                           Instant splitAt, Duration bucket,
                           List<OrderObservation> cohortOrders,
                           List<OrderObservation> populationOrders) {
        this.incidentId = incidentId;
        this.metric = metric;
        this.cohort = cohort;
        this.window = window;
        this.splitAt = splitAt;
        this.bucket = bucket;
        this.cohortOrders = List.copyOf(cohortOrders);
        this.populationOrders = List.copyOf(populationOrders);
        this.baselineOrders = this.cohortOrders.stream()
                .filter(o -> o.getTimestamp().isBefore(splitAt))
                .toList();
        this.currentOrders = this.cohortOrders.stream()
                .filter(o -> !o.getTimestamp().isBefore(splitAt))
                .toList();
    }

    public static EvidenceDataset load(Incident incident, ObservationProvider observations, Duration bucket) {
        TimeRange window = incident.getDetectionWindow();
        Instant splitAt = incident.getEvaluatedAt() != null
                ? incident.getEvaluatedAt()
                : window.getStart().plus(window.length().dividedBy(2));
        return new EvidenceDataset(
                incident.getId(),
                CxMetric.fromName(incident.getMetricName()),
                incident.getCohort(),
                window,
                splitAt,
                bucket,
                observations.observations(incident.getCohort(), window),
                observations.observations(Cohort.ROOT, window));
    }

    /**
     * Present values of a feature, in order.
     */
    public static double[] featureValues(Collection<OrderObservation> orders, String feature) {
        return orders.stream()
                .map(o -> o.feature(feature))
                .filter(OptionalDouble::isPresent)
                .mapToDouble(OptionalDouble::getAsDouble)
                .toArray();
    }

    /**
     * Every feature name present on at least one cohort order, sorted.
     */
    public SortedSet<String> featureNames() {
        SortedSet<String> names = new TreeSet<>();
        cohortOrders.forEach(o -> names.addAll(o.getFeatures().keySet()));
        return names;
    }

    public double outcomeOf(OrderObservation order) {
        return metric.perOrderValue(order);
    }
}
