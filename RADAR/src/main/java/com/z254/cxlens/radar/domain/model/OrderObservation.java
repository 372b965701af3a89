package com.z254.cxlens.radar.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Order-level record supplied by the metrics layer.
 * <p>
 * Carries the cohort dimensions of the order, its binary CX outcomes and the
 * numeric operational features used as evidence during root cause analysis.
 */
@Value
@Builder
@Jacksonized
public class OrderObservation {

    public static final String LATE = "late";
    public static final String CANCELED = "canceled";
    public static final String REFUNDED = "refunded";
    public static final String ITEM_ISSUE = "item_issue";

    String orderId;
    Instant timestamp;

    @Builder.Default
    Map<String, String> dimensions = Map.of();

    @Builder.Default
    Map<String, Boolean> outcomes = Map.of();

    @Builder.Default
    Map<String, Double> features = Map.of();

    public boolean outcome(String name) {
        return Boolean.TRUE.equals(outcomes.get(name));
    }

    public OptionalDouble feature(String name) {
        Double value = features.get(name);
        return value == null || value.isNaN() ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public boolean belongsTo(Cohort cohort) {
        return cohort.matches(dimensions);
    }
}
