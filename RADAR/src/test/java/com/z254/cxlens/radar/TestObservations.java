package com.z254.cxlens.radar;

import com.z254.cxlens.radar.domain.model.OrderObservation;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic order fixtures shared by tests.
 */
public final class TestObservations {

    public static final Instant BASE = Instant.parse("2026-03-02T00:00:00Z");
    public static final int HOURS = 20;
    public static final int ORDERS_PER_HOUR = 20;

    /** Late orders per hour before the swing */
    private static final int[] REGRESSION_PATTERN = {1, 2, 3, 2};
    private static final int[] IMPROVEMENT_PATTERN = {8, 9, 10, 9};
    public static final int REGRESSED_LATE = 15;

    private TestObservations() {
    }

    /**
     * Twenty hours of twenty orders each; the final hour has most orders late, with
     * dasher wait driving lateness throughout.
     */
    public static List<OrderObservation> onTimeRegression() {
        return onTimeSeries(REGRESSION_PATTERN, REGRESSED_LATE);
    }

    /**
     * Same shape as {@link #onTimeRegression()} but about half the orders run late
     * until the final hour, where none do.
     */
    public static List<OrderObservation> onTimeImprovement() {
        return onTimeSeries(IMPROVEMENT_PATTERN, 0);
    }

    private static List<OrderObservation> onTimeSeries(int[] latePattern, int finalLate) {
        List<OrderObservation> orders = new ArrayList<>();
        for (int hour = 0; hour < HOURS; hour++) {
            boolean last = hour == HOURS - 1;
            int late = last ? finalLate : latePattern[hour % latePattern.length];
            for (int i = 0; i < ORDERS_PER_HOUR; i++) {
                boolean isLate = i < late;
                double dasherWait = (isLate ? 14.0 : 4.0) + (i % 5) * 0.5 + (last && finalLate > 0 ? 3.0 : 0.0);
                orders.add(order("o-" + hour + "-" + i,
                        BASE.plus(Duration.ofHours(hour)).plus(Duration.ofMinutes(i * 2L)),
                        Map.of("region", i % 2 == 0 ? "north" : "south",
                                "store", i % 4 < 2 ? "s1" : "s2"),
                        Map.of(OrderObservation.LATE, isLate),
                        Map.of("dasher_wait", dasherWait,
                                "merchant_prep_time", 10.0 + (i % 3),
                                "distance", 2.0 + (i % 7) * 0.3)));
            }
        }
        return orders;
    }

    public static OrderObservation order(String id, Instant at, Map<String, String> dimensions,
                                         Map<String, Boolean> outcomes, Map<String, Double> features) {
        return OrderObservation.builder()
                .orderId(id)
                .timestamp(at)
                .dimensions(new HashMap<>(dimensions))
                .outcomes(new HashMap<>(outcomes))
                .features(new HashMap<>(features))
                .build();
    }

    public static Instant hour(int h) {
        return BASE.plus(Duration.ofHours(h));
    }
}
