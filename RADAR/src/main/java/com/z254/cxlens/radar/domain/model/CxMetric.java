package com.z254.cxlens.radar.domain.model;

import com.z254.cxlens.radar.exception.UnknownMetricException;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

import static com.z254.cxlens.radar.domain.model.HypothesisCategory.*;

/**
 * Customer-experience metrics RADAR can detect regressions on.
 * <p>
 * Each metric knows its per-order value, its polarity, the binary outcome a
 * classifier should predict when attributing a regression, and which
 * hypothesis categories are worth testing when it regresses.
 */
public enum CxMetric {

    ON_TIME_RATE("on_time_rate", true, OrderObservation.LATE,
            EnumSet.of(SUPPLY, MERCHANT, POLICY, MODEL)) {
        @Override
        public double perOrderValue(OrderObservation order) {
            return order.outcome(OrderObservation.LATE) ? 0.0 : 1.0;
        }
    },
    CANCELLATION_RATE("cancellation_rate", false, OrderObservation.CANCELED,
            EnumSet.of(SUPPLY, MERCHANT, POLICY, OPERATIONAL)) {
        @Override
        public double perOrderValue(OrderObservation order) {
            return order.outcome(OrderObservation.CANCELED) ? 1.0 : 0.0;
        }
    },
    REFUND_RATE("refund_rate", false, OrderObservation.REFUNDED,
            EnumSet.of(INVENTORY, MERCHANT)) {
        @Override
        public double perOrderValue(OrderObservation order) {
            return order.outcome(OrderObservation.REFUNDED) ? 1.0 : 0.0;
        }
    },
    ITEM_ACCURACY("item_accuracy", true, OrderObservation.ITEM_ISSUE,
            EnumSet.of(INVENTORY, MERCHANT)) {
        @Override
        public double perOrderValue(OrderObservation order) {
            return order.outcome(OrderObservation.ITEM_ISSUE) ? 0.0 : 1.0;
        }
    },
    CX_SCORE("cx_score", true, OrderObservation.LATE,
            EnumSet.allOf(HypothesisCategory.class)) {
        @Override
        public double perOrderValue(OrderObservation order) {
            double good = 0;
            good += order.outcome(OrderObservation.LATE) ? 0 : 1;
            good += order.outcome(OrderObservation.CANCELED) ? 0 : 1;
            good += order.outcome(OrderObservation.REFUNDED) ? 0 : 1;
            good += order.outcome(OrderObservation.ITEM_ISSUE) ? 0 : 1;
            return 100.0 * good / 4.0;
        }
    };

    private final String metricName;
    private final boolean higherIsBetter;
    private final String outcome;
    private final Set<HypothesisCategory> relevantCategories;

    CxMetric(String metricName, boolean higherIsBetter, String outcome,
             Set<HypothesisCategory> relevantCategories) {
        this.metricName = metricName;
        this.higherIsBetter = higherIsBetter;
        this.outcome = outcome;
        this.relevantCategories = relevantCategories;
    }

    /**
     * Value this metric assigns to a single order; the metric is the mean over orders.
     */
    public abstract double perOrderValue(OrderObservation order);

    public String metricName() {
        return metricName;
    }

    public boolean higherIsBetter() {
        return higherIsBetter;
    }

    public String outcome() {
        return outcome;
    }

    public Set<HypothesisCategory> relevantCategories() {
        return relevantCategories;
    }

    /**
     * Direction of a change in this metric, taking polarity into account.
     */
    public Incident.Direction directionOf(double delta) {
        boolean worse = higherIsBetter ? delta < 0 : delta > 0;
        return worse ? Incident.Direction.REGRESSION : Incident.Direction.IMPROVEMENT;
    }

    public static CxMetric fromName(String metricName) {
        return Arrays.stream(values())
                .filter(m -> m.metricName.equalsIgnoreCase(metricName))
                .findFirst()
                .orElseThrow(() -> new UnknownMetricException(metricName));
    }
}
