package com.z254.cxlens.radar.detection;

import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.Arrays;

/**
 * Residual of the current value against an exponentially weighted moving average,
 * scaled by the spread of the most recent residuals.
 */
public class EwmaDetector implements SeriesDetector {

    public static final String METHOD = "ewma";

    @Override
    public String method() {
        return METHOD;
    }

    @Override
    public DetectorVote evaluate(double[] values, DetectionConfig config) {
        int current = values.length - 1;
        if (current < config.getEwmaMinHistory()) {
            return DetectorVote.abstain(METHOD, "insufficient_history");
        }
        double[] ewma = smooth(values, config.getEwmaAlpha());
        double[] residuals = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            residuals[i] = values[i] - ewma[i];
        }
        int from = Math.max(0, values.length - config.getEwmaResidualWindow());
        double sigma = new StandardDeviation(false).evaluate(Arrays.copyOfRange(residuals, from, values.length));
        if (sigma == 0.0) {
            return DetectorVote.abstain(METHOD, "zero_variance");
        }
        double deviation = Math.abs(residuals[current]) / sigma;
        return DetectorVote.of(METHOD, deviation, config.getEwmaThreshold());
    }

    /**
     * EWMA seeded with the first value.
     */
    static double[] smooth(double[] values, double alpha) {
        double[] ewma = new double[values.length];
        ewma[0] = values[0];
        for (int i = 1; i < values.length; i++) {
            ewma[i] = alpha * values[i] + (1 - alpha) * ewma[i - 1];
        }
        return ewma;
    }
}
