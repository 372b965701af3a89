package com.z254.cxlens.radar.detection;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.Arrays;

/**
 * Distance of the current value from the rolling mean of the preceding window,
 * in population standard deviations.
 */
public class ZScoreDetector implements SeriesDetector {

    public static final String METHOD = "z_score";

    @Override
    public String method() {
        return METHOD;
    }

    @Override
    public DetectorVote evaluate(double[] values, DetectionConfig config) {
        int current = values.length - 1;
        double[] history = history(values, config.getZScoreWindow());
        if (history.length < 2) {
            return DetectorVote.abstain(METHOD, "insufficient_history");
        }
        double std = new StandardDeviation(false).evaluate(history);
        if (std == 0.0) {
            return DetectorVote.abstain(METHOD, "zero_variance");
        }
        double z = Math.abs(values[current] - new Mean().evaluate(history)) / std;
        return DetectorVote.of(METHOD, z, config.getZScoreThreshold());
    }

    /**
     * Up to {@code window} points immediately before the current one.
     */
    static double[] history(double[] values, int window) {
        int current = values.length - 1;
        return Arrays.copyOfRange(values, Math.max(0, current - window), current);
    }
}
