package com.z254.cxlens.radar.detection;

import com.z254.cxlens.radar.domain.model.Severity;

/**
 * Percentile-rank severity of a value against the full series distribution.
 * <p>
 * Severity is two-tailed: a value at the 97th percentile is as extreme as one at
 * the 3rd, so spikes in lower-is-better metrics (cancellation, refunds) rank the
 * same as drops in higher-is-better ones. Whether the swing is a regression is
 * decided by the metric's polarity, not here.
 */
public final class SeverityClassifier {

    private SeverityClassifier() {
    }

    /**
     * Rank percentile: ties count half, matching the usual "rank" definition.
     */
    public static double percentileOfScore(double[] distribution, double value) {
        if (distribution.length == 0) {
            return Double.NaN;
        }
        int left = 0;
        int right = 0;
        for (double v : distribution) {
            if (v < value) {
                left++;
            }
            if (v <= value) {
                right++;
            }
        }
        int plusOne = right > left ? 1 : 0;
        return (left + right + plusOne) * 50.0 / distribution.length;
    }

    /**
     * Distance of a percentile from the nearer end of the distribution.
     */
    public static double tailPercentile(double percentile) {
        return Math.min(percentile, 100.0 - percentile);
    }

    public static Severity classify(double percentile, DetectionConfig config) {
        double tail = tailPercentile(percentile);
        if (tail < config.getHighSeverityPercentile()) {
            return Severity.HIGH;
        }
        if (tail < config.getMediumSeverityPercentile()) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }
}
