package com.z254.cxlens.radar.detection;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.Arrays;

/**
 * Two-segment mean-shift test.
 * <p>
 * The candidate split is the latest index that still leaves a full post-change
 * segment, so the evaluated point always lies in the segment after the split.
 */
public class BayesianChangePointDetector implements SeriesDetector {

    public static final String METHOD = "bayesian";

    @Override
    public String method() {
        return METHOD;
    }

    @Override
    public DetectorVote evaluate(double[] values, DetectionConfig config) {
        int split = values.length - config.getBayesianMinSegment();
        return evaluateSplit(values, split, config);
    }

    /**
     * Test a shift between {@code values[0, split)} and {@code values[split, n)}.
     */
    public DetectorVote evaluateSplit(double[] values, int split, DetectionConfig config) {
        int minSegment = config.getBayesianMinSegment();
        if (split < minSegment || values.length - split < minSegment) {
            return DetectorVote.abstain(METHOD, "segment_too_short");
        }
        double[] before = Arrays.copyOfRange(values, 0, split);
        double[] after = Arrays.copyOfRange(values, split, values.length);

        StandardDeviation sd = new StandardDeviation();
        double std1 = sd.evaluate(before);
        double std2 = sd.evaluate(after);
        if (std1 == 0.0 || std2 == 0.0) {
            return DetectorVote.abstain(METHOD, "zero_variance");
        }
        double pooled = Math.sqrt((std1 * std1 + std2 * std2) / 2);
        Mean mean = new Mean();
        double t = Math.abs(mean.evaluate(before) - mean.evaluate(after)) / pooled;
        return DetectorVote.of(METHOD, t, config.getBayesianThreshold());
    }
}
