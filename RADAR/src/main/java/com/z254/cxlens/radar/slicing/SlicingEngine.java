package com.z254.cxlens.radar.slicing;

import com.z254.cxlens.radar.config.RadarProperties;
import com.z254.cxlens.radar.domain.model.Cohort;
import com.z254.cxlens.radar.domain.model.SignificanceLevel;
import com.z254.cxlens.radar.domain.model.SliceResult;
import com.z254.cxlens.radar.domain.model.TimeRange;
import com.z254.cxlens.radar.metrics.CohortMetricsProvider;
import com.z254.cxlens.radar.metrics.CohortSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Finds the cohort slices beneath a regressed cohort that drive the regression.
 * <p>
 * Enumerates single-dimension slices, then dimension pairs, compares each
 * slice's metric between the baseline and current windows with a two-sample
 * z-test, and keeps the slices that move the same way as the parent cohort.
 */
@Slf4j
@Component
public class SlicingEngine {

    static final Comparator<SliceResult> RANKING = Comparator
            .comparingInt((SliceResult s) -> s.getSignificance().strength()).reversed()
            .thenComparing(Comparator.comparingDouble((SliceResult s) -> Math.abs(s.getDelta())).reversed())
            .thenComparing(Comparator.comparingLong(SliceResult::getOrderCount).reversed())
            .thenComparing(SliceResult::label);

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    private final CohortMetricsProvider metricsProvider;
    private final RadarProperties.Slicing settings;

    @Autowired
    public SlicingEngine(CohortMetricsProvider metricsProvider, RadarProperties properties) {
        this(metricsProvider, properties.getSlicing());
    }

    public SlicingEngine(CohortMetricsProvider metricsProvider, RadarProperties.Slicing settings) {
        this.metricsProvider = metricsProvider;
        this.settings = settings;
    }

    /**
     * Top slices moving in the same direction as the root cohort's own change.
     */
    public List<SliceResult> findTopSlices(String metricName, Cohort root,
                                           TimeRange baselineWindow, TimeRange currentWindow) {
        CohortSnapshot baseline = metricsProvider.snapshot(metricName, root, baselineWindow);
        CohortSnapshot current = metricsProvider.snapshot(metricName, root, currentWindow);
        double direction = baseline.isEmpty() || current.isEmpty()
                ? 0.0
                : Math.signum(current.getValue() - baseline.getValue());
        return findTopSlices(metricName, root, baselineWindow, currentWindow, direction);
    }

    /**
     * @param direction sign of the change to keep; 0 keeps any non-zero change
     */
    public List<SliceResult> findTopSlices(String metricName, Cohort root,
                                           TimeRange baselineWindow, TimeRange currentWindow,
                                           double direction) {
        TimeRange span = TimeRange.of(
                min(baselineWindow, currentWindow).getStart(),
                max(baselineWindow, currentWindow).getEnd());

        List<SliceResult> candidates = new ArrayList<>();
        for (Cohort slice : enumerate(root, span)) {
            compare(metricName, slice, baselineWindow, currentWindow)
                    .filter(s -> s.getDelta() != 0.0)
                    .filter(s -> direction == 0.0 || Math.signum(s.getDelta()) == Math.signum(direction))
                    .ifPresent(candidates::add);
        }
        List<SliceResult> top = candidates.stream()
                .sorted(RANKING)
                .limit(settings.getTopN())
                .toList();
        log.debug("Slicing {} under {}: {} candidates, {} kept", metricName, root.label(),
                candidates.size(), top.size());
        return top;
    }

    /**
     * Compare one slice between two windows.
     *
     * @return empty when either window has fewer orders than the sample floor
     */
    public Optional<SliceResult> compare(String metricName, Cohort slice,
                                         TimeRange baselineWindow, TimeRange currentWindow) {
        CohortSnapshot baseline = metricsProvider.snapshot(metricName, slice, baselineWindow);
        CohortSnapshot current = metricsProvider.snapshot(metricName, slice, currentWindow);
        int floor = settings.getMinOrderCount();
        if (baseline.getOrderCount() < floor || current.getOrderCount() < floor) {
            return Optional.empty();
        }

        double delta = current.getValue() - baseline.getValue();
        double deltaPercent = baseline.getValue() == 0.0 ? 0.0 : delta / baseline.getValue() * 100.0;
        double se = Math.sqrt(variance(baseline) / baseline.getOrderCount()
                + variance(current) / current.getOrderCount());

        Double statistic;
        double pValue;
        if (se == 0.0) {
            statistic = null;
            pValue = delta == 0.0 ? 1.0 : 0.0;
        } else {
            statistic = delta / se;
            pValue = twoSidedPValue(statistic);
        }

        return Optional.of(SliceResult.builder()
                .cohort(slice)
                .baselineValue(baseline.getValue())
                .currentValue(current.getValue())
                .delta(delta)
                .deltaPercent(deltaPercent)
                .orderCount(current.getOrderCount())
                .baselineOrderCount(baseline.getOrderCount())
                .testStatistic(statistic)
                .pValue(pValue)
                .significance(SignificanceLevel.fromPValue(pValue))
                .build());
    }

    /**
     * Single-dimension slices first, then pairs, bounded by the slice budget.
     */
    List<Cohort> enumerate(Cohort root, TimeRange span) {
        List<String> dimensions = settings.getDimensions().stream()
                .filter(d -> !root.fixedDimensions().contains(d))
                .toList();
        int budget = settings.getMaxSlices();
        List<Cohort> slices = new ArrayList<>();

        for (String dimension : dimensions) {
            for (String value : metricsProvider.dimensionValues(dimension, root, span)) {
                if (slices.size() >= budget) {
                    return slices;
                }
                slices.add(root.with(dimension, value));
            }
        }
        if (Math.min(settings.getMaxDimensions(), 2) < 2) {
            return slices;
        }
        for (int i = 0; i < dimensions.size(); i++) {
            for (String first : metricsProvider.dimensionValues(dimensions.get(i), root, span)) {
                Cohort single = root.with(dimensions.get(i), first);
                for (int j = i + 1; j < dimensions.size(); j++) {
                    for (String second : metricsProvider.dimensionValues(dimensions.get(j), single, span)) {
                        if (slices.size() >= budget) {
                            log.debug("Slice budget of {} reached under {}", budget, root.label());
                            return slices;
                        }
                        slices.add(single.with(dimensions.get(j), second));
                    }
                }
            }
        }
        return slices;
    }

    static double twoSidedPValue(double statistic) {
        return 2.0 * (1.0 - STANDARD_NORMAL.cumulativeProbability(Math.abs(statistic)));
    }

    private static double variance(CohortSnapshot snapshot) {
        return snapshot.getStdDev() * snapshot.getStdDev();
    }

    private static TimeRange min(TimeRange a, TimeRange b) {
        return a.getStart().isBefore(b.getStart()) ? a : b;
    }

    private static TimeRange max(TimeRange a, TimeRange b) {
        return a.getEnd().isAfter(b.getEnd()) ? a : b;
    }
}
