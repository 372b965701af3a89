package com.z254.cxlens.radar.detection;

import com.z254.cxlens.radar.config.RadarProperties;
import com.z254.cxlens.radar.domain.model.Cohort;
import com.z254.cxlens.radar.domain.model.CxMetric;
import com.z254.cxlens.radar.domain.model.Incident;
import com.z254.cxlens.radar.domain.model.MetricSeries;
import com.z254.cxlens.radar.domain.model.SliceResult;
import com.z254.cxlens.radar.domain.model.TimeRange;
import com.z254.cxlens.radar.domain.service.IncidentService;
import com.z254.cxlens.radar.exception.EmptySeriesException;
import com.z254.cxlens.radar.kafka.RadarEventPublisher;
import com.z254.cxlens.radar.metrics.MetricSeriesProvider;
import com.z254.cxlens.radar.observability.RadarMetrics;
import com.z254.cxlens.radar.observability.RadarStructuredLogger;
import com.z254.cxlens.radar.observability.RadarStructuredLogger.DetectionEventType;
import com.z254.cxlens.radar.slicing.SlicingEngine;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Detection entry point: series, consensus detection, slicing and incident upsert.
 * <p>
 * Each {@code (metric, cohort)} key is processed independently, so a pass fans
 * keys out in parallel; the incident store serializes writes per key.
 */
@Slf4j
@Service
public class DetectionPipeline {

    private final MetricSeriesProvider seriesProvider;
    private final AnomalyDetector anomalyDetector;
    private final SlicingEngine slicingEngine;
    private final IncidentService incidentService;
    private final RadarEventPublisher eventPublisher;
    private final RadarProperties properties;
    private final RadarMetrics metrics;
    private final RadarStructuredLogger structuredLogger;

    public DetectionPipeline(MetricSeriesProvider seriesProvider,
                             AnomalyDetector anomalyDetector,
                             SlicingEngine slicingEngine,
                             IncidentService incidentService,
                             RadarEventPublisher eventPublisher,
                             RadarProperties properties,
                             RadarMetrics metrics,
                             RadarStructuredLogger structuredLogger) {
        this.seriesProvider = seriesProvider;
        this.anomalyDetector = anomalyDetector;
        this.slicingEngine = slicingEngine;
        this.incidentService = incidentService;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    /**
     * Detect on the latest point of the metric's series for the cohort and range.
     * <p>
     * The range is aligned to the series bucket first; the aligned range is the
     * incident's detection window, so reruns inside one bucket refresh the same incident.
     *
     * @return the created or refreshed incident, or empty when there is no anomaly
     * @throws com.z254.cxlens.radar.exception.UnknownMetricException if the metric is not supported
     * @throws EmptySeriesException if the range holds no data for the cohort
     */
    public Optional<Incident> runDetection(String metricName, Cohort cohort, TimeRange requested) {
        CxMetric metric = CxMetric.fromName(metricName);
        TimeRange range = requested.alignedTo(properties.getDetection().getBucket());
        MetricSeries series = seriesProvider.fetchSeries(metric.metricName(), cohort, range);
        if (series.isEmpty()) {
            metrics.recordSeriesRejected();
            structuredLogger.logDetectionEvent(metric.metricName(), cohort.key(),
                    DetectionEventType.SERIES_REJECTED, "No data points in range",
                    Map.of("range", range.toString()));
            throw new EmptySeriesException("No " + metric.metricName() + " data for "
                    + cohort.label() + " in " + range);
        }

        Timer.Sample sample = metrics.startDetectionTimer();
        DetectionResult result = anomalyDetector.detect(series);
        metrics.recordDetection(sample, result.isAnomaly());
        result.getMethodVotes().forEach(v -> metrics.recordVote(v.getMethod(), v.getVote()));

        if (!result.isAnomaly()) {
            structuredLogger.logDetectionEvent(metric.metricName(), cohort.key(),
                    DetectionEventType.NO_ANOMALY, "No consensus anomaly", voteDetails(result));
            return Optional.empty();
        }

        double delta = result.getCurrentValue() - result.getBaselineValue();
        Incident.Direction direction = metric.directionOf(delta);
        if (direction == Incident.Direction.IMPROVEMENT && properties.getDetection().isSuppressImprovements()) {
            log.debug("Suppressing improvement on {} / {}", metric.metricName(), cohort.label());
            return Optional.empty();
        }

        Incident candidate = buildCandidate(metric, cohort, range, result, delta, direction);
        IncidentService.UpsertResult upsert = incidentService.upsert(candidate);
        eventPublisher.publishIncident(upsert.getIncident(), upsert.isCreated());

        Map<String, Object> details = voteDetails(result);
        details.put("incidentId", upsert.getIncident().getId());
        details.put("severity", result.getSeverity().name());
        details.put("direction", direction.name());
        details.put("created", upsert.isCreated());
        structuredLogger.logDetectionEvent(metric.metricName(), cohort.key(),
                DetectionEventType.ANOMALY_DETECTED, candidate.getDescription(), details);
        return Optional.of(upsert.getIncident());
    }

    /**
     * Run detection for every configured metric over the root cohort.
     */
    public Flux<Incident> runPass(TimeRange range) {
        return runPass(range, List.of(Cohort.ROOT));
    }

    /**
     * Run detection for every configured metric and each given cohort, in parallel.
     * Keys without data are skipped; configuration errors fail the pass.
     */
    public Flux<Incident> runPass(TimeRange range, List<Cohort> cohorts) {
        List<String> metricNames = properties.getDetection().getMetrics();
        metricNames.forEach(CxMetric::fromName);
        List<Cohort> targets = cohorts == null || cohorts.isEmpty() ? List.of(Cohort.ROOT) : cohorts;

        return Flux.fromIterable(metricNames)
                .flatMap(metricName -> Flux.fromIterable(targets)
                        .flatMap(cohort -> Mono.fromCallable(() -> runDetection(metricName, cohort, range))
                                .subscribeOn(Schedulers.boundedElastic())
                                .flatMap(found -> found.map(Mono::just).orElseGet(Mono::empty))
                                .onErrorResume(EmptySeriesException.class, e -> {
                                    log.debug("Skipping {} / {}: {}", metricName, cohort.label(), e.getMessage());
                                    return Mono.empty();
                                })))
                .doOnComplete(() -> log.info("Detection pass over {} complete", range));
    }

    private Incident buildCandidate(CxMetric metric, Cohort cohort, TimeRange range,
                                    DetectionResult result, double delta, Incident.Direction direction) {
        double baseline = result.getBaselineValue();
        double deltaPercent = baseline == 0.0 ? 0.0 : delta / baseline * 100.0;

        return Incident.builder()
                .metricName(metric.metricName())
                .cohort(cohort)
                .detectionWindow(range)
                .evaluatedAt(result.getEvaluatedAt())
                .baselineValue(baseline)
                .currentValue(result.getCurrentValue())
                .delta(delta)
                .deltaPercent(deltaPercent)
                .severity(result.getSeverity())
                .direction(direction)
                .detectionVotes(result.getVotes())
                .topSlices(findSlices(metric, cohort, range, result.getEvaluatedAt(), delta))
                .description(describe(metric, baseline, result.getCurrentValue(), direction))
                .build();
    }

    /**
     * Slices compare the evaluated bucket onwards against everything before it.
     */
    private List<SliceResult> findSlices(CxMetric metric, Cohort cohort, TimeRange range,
                                         Instant evaluatedAt, double delta) {
        if (!evaluatedAt.isAfter(range.getStart()) || !range.getEnd().isAfter(evaluatedAt)) {
            return new ArrayList<>();
        }
        TimeRange baselineWindow = TimeRange.of(range.getStart(), evaluatedAt);
        TimeRange currentWindow = TimeRange.of(evaluatedAt, range.getEnd());
        return new ArrayList<>(slicingEngine.findTopSlices(metric.metricName(), cohort,
                baselineWindow, currentWindow, Math.signum(delta)));
    }

    static String describe(CxMetric metric, double baseline, double current, Incident.Direction direction) {
        String verb = direction == Incident.Direction.REGRESSION ? "regressed" : "improved";
        return String.format(Locale.ROOT, "%s %s from %.2f to %.2f", metric.metricName(), verb, baseline, current);
    }

    private Map<String, Object> voteDetails(DetectionResult result) {
        Map<String, Object> details = new LinkedHashMap<>();
        result.getMethodVotes().forEach(v -> details.put(v.getMethod(), v.getVote().name()));
        details.put("percentile", result.getPercentile());
        return details;
    }
}
