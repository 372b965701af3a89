package com.z254.cxlens.radar.rca;

import com.z254.cxlens.radar.config.RadarProperties;
import com.z254.cxlens.radar.domain.model.CxMetric;
import com.z254.cxlens.radar.domain.model.Hypothesis;
import com.z254.cxlens.radar.domain.model.HypothesisTestResult;
import com.z254.cxlens.radar.domain.model.Incident;
import com.z254.cxlens.radar.domain.model.RcaReport;
import com.z254.cxlens.radar.domain.service.IncidentService;
import com.z254.cxlens.radar.exception.InvalidConfigurationException;
import com.z254.cxlens.radar.kafka.RadarEventPublisher;
import com.z254.cxlens.radar.metrics.ObservationProvider;
import com.z254.cxlens.radar.observability.RadarMetrics;
import com.z254.cxlens.radar.observability.RadarStructuredLogger;
import com.z254.cxlens.radar.observability.RadarStructuredLogger.RcaEventType;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Root Cause Analysis orchestrator.
 * <p>
 * Coordinates the RCA pipeline:
 * <ol>
 *     <li>Load the incident's order-level evidence once</li>
 *     <li>Select the hypotheses relevant to the regressed metric</li>
 *     <li>Test each hypothesis in parallel, each under its own timeout</li>
 *     <li>Rank the results and render the narrative</li>
 * </ol>
 * A hypothesis that fails or times out is kept with confidence 0 rather than dropped.
 */
@Slf4j
@Service
public class RootCauseAnalyzer {

    private final HypothesisLibrary hypothesisLibrary;
    private final CausalEvidenceEngine evidenceEngine;
    private final HypothesisScorer scorer;
    private final ObservationProvider observationProvider;
    private final RcaReportCache reportCache;
    private final IncidentService incidentService;
    private final RadarEventPublisher eventPublisher;
    private final RadarProperties radarProperties;
    private final RadarMetrics metrics;
    private final RadarStructuredLogger logger;
    private final Clock clock;

    public RootCauseAnalyzer(HypothesisLibrary hypothesisLibrary,
                             CausalEvidenceEngine evidenceEngine,
                             HypothesisScorer scorer,
                             ObservationProvider observationProvider,
                             RcaReportCache reportCache,
                             IncidentService incidentService,
                             RadarEventPublisher eventPublisher,
                             RadarProperties radarProperties,
                             RadarMetrics metrics,
                             RadarStructuredLogger logger,
                             Clock clock) {
        this.hypothesisLibrary = hypothesisLibrary;
        this.evidenceEngine = evidenceEngine;
        this.scorer = scorer;
        this.observationProvider = observationProvider;
        this.reportCache = reportCache;
        this.incidentService = incidentService;
        this.eventPublisher = eventPublisher;
        this.radarProperties = radarProperties;
        this.metrics = metrics;
        this.logger = logger;
        this.clock = clock;
    }

    /**
     * Cached report for the incident's current revision, or a fresh analysis.
     */
    public Mono<RcaReport> getOrAnalyze(Incident incident) {
        return Mono.justOrEmpty(reportCache.get(incident))
                .switchIfEmpty(Mono.defer(() -> analyze(incident)));
    }

    /**
     * Run a full analysis. Re-running on an unchanged incident yields the same
     * ranking and scores.
     */
    public Mono<RcaReport> analyze(Incident incident) {
        String incidentId = incident.getId();
        CxMetric metric = CxMetric.fromName(incident.getMetricName());
        List<Hypothesis> hypotheses = hypothesisLibrary.relevantTo(metric);
        Timer.Sample timerSample = metrics.startRcaTimer();

        logger.logRcaEvent(incidentId, null, RcaEventType.ANALYSIS_STARTED,
                "Starting RCA analysis",
                Map.of("metric", metric.metricName(),
                        "cohort", incident.getCohort().key(),
                        "hypotheses", hypotheses.size()));

        return Mono.fromCallable(() -> EvidenceDataset.load(incident, observationProvider,
                        radarProperties.getDetection().getBucket()))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(dataset -> Flux.fromIterable(hypotheses)
                        .flatMap(h -> testHypothesis(incidentId, h, dataset),
                                radarProperties.getRca().getMaxParallelTests())
                        .collectList())
                .map(results -> buildReport(incident, results))
                .doOnNext(report -> onCompleted(report, timerSample))
                .onErrorMap(e -> !(e instanceof InvalidConfigurationException || e instanceof RcaAnalysisException),
                        e -> new RcaAnalysisException("RCA analysis failed for " + incidentId + ": " + e.getMessage(), e))
                .doOnError(error -> {
                    metrics.recordRcaFailed(timerSample);
                    logger.logRcaEvent(incidentId, null, RcaEventType.ANALYSIS_FAILED,
                            "RCA analysis failed: " + error.getMessage(),
                            Map.of("error", error.getClass().getSimpleName()));
                });
    }

    /**
     * Blocking variant for batch callers.
     */
    public RcaReport analyzeBlocking(Incident incident) {
        return analyze(incident).block();
    }

    private Mono<HypothesisTestResult> testHypothesis(String incidentId, Hypothesis hypothesis,
                                                      EvidenceDataset dataset) {
        return Mono.fromCallable(() -> scorer.score(hypothesis,
                        evidenceEngine.evaluate(hypothesis, dataset),
                        evidenceEngine.impact(hypothesis, dataset)))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(radarProperties.getRca().getHypothesisTimeout())
                .doOnNext(result -> logger.logRcaEvent(incidentId, hypothesis.getId(),
                        RcaEventType.HYPOTHESIS_TESTED, "Hypothesis tested",
                        Map.of("confidence", result.getConfidence(),
                                "impact", result.getImpact(),
                                "score", result.getCombinedScore())))
                .onErrorResume(TimeoutException.class, e -> {
                    metrics.recordHypothesisTimedOut();
                    logger.logRcaEvent(incidentId, hypothesis.getId(), RcaEventType.HYPOTHESIS_TIMED_OUT,
                            "Hypothesis test timed out",
                            Map.of("timeout", radarProperties.getRca().getHypothesisTimeout().toString()));
                    return Mono.just(scorer.inapplicable(hypothesis, "timed_out"));
                })
                .onErrorResume(RuntimeException.class, e -> {
                    log.warn("Hypothesis {} failed on incident {}", hypothesis.getId(), incidentId, e);
                    return Mono.just(scorer.inapplicable(hypothesis, "failed: " + e.getMessage()));
                });
    }

    private RcaReport buildReport(Incident incident, List<HypothesisTestResult> results) {
        List<HypothesisTestResult> ranked = scorer.rank(results);
        Incident.Direction direction = incident.getDirection() != null
                ? incident.getDirection()
                : Incident.Direction.REGRESSION;
        return RcaReport.builder()
                .incidentId(incident.getId())
                .metricName(incident.getMetricName())
                .direction(direction)
                .incidentRevision(incident.getRevision())
                .generatedAt(clock.instant())
                .hypothesesTested(results.size())
                .rankedCauses(ranked)
                .narrative(scorer.narrative(ranked, incident.getMetricName(), direction))
                .summary(scorer.summary(ranked, incident.getMetricName(), direction))
                .build();
    }

    private void onCompleted(RcaReport report, Timer.Sample timerSample) {
        double topConfidence = report.topCause().map(HypothesisTestResult::getConfidence).orElse(0.0);
        String topId = report.topCause().map(HypothesisTestResult::getHypothesisId).orElse(null);

        reportCache.put(report);
        metrics.recordRcaCompleted(timerSample, topConfidence);
        incidentService.recordRcaCompleted(report.getIncidentId(), report.getSummary());
        eventPublisher.publishReport(report);

        logger.logRcaEvent(report.getIncidentId(), topId, RcaEventType.ANALYSIS_COMPLETED,
                "RCA analysis completed",
                Map.of("hypothesesTested", report.getHypothesesTested(),
                        "topConfidence", topConfidence,
                        "summary", report.getSummary()));

        double threshold = radarProperties.getRca().getLowConfidenceThreshold();
        if (topConfidence < threshold) {
            logger.logRcaEvent(report.getIncidentId(), null, RcaEventType.LOW_CONFIDENCE,
                    "All hypotheses below confidence threshold",
                    Map.of("topConfidence", topConfidence, "threshold", threshold));
        }
    }

    /**
     * Exception thrown when a whole RCA pass fails.
     */
    public static class RcaAnalysisException extends RuntimeException {
        public RcaAnalysisException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
