package com.z254.cxlens.radar.observability;

import com.z254.cxlens.radar.domain.model.Vote;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for the RADAR service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Detection runs, anomalies and per-method abstentions</li>
 *     <li>Incident lifecycle (created, updated, resolved, open)</li>
 *     <li>RCA performance (latency, top confidence, timed-out hypotheses)</li>
 * </ul>
 */
@Component
public class RadarMetrics {

    private final MeterRegistry meterRegistry;

    // Detection metrics
    @Getter
    private final Counter detectionRuns;
    @Getter
    private final Counter anomaliesDetected;
    @Getter
    private final Counter seriesRejected;
    private final Timer detectionLatency;
    private final Map<String, Counter> abstentionsByMethod = new ConcurrentHashMap<>();

    // Incident metrics
    @Getter
    private final Counter incidentsCreated;
    @Getter
    private final Counter incidentsUpdated;
    @Getter
    private final Counter incidentsResolved;
    private final AtomicInteger openIncidents;

    // RCA metrics
    @Getter
    private final Counter rcaAnalysisCompleted;
    @Getter
    private final Counter rcaAnalysisFailed;
    @Getter
    private final Counter hypothesesTimedOut;
    private final Timer rcaLatency;
    private final DistributionSummary rcaConfidence;

    public RadarMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.detectionRuns = Counter.builder("radar.detection.runs")
                .description("Detection runs over a metric series")
                .register(meterRegistry);
        this.anomaliesDetected = Counter.builder("radar.detection.anomalies")
                .description("Consensus anomalies detected")
                .register(meterRegistry);
        this.seriesRejected = Counter.builder("radar.detection.rejected")
                .description("Series rejected as empty")
                .register(meterRegistry);
        this.detectionLatency = Timer.builder("radar.detection.latency")
                .description("Detection latency per metric and cohort")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        this.incidentsCreated = Counter.builder("radar.incidents.created")
                .description("Total incidents created")
                .register(meterRegistry);
        this.incidentsUpdated = Counter.builder("radar.incidents.updated")
                .description("Incidents refreshed by re-detection")
                .register(meterRegistry);
        this.incidentsResolved = Counter.builder("radar.incidents.resolved")
                .description("Total incidents resolved")
                .register(meterRegistry);
        this.openIncidents = meterRegistry.gauge("radar.incidents.open", new AtomicInteger(0));

        this.rcaAnalysisCompleted = Counter.builder("radar.rca.completed")
                .description("RCA reports generated")
                .register(meterRegistry);
        this.rcaAnalysisFailed = Counter.builder("radar.rca.failed")
                .description("RCA passes that failed")
                .register(meterRegistry);
        this.hypothesesTimedOut = Counter.builder("radar.rca.hypotheses.timed_out")
                .description("Hypothesis tests aborted by timeout")
                .register(meterRegistry);
        this.rcaLatency = Timer.builder("radar.rca.latency")
                .description("RCA latency per incident")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
        this.rcaConfidence = DistributionSummary.builder("radar.rca.confidence")
                .description("Confidence of the top ranked hypothesis")
                .publishPercentiles(0.5, 0.75, 0.95)
                .register(meterRegistry);
    }

    // ========== Detection Methods ==========

    public Timer.Sample startDetectionTimer() {
        detectionRuns.increment();
        return Timer.start(meterRegistry);
    }

    public void recordDetection(Timer.Sample sample, boolean anomaly) {
        sample.stop(detectionLatency);
        if (anomaly) {
            anomaliesDetected.increment();
        }
    }

    public void recordVote(String method, Vote vote) {
        if (vote == Vote.ABSTAIN) {
            abstentionsByMethod.computeIfAbsent(method, m ->
                    Counter.builder("radar.detection.abstentions")
                            .tag("method", m)
                            .description("Detector abstentions by method")
                            .register(meterRegistry))
                    .increment();
        }
    }

    public void recordSeriesRejected() {
        seriesRejected.increment();
    }

    // ========== Incident Methods ==========

    public void recordIncidentCreated() {
        incidentsCreated.increment();
        openIncidents.incrementAndGet();
    }

    public void recordIncidentUpdated() {
        incidentsUpdated.increment();
    }

    public void recordIncidentResolved() {
        incidentsResolved.increment();
        openIncidents.decrementAndGet();
    }

    public int getOpenIncidents() {
        return openIncidents.get();
    }

    // ========== RCA Methods ==========

    public Timer.Sample startRcaTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordRcaCompleted(Timer.Sample sample, double topConfidence) {
        sample.stop(rcaLatency);
        rcaAnalysisCompleted.increment();
        rcaConfidence.record(topConfidence);
    }

    public void recordRcaFailed(Timer.Sample sample) {
        sample.stop(rcaLatency);
        rcaAnalysisFailed.increment();
    }

    public void recordHypothesisTimedOut() {
        hypothesesTimedOut.increment();
    }
}
