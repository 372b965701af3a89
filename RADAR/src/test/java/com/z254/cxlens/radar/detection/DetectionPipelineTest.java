package com.z254.cxlens.radar.detection;

import com.z254.cxlens.radar.TestObservations;
import com.z254.cxlens.radar.config.RadarProperties;
import com.z254.cxlens.radar.domain.model.Cohort;
import com.z254.cxlens.radar.domain.model.Incident;
import com.z254.cxlens.radar.domain.model.Severity;
import com.z254.cxlens.radar.domain.model.SliceResult;
import com.z254.cxlens.radar.domain.model.TimeRange;
import com.z254.cxlens.radar.domain.model.Vote;
import com.z254.cxlens.radar.domain.repository.InMemoryIncidentRepository;
import com.z254.cxlens.radar.domain.service.IncidentService;
import com.z254.cxlens.radar.exception.EmptySeriesException;
import com.z254.cxlens.radar.exception.UnknownMetricException;
import com.z254.cxlens.radar.kafka.RadarEventPublisher;
import com.z254.cxlens.radar.metrics.InMemoryObservationStore;
import com.z254.cxlens.radar.observability.RadarMetrics;
import com.z254.cxlens.radar.observability.RadarStructuredLogger;
import com.z254.cxlens.radar.slicing.SlicingEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class DetectionPipelineTest {

    private static final TimeRange WINDOW = TimeRange.of(TestObservations.BASE,
            TestObservations.hour(TestObservations.HOURS));

    @Mock
    private RadarEventPublisher eventPublisher;

    private RadarProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private InMemoryObservationStore store;
    private IncidentService incidentService;
    private DetectionPipeline pipeline;

    @BeforeEach
    void setUp() {
        properties = new RadarProperties();
        meterRegistry = new SimpleMeterRegistry();
        RadarMetrics metrics = new RadarMetrics(meterRegistry);
        RadarStructuredLogger logger = new RadarStructuredLogger();
        Clock clock = Clock.fixed(Instant.parse("2026-03-03T00:00:00Z"), ZoneOffset.UTC);

        store = new InMemoryObservationStore(Duration.ofHours(1));
        store.ingest(TestObservations.onTimeRegression());
        incidentService = new IncidentService(new InMemoryIncidentRepository(), metrics, logger, clock);
        pipeline = new DetectionPipeline(store, new AnomalyDetector(properties),
                new SlicingEngine(store, properties), incidentService, eventPublisher,
                properties, metrics, logger);
    }

    @Test
    void runDetectionCreatesRegressionIncident() {
        Incident incident = pipeline.runDetection("on_time_rate", Cohort.ROOT, WINDOW).orElseThrow();

        assertThat(incident.getId()).startsWith("inc-");
        assertThat(incident.getStatus()).isEqualTo(Incident.Status.NEW);
        assertThat(incident.getDirection()).isEqualTo(Incident.Direction.REGRESSION);
        assertThat(incident.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(incident.getBaselineValue()).isCloseTo(0.9, within(1e-9));
        assertThat(incident.getCurrentValue()).isCloseTo(0.25, within(1e-9));
        assertThat(incident.getDeltaPercent()).isCloseTo(-72.22, within(0.01));
        assertThat(incident.getEvaluatedAt()).isEqualTo(TestObservations.hour(TestObservations.HOURS - 1));
        assertThat(incident.getDetectionVotes().getZScore()).isEqualTo(Vote.ANOMALY);
        assertThat(incident.getDetectionVotes().getEwma()).isEqualTo(Vote.ANOMALY);
        assertThat(incident.getDescription()).isEqualTo("on_time_rate regressed from 0.90 to 0.25");
        verify(eventPublisher).publishIncident(any(Incident.class), eq(true));
    }

    @Test
    void runDetectionAttachesSlicesMovingWithTheRegression() {
        Incident incident = pipeline.runDetection("on_time_rate", Cohort.ROOT, WINDOW).orElseThrow();

        assertThat(incident.getTopSlices())
                .isNotEmpty()
                .allSatisfy(slice -> {
                    assertThat(slice.getDelta()).isNegative();
                    assertThat(slice.getOrderCount()).isGreaterThanOrEqualTo(10);
                });
        assertThat(incident.getTopSlices()).extracting(SliceResult::label)
                .contains("region=north", "region=south", "store=s1", "store=s2");
        assertThat(incident.getTotalOrdersAffected()).isEqualTo(40);
    }

    @Test
    void rerunOverSameWindowRefreshesInsteadOfDuplicating() {
        Incident first = pipeline.runDetection("on_time_rate", Cohort.ROOT, WINDOW).orElseThrow();
        double firstDelta = first.getDelta();
        Incident second = pipeline.runDetection("on_time_rate", Cohort.ROOT, WINDOW).orElseThrow();

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(second.getRevision()).isEqualTo(2);
        assertThat(second.getDelta()).isEqualTo(firstDelta);
        assertThat(incidentService.listIncidents(null, null, null, null)).hasSize(1);
        verify(eventPublisher).publishIncident(any(Incident.class), eq(false));
        assertThat(meterRegistry.counter("radar.incidents.created").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("radar.incidents.updated").count()).isEqualTo(1.0);
    }

    @Test
    void passesEndingInsideOneBucketRefreshTheSameIncidents() {
        Duration lookback = Duration.ofDays(7);
        Instant end = TestObservations.hour(TestObservations.HOURS);

        List<Incident> first = pipeline.runPass(TimeRange.lookback(end, lookback)).collectList().block();
        List<String> firstIds = first.stream().map(Incident::getId).toList();
        List<Incident> second = pipeline.runPass(TimeRange.lookback(end.plusSeconds(60), lookback))
                .collectList().block();

        assertThat(firstIds).isNotEmpty();
        assertThat(second).extracting(Incident::getId).containsExactlyInAnyOrderElementsOf(firstIds);
        assertThat(second).allSatisfy(incident -> {
            assertThat(incident.getRevision()).isEqualTo(2);
            assertThat(incident.getDetectionWindow().getEnd()).isEqualTo(end);
        });
        assertThat(incidentService.listIncidents(null, null, null, null)).hasSize(firstIds.size());
    }

    @Test
    void stableMetricProducesNoIncident() {
        TimeRange beforeRegression = TimeRange.of(TestObservations.BASE,
                TestObservations.hour(TestObservations.HOURS - 1));

        Optional<Incident> result = pipeline.runDetection("on_time_rate", Cohort.ROOT, beforeRegression);

        assertThat(result).isEmpty();
        verify(eventPublisher, never()).publishIncident(any(), anyBoolean());
    }

    @Test
    void improvementIsLabelledByPolarity() {
        store.clear();
        store.ingest(TestObservations.onTimeImprovement());

        Incident incident = pipeline.runDetection("on_time_rate", Cohort.ROOT, WINDOW).orElseThrow();

        assertThat(incident.getDirection()).isEqualTo(Incident.Direction.IMPROVEMENT);
        assertThat(incident.isRegression()).isFalse();
        assertThat(incident.getDescription()).isEqualTo("on_time_rate improved from 0.55 to 1.00");
    }

    @Test
    void improvementsCanBeSuppressed() {
        properties.getDetection().setSuppressImprovements(true);
        store.clear();
        store.ingest(TestObservations.onTimeImprovement());

        assertThat(pipeline.runDetection("on_time_rate", Cohort.ROOT, WINDOW)).isEmpty();
        assertThat(incidentService.listIncidents(null, null, null, null)).isEmpty();
    }

    @Test
    void unknownMetricIsRejected() {
        assertThatThrownBy(() -> pipeline.runDetection("nps", Cohort.ROOT, WINDOW))
                .isInstanceOf(UnknownMetricException.class);
    }

    @Test
    void emptyRangeIsRejected() {
        TimeRange empty = TimeRange.of(Instant.parse("2025-01-01T00:00:00Z"), Instant.parse("2025-01-02T00:00:00Z"));

        assertThatThrownBy(() -> pipeline.runDetection("on_time_rate", Cohort.ROOT, empty))
                .isInstanceOf(EmptySeriesException.class);
        assertThat(meterRegistry.counter("radar.detection.rejected").count()).isEqualTo(1.0);
    }

    @Test
    void passCoversConfiguredMetricsAndSkipsCohortsWithoutData() {
        properties.getDetection().setMetrics(List.of("on_time_rate", "cancellation_rate"));

        StepVerifier.create(pipeline.runPass(WINDOW, List.of(Cohort.ROOT, Cohort.of("region", "west"))))
                .assertNext(incident -> assertThat(incident.getMetricName()).isEqualTo("on_time_rate"))
                .verifyComplete();
    }

    @Test
    void passFailsFastOnUnknownConfiguredMetric() {
        properties.getDetection().setMetrics(List.of("on_time_rate", "nps"));

        assertThatThrownBy(() -> pipeline.runPass(WINDOW)).isInstanceOf(UnknownMetricException.class);
    }
}
