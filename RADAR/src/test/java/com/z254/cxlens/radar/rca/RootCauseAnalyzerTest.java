package com.z254.cxlens.radar.rca;

import com.z254.cxlens.radar.TestObservations;
import com.z254.cxlens.radar.config.RadarProperties;
import com.z254.cxlens.radar.domain.model.EvidenceMethod;
import com.z254.cxlens.radar.domain.model.EvidenceTerm;
import com.z254.cxlens.radar.domain.model.Hypothesis;
import com.z254.cxlens.radar.domain.model.HypothesisTestResult;
import com.z254.cxlens.radar.domain.model.Incident;
import com.z254.cxlens.radar.domain.model.RcaReport;
import com.z254.cxlens.radar.domain.repository.InMemoryIncidentRepository;
import com.z254.cxlens.radar.domain.service.IncidentService;
import com.z254.cxlens.radar.kafka.RadarEventPublisher;
import com.z254.cxlens.radar.metrics.InMemoryObservationStore;
import com.z254.cxlens.radar.metrics.ObservationProvider;
import com.z254.cxlens.radar.observability.RadarMetrics;
import com.z254.cxlens.radar.observability.RadarStructuredLogger;
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
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RootCauseAnalyzerTest {

    private static final Instant NOW = Instant.parse("2026-03-03T00:00:00Z");

    @Mock
    private RadarEventPublisher eventPublisher;

    private RadarProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private RadarMetrics metrics;
    private InMemoryObservationStore store;
    private IncidentService incidentService;
    private RcaReportCache reportCache;
    private Incident incident;

    @BeforeEach
    void setUp() {
        properties = new RadarProperties();
        properties.getRca().setHypothesisTimeout(Duration.ofSeconds(30));
        meterRegistry = new SimpleMeterRegistry();
        metrics = new RadarMetrics(meterRegistry);
        store = new InMemoryObservationStore(Duration.ofHours(1));
        store.ingest(TestObservations.onTimeRegression());
        incidentService = new IncidentService(new InMemoryIncidentRepository(), metrics,
                new RadarStructuredLogger(), Clock.fixed(NOW, ZoneOffset.UTC));
        reportCache = new RcaReportCache(Duration.ofMinutes(5), 100);
        incident = incidentService.upsert(EvidenceAnalyzersTest.regressionIncident()).getIncident();
    }

    @Test
    void ranksDasherAvailabilityFirst() {
        StepVerifier.create(analyzer().analyze(incident))
                .assertNext(report -> {
                    assertThat(report.getIncidentId()).isEqualTo(incident.getId());
                    assertThat(report.getHypothesesTested()).isEqualTo(4);
                    assertThat(report.getRankedCauses()).extracting(HypothesisTestResult::getHypothesisId)
                            .containsExactly("low_dasher_availability", "batching_threshold_increase",
                                    "prep_time_drift", "eta_model_bias");

                    HypothesisTestResult top = report.topCause().orElseThrow();
                    assertThat(top.getConfidence()).isCloseTo(0.964, within(0.01));
                    assertThat(top.getImpact()).isEqualTo(1.0);
                    assertThat(top.getCombinedScore()).isEqualTo(top.getConfidence());
                    assertThat(top.getDiffInDiffScore()).isNull();

                    HypothesisTestResult eta = report.getRankedCauses().get(3);
                    assertThat(eta.getConfidence()).isZero();
                    assertThat(eta.getEvidence().values()).noneMatch(EvidenceTerm::isApplicable);

                    assertThat(report.getNarrative()).startsWith(
                            "Most of the on_time_rate regression is attributable to Low Dasher Availability");
                    assertThat(report.getSummary()).isEqualTo("Most of the on_time_rate drop comes from "
                            + "low dasher availability and batching threshold increase.");
                    assertThat(report.getGeneratedAt()).isEqualTo(NOW);
                })
                .verifyComplete();

        verify(eventPublisher).publishReport(any(RcaReport.class));
        assertThat(meterRegistry.counter("radar.rca.completed").count()).isEqualTo(1.0);
        assertThat(incidentService.requireIncident(incident.getId()).getTimeline()).last()
                .extracting(Incident.TimelineEvent::getType)
                .isEqualTo(Incident.TimelineEventType.RCA_COMPLETED);
    }

    @Test
    void rerunGivesIdenticalRanking() {
        RootCauseAnalyzer analyzer = analyzer();

        RcaReport first = analyzer.analyzeBlocking(incident);
        RcaReport second = analyzer.analyzeBlocking(incident);

        assertThat(second.getRankedCauses()).extracting(HypothesisTestResult::getHypothesisId)
                .containsExactlyElementsOf(first.getRankedCauses().stream()
                        .map(HypothesisTestResult::getHypothesisId).toList());
        assertThat(second.getRankedCauses()).extracting(HypothesisTestResult::getCombinedScore)
                .containsExactlyElementsOf(first.getRankedCauses().stream()
                        .map(HypothesisTestResult::getCombinedScore).toList());
    }

    @Test
    void cachedReportServedUntilIncidentRevisionChanges() {
        RootCauseAnalyzer analyzer = analyzer();

        RcaReport first = analyzer.getOrAnalyze(incident).block();
        RcaReport cached = analyzer.getOrAnalyze(incidentService.requireIncident(incident.getId())).block();

        assertThat(cached).isSameAs(first);
        verify(eventPublisher, times(1)).publishReport(any());

        Incident refreshed = incidentService.upsert(EvidenceAnalyzersTest.regressionIncident()).getIncident();
        RcaReport fresh = analyzer.getOrAnalyze(refreshed).block();

        assertThat(fresh).isNotSameAs(first);
        assertThat(fresh.getIncidentRevision()).isEqualTo(2);
        verify(eventPublisher, times(2)).publishReport(any());
    }

    @Test
    void slowHypothesisIsKeptWithZeroConfidence() {
        properties.getRca().setHypothesisTimeout(Duration.ofMillis(200));
        CausalEvidenceEngine engine = new CausalEvidenceEngine(
                List.of(new AttributionAnalyzer(30), new SlowAnalyzer("low_dasher_availability")), 0.5);

        StepVerifier.create(analyzer(engine, store).analyze(incident))
                .assertNext(report -> {
                    assertThat(report.getHypothesesTested()).isEqualTo(4);
                    HypothesisTestResult dasher = report.getRankedCauses().stream()
                            .filter(r -> r.getHypothesisId().equals("low_dasher_availability"))
                            .findFirst().orElseThrow();
                    assertThat(dasher.getConfidence()).isZero();
                    assertThat(dasher.getEvidence().get(EvidenceMethod.ATTRIBUTION).getNote())
                            .isEqualTo("timed_out");
                    assertThat(report.topCause().orElseThrow().getHypothesisId())
                            .isEqualTo("batching_threshold_increase");
                })
                .verifyComplete();

        assertThat(meterRegistry.counter("radar.rca.hypotheses.timed_out").count()).isEqualTo(1.0);
    }

    @Test
    void dataLoadFailureFailsTheAnalysis() {
        ObservationProvider broken = (cohort, range) -> {
            throw new IllegalStateException("store unavailable");
        };

        StepVerifier.create(analyzer(engine(), broken).analyze(incident))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(RootCauseAnalyzer.RcaAnalysisException.class)
                        .hasMessageContaining("store unavailable"))
                .verify();

        assertThat(meterRegistry.counter("radar.rca.failed").count()).isEqualTo(1.0);
        verify(eventPublisher, never()).publishReport(any());
    }

    private RootCauseAnalyzer analyzer() {
        return analyzer(engine(), store);
    }

    private CausalEvidenceEngine engine() {
        return new CausalEvidenceEngine(properties, new ChangeEventRegistry(Map.of()));
    }

    private RootCauseAnalyzer analyzer(CausalEvidenceEngine engine, ObservationProvider observations) {
        return new RootCauseAnalyzer(new HypothesisLibrary(), engine,
                new HypothesisScorer(ScoringWeights.defaults()), observations, reportCache, incidentService,
                eventPublisher, properties, metrics, new RadarStructuredLogger(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    /**
     * Correlation analyzer that stalls on one hypothesis.
     */
    private static final class SlowAnalyzer implements EvidenceAnalyzer {

        private final String slowHypothesisId;

        SlowAnalyzer(String slowHypothesisId) {
            this.slowHypothesisId = slowHypothesisId;
        }

        @Override
        public EvidenceMethod method() {
            return EvidenceMethod.CORRELATION;
        }

        @Override
        public EvidenceTerm analyze(Hypothesis hypothesis, EvidenceDataset dataset) {
            if (hypothesis.getId().equals(slowHypothesisId)) {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("interrupted", e);
                }
            }
            return EvidenceTerm.inapplicable(method(), "insufficient_points");
        }
    }
}
