package com.z254.cxlens.radar.rca;

import com.z254.cxlens.radar.TestObservations;
import com.z254.cxlens.radar.domain.model.Cohort;
import com.z254.cxlens.radar.domain.model.CxMetric;
import com.z254.cxlens.radar.domain.model.DetectionVotes;
import com.z254.cxlens.radar.domain.model.EvidenceMethod;
import com.z254.cxlens.radar.domain.model.EvidenceTerm;
import com.z254.cxlens.radar.domain.model.Hypothesis;
import com.z254.cxlens.radar.domain.model.Incident;
import com.z254.cxlens.radar.domain.model.OrderObservation;
import com.z254.cxlens.radar.domain.model.Severity;
import com.z254.cxlens.radar.domain.model.TimeRange;
import com.z254.cxlens.radar.domain.model.Vote;
import com.z254.cxlens.radar.metrics.InMemoryObservationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.z254.cxlens.radar.TestObservations.order;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EvidenceAnalyzersTest {

    private final HypothesisLibrary library = new HypothesisLibrary();

    private EvidenceDataset regression;

    @BeforeEach
    void setUp() {
        InMemoryObservationStore store = new InMemoryObservationStore(Duration.ofHours(1));
        store.ingest(TestObservations.onTimeRegression());
        regression = EvidenceDataset.load(regressionIncident(), store, Duration.ofHours(1));
    }

    @Test
    void datasetSplitsAtEvaluatedBucket() {
        assertThat(regression.getBaselineOrders()).hasSize(19 * TestObservations.ORDERS_PER_HOUR);
        assertThat(regression.getCurrentOrders()).hasSize(TestObservations.ORDERS_PER_HOUR);
        assertThat(regression.featureNames()).containsExactly("dasher_wait", "distance", "merchant_prep_time");
    }

    @Nested
    @DisplayName("Attribution")
    class Attribution {

        private final AttributionAnalyzer analyzer = new AttributionAnalyzer(30);

        @Test
        void implicatedFeatureCarriesMostAttribution() {
            EvidenceTerm dasher = analyzer.analyze(hypothesis("low_dasher_availability"), regression);
            EvidenceTerm prep = analyzer.analyze(hypothesis("prep_time_drift"), regression);

            assertThat(dasher.getScore()).isCloseTo(0.939, within(0.01));
            assertThat(prep.getScore()).isCloseTo(0.061, within(0.01));
            assertThat(dasher.getScore() + prep.getScore()).isCloseTo(1.0, within(1e-9));
            assertThat(dasher.getDetails()).containsEntry("outcome", OrderObservation.LATE);
        }

        @Test
        void refitIsDeterministic() {
            EvidenceTerm first = analyzer.analyze(hypothesis("low_dasher_availability"), regression);
            EvidenceTerm second = analyzer.analyze(hypothesis("low_dasher_availability"), regression);

            assertThat(second.getScore()).isEqualTo(first.getScore());
        }

        @Test
        void smallSampleScoresZeroWithNote() {
            EvidenceTerm term = new AttributionAnalyzer(1000).analyze(hypothesis("low_dasher_availability"), regression);

            assertThat(term.isApplicable()).isTrue();
            assertThat(term.getScore()).isZero();
            assertThat(term.getNote()).isEqualTo("insufficient_sample");
            assertThat(term.getDetails()).containsEntry("sampleSize", 400).containsEntry("minSample", 1000);
        }

        @Test
        void missingFeaturesAreInapplicable() {
            EvidenceTerm term = analyzer.analyze(hypothesis("eta_model_bias"), regression);

            assertThat(term.getNote()).isEqualTo("features_unavailable");
        }

        @Test
        void singleClassOutcomeIsInapplicable() {
            EvidenceDataset allOnTime = dataset(Cohort.ROOT, twoGroups(0, 0, 0, 0));

            EvidenceTerm term = analyzer.analyze(hypothesis("low_dasher_availability"), allOnTime);

            assertThat(term.getNote()).isEqualTo("degenerate_outcome");
        }
    }

    @Nested
    @DisplayName("Diff-in-diff")
    class DiffInDiff {

        private final ChangeEventRegistry changes = new ChangeEventRegistry(Map.of());
        private final DiffInDiffAnalyzer analyzer = new DiffInDiffAnalyzer(changes);

        @Test
        void withoutChangeEventIsInapplicable() {
            EvidenceTerm term = analyzer.analyze(hypothesis("prep_time_drift"), regression);

            assertThat(term.getNote()).isEqualTo("no_change_event");
        }

        @Test
        void exposedOrdersRegressingAloneIsStrongEvidence() {
            changes.register("batching_threshold_increase", SPLIT);
            EvidenceDataset dataset = dataset(Cohort.ROOT, twoGroups(2, 12, 2, 2));

            EvidenceTerm term = analyzer.analyze(hypothesis("batching_threshold_increase"), dataset);

            assertThat(term.getScore()).isGreaterThan(0.99);
            assertThat((Double) term.getDetails().get("estimate")).isCloseTo(-0.5, within(1e-9));
        }

        @Test
        void bothGroupsMovingTogetherIsWeakEvidence() {
            changes.register("batching_threshold_increase", SPLIT);
            EvidenceDataset dataset = dataset(Cohort.ROOT, twoGroups(2, 12, 2, 12));

            EvidenceTerm term = analyzer.analyze(hypothesis("batching_threshold_increase"), dataset);

            assertThat(term.getScore()).isCloseTo(0.0, within(1e-9));
        }

        @Test
        void rootCohortHasNoControlGroup() {
            changes.register("prep_time_drift", TestObservations.hour(TestObservations.HOURS - 1));

            EvidenceTerm term = analyzer.analyze(hypothesis("prep_time_drift"), regression);

            assertThat(term.getNote()).isEqualTo("insufficient_groups");
        }

        @Test
        void restOfPopulationIsControlForNarrowCohort() {
            changes.register("prep_time_drift", SPLIT);
            EvidenceDataset dataset = dataset(Cohort.of("region", "north"), twoGroups(2, 12, 2, 2));

            EvidenceTerm term = analyzer.analyze(hypothesis("prep_time_drift"), dataset);

            assertThat(term.getDetails()).containsEntry("treatedBefore", 20L).containsEntry("controlAfter", 20L);
            assertThat(term.getScore()).isGreaterThan(0.99);
        }
    }

    @Nested
    @DisplayName("Correlation")
    class Correlation {

        private final TemporalCorrelationAnalyzer analyzer = new TemporalCorrelationAnalyzer(5, 0.7);

        @Test
        void metricTracksPrimaryFeature() {
            EvidenceTerm term = analyzer.analyze(hypothesis("low_dasher_availability"), regression);

            assertThat(term.getScore()).isGreaterThan(0.99);
            assertThat(term.getDetails()).containsEntry("points", 20).containsEntry("strong", true);
            assertThat((Double) term.getDetails().get("r")).isNegative();
        }

        @Test
        void constantFeatureSeriesIsInapplicable() {
            EvidenceTerm term = analyzer.analyze(hypothesis("prep_time_drift"), regression);

            assertThat(term.getNote()).isEqualTo("zero_variance");
        }

        @Test
        void tooFewBucketsIsInapplicable() {
            EvidenceTerm term = new TemporalCorrelationAnalyzer(50, 0.7)
                    .analyze(hypothesis("low_dasher_availability"), regression);

            assertThat(term.getNote()).isEqualTo("insufficient_points");
        }
    }

    @Nested
    @DisplayName("Distribution test")
    class DistributionTest {

        private final DistributionTestAnalyzer analyzer = new DistributionTestAnalyzer(0.05);

        @Test
        void shiftedFeatureIsSignificant() {
            EvidenceTerm term = analyzer.analyze(hypothesis("low_dasher_availability"), regression);

            assertThat(term.getScore()).isGreaterThan(0.99);
            assertThat((Double) term.getDetails().get("baselineMean")).isCloseTo(6.0, within(1e-9));
            assertThat((Double) term.getDetails().get("currentMean")).isCloseTo(15.5, within(1e-9));
        }

        @Test
        void unchangedFeatureScoresZero() {
            EvidenceTerm term = analyzer.analyze(hypothesis("prep_time_drift"), regression);

            assertThat(term.isApplicable()).isTrue();
            assertThat(term.getScore()).isZero();
        }

        @Test
        void absentFeatureIsInapplicable() {
            EvidenceTerm term = analyzer.analyze(hypothesis("eta_model_bias"), regression);

            assertThat(term.getNote()).isEqualTo("insufficient_sample");
        }
    }

    @Nested
    @DisplayName("Engine")
    class Engine {

        @Test
        void undeclaredMethodsAreInapplicable() {
            CausalEvidenceEngine engine = new CausalEvidenceEngine(List.of(new AttributionAnalyzer(30)), 0.5);

            Map<EvidenceMethod, EvidenceTerm> evidence = engine.evaluate(hypothesis("low_dasher_availability"),
                    regression);

            assertThat(evidence.get(EvidenceMethod.DIFF_IN_DIFF).getNote()).isEqualTo("not_declared");
            assertThat(evidence.get(EvidenceMethod.CORRELATION).getNote()).isEqualTo("no_analyzer");
            assertThat(evidence.get(EvidenceMethod.ATTRIBUTION).isApplicable()).isTrue();
        }

        @Test
        void failingAnalyzerDegradesToInapplicable() {
            EvidenceAnalyzer broken = new EvidenceAnalyzer() {
                @Override
                public EvidenceMethod method() {
                    return EvidenceMethod.CORRELATION;
                }

                @Override
                public EvidenceTerm analyze(Hypothesis hypothesis, EvidenceDataset dataset) {
                    throw new IllegalStateException("boom");
                }
            };
            CausalEvidenceEngine engine = new CausalEvidenceEngine(List.of(broken), 0.5);

            EvidenceTerm term = engine.evaluate(hypothesis("low_dasher_availability"), regression)
                    .get(EvidenceMethod.CORRELATION);

            assertThat(term.isApplicable()).isFalse();
            assertThat(term.getNote()).isEqualTo("analysis_failed: boom");
        }

        @Test
        void impactSaturatesAtHalfRelativeChange() {
            CausalEvidenceEngine engine = new CausalEvidenceEngine(List.of(), 0.5);

            assertThat(engine.impact(hypothesis("low_dasher_availability"), regression)).isEqualTo(1.0);
            assertThat(engine.impact(hypothesis("prep_time_drift"), regression)).isZero();
            assertThat(engine.impact(hypothesis("batching_threshold_increase"), regression)).isZero();
            assertThat(CausalEvidenceEngine.impact(10.0, 12.0, 0.5)).isCloseTo(0.4, within(1e-9));
            assertThat(CausalEvidenceEngine.impact(0.0, 0.0, 0.5)).isZero();
            assertThat(CausalEvidenceEngine.impact(0.0, 1.0, 0.5)).isEqualTo(1.0);
        }
    }

    private static final Instant START = Instant.parse("2026-03-02T00:00:00Z");
    private static final Instant SPLIT = START.plus(Duration.ofHours(1));

    private Hypothesis hypothesis(String id) {
        return library.get(id).orElseThrow();
    }

    static Incident regressionIncident() {
        return Incident.builder()
                .id("inc-regression")
                .metricName("on_time_rate")
                .cohort(Cohort.ROOT)
                .detectionWindow(TimeRange.of(TestObservations.BASE, TestObservations.hour(TestObservations.HOURS)))
                .evaluatedAt(TestObservations.hour(TestObservations.HOURS - 1))
                .direction(Incident.Direction.REGRESSION)
                .severity(Severity.MEDIUM)
                .baselineValue(0.9)
                .currentValue(0.25)
                .delta(-0.65)
                .deltaPercent(-72.22)
                .detectionVotes(new DetectionVotes(Vote.ANOMALY, Vote.ANOMALY, Vote.NORMAL))
                .description("on_time_rate regressed from 0.90 to 0.25")
                .revision(1)
                .build();
    }

    private static EvidenceDataset dataset(Cohort cohort, List<OrderObservation> population) {
        List<OrderObservation> cohortOrders = population.stream().filter(o -> o.belongsTo(cohort)).toList();
        return new EvidenceDataset("inc-test", CxMetric.ON_TIME_RATE, cohort,
                TimeRange.of(START, SPLIT.plus(Duration.ofHours(1))), SPLIT, Duration.ofHours(1),
                cohortOrders, population);
    }

    /**
     * Twenty north orders exposed to batching and twenty south orders that are not,
     * in each of two hourly periods, with the given late counts.
     */
    private static List<OrderObservation> twoGroups(int exposedBefore, int exposedAfter,
                                                    int controlBefore, int controlAfter) {
        List<OrderObservation> orders = new ArrayList<>();
        addGroup(orders, "north", 1.0, START, exposedBefore);
        addGroup(orders, "north", 1.0, SPLIT, exposedAfter);
        addGroup(orders, "south", 0.0, START, controlBefore);
        addGroup(orders, "south", 0.0, SPLIT, controlAfter);
        return orders;
    }

    private static void addGroup(List<OrderObservation> orders, String region, double batched,
                                 Instant from, int late) {
        for (int i = 0; i < 20; i++) {
            orders.add(order(region + "-" + from.getEpochSecond() + "-" + i,
                    from.plus(Duration.ofMinutes(i)),
                    Map.of("region", region),
                    Map.of(OrderObservation.LATE, i < late),
                    Map.of("batched", batched, "dasher_wait", 5.0 + i % 4)));
        }
    }
}
