package com.z254.cxlens.radar.metrics;

import com.z254.cxlens.radar.TestObservations;
import com.z254.cxlens.radar.domain.model.Cohort;
import com.z254.cxlens.radar.domain.model.MetricSeries;
import com.z254.cxlens.radar.domain.model.OrderObservation;
import com.z254.cxlens.radar.domain.model.TimeRange;
import com.z254.cxlens.radar.exception.UnknownMetricException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.z254.cxlens.radar.TestObservations.order;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class InMemoryObservationStoreTest {

    private static final TimeRange ALL = TimeRange.of(TestObservations.BASE,
            TestObservations.hour(TestObservations.HOURS));

    private InMemoryObservationStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryObservationStore(Duration.ofHours(1));
        store.ingest(TestObservations.onTimeRegression());
    }

    @Test
    void seriesHasOnePointPerHourlyBucket() {
        MetricSeries series = store.fetchSeries("on_time_rate", Cohort.ROOT, ALL);

        assertThat(series.size()).isEqualTo(TestObservations.HOURS);
        assertThat(series.getPoints().get(0).getTimestamp()).isEqualTo(TestObservations.BASE);
        assertThat(series.values()[0]).isCloseTo(0.95, within(1e-9));
        assertThat(series.latest().getValue()).isCloseTo(0.25, within(1e-9));
    }

    @Test
    void seriesIsRestrictedToCohort() {
        MetricSeries north = store.fetchSeries("on_time_rate", Cohort.of("region", "north"), ALL);

        // 8 of the 10 north orders in the final hour are late
        assertThat(north.latest().getValue()).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void reingestingAnOrderReplacesIt() {
        int before = store.size();
        Instant at = TestObservations.hour(0);

        int accepted = store.ingest(List.of(
                order("o-0-0", at, Map.of("region", "north"), Map.of(OrderObservation.LATE, false), Map.of()),
                OrderObservation.builder().orderId("no-timestamp").build()));

        assertThat(accepted).isEqualTo(1);
        assertThat(store.size()).isEqualTo(before);
        assertThat(store.fetchSeries("on_time_rate", Cohort.ROOT, ALL).values()[0]).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void emptyBucketsAreSkipped() {
        store.clear();
        store.ingest(List.of(
                order("a", TestObservations.hour(0), Map.of(), Map.of(), Map.of()),
                order("b", TestObservations.hour(3), Map.of(), Map.of(OrderObservation.CANCELED, true), Map.of())));

        MetricSeries series = store.fetchSeries("cancellation_rate", Cohort.ROOT, ALL);

        assertThat(series.values()).containsExactly(0.0, 1.0);
    }

    @Test
    void snapshotUsesSampleStandardDeviation() {
        TimeRange lastHour = TimeRange.of(TestObservations.hour(TestObservations.HOURS - 1),
                TestObservations.hour(TestObservations.HOURS));

        CohortSnapshot snapshot = store.snapshot("on_time_rate", Cohort.ROOT, lastHour);

        assertThat(snapshot.getOrderCount()).isEqualTo(20);
        assertThat(snapshot.getValue()).isCloseTo(0.25, within(1e-9));
        assertThat(snapshot.getStdDev()).isCloseTo(Math.sqrt(20.0 / 19.0 * 0.25 * 0.75), within(1e-9));
        assertThat(store.snapshot("on_time_rate", Cohort.of("region", "west"), lastHour).isEmpty()).isTrue();
    }

    @Test
    void dimensionValuesAreDistinctAndSorted() {
        assertThat(store.dimensionValues("region", Cohort.ROOT, ALL)).containsExactly("north", "south");
        assertThat(store.dimensionValues("store", Cohort.of("region", "north"), ALL)).containsExactly("s1", "s2");
        assertThat(store.dimensionValues("channel", Cohort.ROOT, ALL)).isEmpty();
    }

    @Test
    void unknownMetricIsRejected() {
        assertThatThrownBy(() -> store.fetchSeries("nps", Cohort.ROOT, ALL))
                .isInstanceOf(UnknownMetricException.class);
    }
}
