package com.z254.cxlens.radar.domain.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class IncidentTest {

    private static final Instant AT = Instant.parse("2026-03-03T00:00:00Z");

    @ParameterizedTest
    @CsvSource({
            "NEW, NEW, true",
            "NEW, INVESTIGATING, true",
            "NEW, RESOLVED, true",
            "INVESTIGATING, NEW, false",
            "INVESTIGATING, RESOLVED, true",
            "RESOLVED, INVESTIGATING, false",
            "RESOLVED, RESOLVED, true"
    })
    void statusOnlyMovesForward(Incident.Status from, Incident.Status to, boolean allowed) {
        assertThat(from.canTransitionTo(to)).isEqualTo(allowed);
    }

    @Test
    void transitionRecordsTimeline() {
        Incident incident = Incident.builder().id("inc-1").build();

        assertThat(incident.transitionTo(Incident.Status.RESOLVED, AT)).isTrue();
        assertThat(incident.getResolvedAt()).isEqualTo(AT);
        assertThat(incident.getTimeline()).singleElement()
                .extracting(Incident.TimelineEvent::getDescription).isEqualTo("NEW -> RESOLVED");
        assertThat(incident.transitionTo(Incident.Status.NEW, AT)).isFalse();
        assertThat(incident.getStatus()).isEqualTo(Incident.Status.RESOLVED);
    }

    @Test
    void repeatedEventsFoldIntoOneEntry() {
        Incident incident = Incident.builder().id("inc-1").build();

        incident.addTimelineEvent(Incident.TimelineEventType.CREATED, "created", AT);
        incident.addTimelineEvent(Incident.TimelineEventType.REDETECTED, "Re-detected with severity HIGH", AT);
        incident.addTimelineEvent(Incident.TimelineEventType.REDETECTED, "Re-detected with severity HIGH",
                AT.plusSeconds(3600));
        incident.addTimelineEvent(Incident.TimelineEventType.REDETECTED, "Re-detected with severity LOW",
                AT.plusSeconds(7200));

        assertThat(incident.getTimeline()).hasSize(3);
        Incident.TimelineEvent folded = incident.getTimeline().get(1);
        assertThat(folded.getOccurrences()).isEqualTo(2);
        assertThat(folded.getTimestamp()).isEqualTo(AT.plusSeconds(3600));
        assertThat(incident.getTimeline().get(2).getOccurrences()).isEqualTo(1);
    }

    @Test
    void timelineIsCappedKeepingCreation() {
        Incident incident = Incident.builder().id("inc-1").build();
        incident.addTimelineEvent(Incident.TimelineEventType.CREATED, "created", AT);

        for (int i = 0; i < Incident.MAX_TIMELINE_EVENTS + 20; i++) {
            incident.addTimelineEvent(Incident.TimelineEventType.RCA_COMPLETED, "summary " + i, AT.plusSeconds(i));
        }

        assertThat(incident.getTimeline()).hasSize(Incident.MAX_TIMELINE_EVENTS);
        assertThat(incident.getTimeline().get(0).getType()).isEqualTo(Incident.TimelineEventType.CREATED);
        assertThat(incident.getTimeline()).last()
                .extracting(Incident.TimelineEvent::getDescription)
                .isEqualTo("summary " + (Incident.MAX_TIMELINE_EVENTS + 19));
    }

    @Test
    void timelineCanBeReadWhileAppending() {
        Incident incident = Incident.builder().id("inc-1").build();
        incident.addTimelineEvent(Incident.TimelineEventType.CREATED, "created", AT);
        incident.addTimelineEvent(Incident.TimelineEventType.STATUS_CHANGED, "NEW -> INVESTIGATING", AT);

        int seen = 0;
        for (Incident.TimelineEvent ignored : incident.getTimeline()) {
            incident.addTimelineEvent(Incident.TimelineEventType.RCA_COMPLETED, "summary " + seen, AT);
            seen++;
        }

        assertThat(seen).isEqualTo(2);
        assertThat(incident.getTimeline()).hasSize(4);
    }

    @Test
    void polarityDecidesDirection() {
        assertThat(CxMetric.ON_TIME_RATE.directionOf(-0.1)).isEqualTo(Incident.Direction.REGRESSION);
        assertThat(CxMetric.ON_TIME_RATE.directionOf(0.1)).isEqualTo(Incident.Direction.IMPROVEMENT);
        assertThat(CxMetric.CANCELLATION_RATE.directionOf(0.1)).isEqualTo(Incident.Direction.REGRESSION);
        assertThat(CxMetric.REFUND_RATE.directionOf(-0.1)).isEqualTo(Incident.Direction.IMPROVEMENT);
    }

    @Test
    void cxScoreAveragesGoodOutcomes() {
        OrderObservation order = OrderObservation.builder()
                .orderId("o-1")
                .timestamp(AT)
                .outcomes(java.util.Map.of(OrderObservation.LATE, true, OrderObservation.REFUNDED, false))
                .build();

        assertThat(CxMetric.CX_SCORE.perOrderValue(order)).isEqualTo(75.0);
        assertThat(CxMetric.ON_TIME_RATE.perOrderValue(order)).isEqualTo(0.0);
        assertThat(CxMetric.fromName("ON_TIME_RATE")).isEqualTo(CxMetric.ON_TIME_RATE);
    }
}
