package com.z254.cxlens.radar.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A statistically significant swing of a CX metric for one cohort and detection window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Incident {

    /** Timeline entries kept per incident; the creation event is never dropped */
    public static final int MAX_TIMELINE_EVENTS = 100;

    /** Unique incident identifier */
    private String id;

    /** Regressed metric name */
    private String metricName;

    /** Cohort the metric was evaluated on */
    private Cohort cohort;

    /** Time range the detection pass covered */
    private TimeRange detectionWindow;

    /** Start of the evaluated (latest) bucket; splits the window into baseline and current */
    private Instant evaluatedAt;

    private Instant detectedAt;

    private Instant updatedAt;

    private Instant resolvedAt;

    /** Mean of the history preceding the evaluated point */
    private double baselineValue;

    /** Value at the evaluated point */
    private double currentValue;

    private double delta;

    private double deltaPercent;

    private Severity severity;

    private Direction direction;

    private DetectionVotes detectionVotes;

    @Builder.Default
    private Status status = Status.NEW;

    /** Slices driving the swing, most significant first */
    @Builder.Default
    private List<SliceResult> topSlices = new ArrayList<>();

    private String description;

    /** Incremented every time re-detection refreshes the incident */
    private long revision;

    /** Append-only history, safe to read while detection or RCA appends */
    @Builder.Default
    private List<TimelineEvent> timeline = new CopyOnWriteArrayList<>();

    @JsonIgnore
    public IncidentKey getKey() {
        return IncidentKey.of(metricName, cohort, detectionWindow);
    }

    public boolean isActive() {
        return status != Status.RESOLVED;
    }

    public boolean isRegression() {
        return direction == Direction.REGRESSION;
    }

    public long getTotalOrdersAffected() {
        return topSlices.stream().mapToLong(SliceResult::getOrderCount).sum();
    }

    /**
     * Move the incident forward in its lifecycle.
     *
     * @return false when the requested status is behind the current one
     */
    public boolean transitionTo(Status next, Instant at) {
        if (!status.canTransitionTo(next)) {
            return false;
        }
        if (next == status) {
            return true;
        }
        Status previous = status;
        this.status = next;
        this.updatedAt = at;
        if (next == Status.RESOLVED) {
            this.resolvedAt = at;
        }
        addTimelineEvent(TimelineEventType.STATUS_CHANGED, previous + " -> " + next, at);
        return true;
    }

    public void setTimeline(List<TimelineEvent> timeline) {
        this.timeline = new CopyOnWriteArrayList<>(timeline);
    }

    /**
     * Append a timeline event. A repeat of the latest event (same type and description)
     * is folded into it, bumping its occurrence count and timestamp.
     */
    public synchronized void addTimelineEvent(TimelineEventType type, String description, Instant at) {
        if (!timeline.isEmpty()) {
            int lastIndex = timeline.size() - 1;
            TimelineEvent last = timeline.get(lastIndex);
            if (last.getType() == type && Objects.equals(last.getDescription(), description)) {
                timeline.set(lastIndex, last.toBuilder()
                        .timestamp(at)
                        .occurrences(last.getOccurrences() + 1)
                        .build());
                return;
            }
        }
        timeline.add(TimelineEvent.builder()
                .timestamp(at)
                .type(type)
                .description(description)
                .build());
        if (timeline.size() > MAX_TIMELINE_EVENTS) {
            timeline.remove(1);
        }
    }

    /**
     * Incident lifecycle. Transitions only move forward.
     */
    public enum Status {
        NEW,
        INVESTIGATING,
        RESOLVED;

        public boolean canTransitionTo(Status next) {
            return next.ordinal() >= ordinal();
        }
    }

    /**
     * Whether the swing hurts or helps the customer experience.
     */
    public enum Direction {
        REGRESSION,
        IMPROVEMENT
    }

    public enum TimelineEventType {
        CREATED,
        REDETECTED,
        STATUS_CHANGED,
        RCA_COMPLETED
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TimelineEvent {
        private Instant timestamp;
        private TimelineEventType type;
        private String description;
        private Map<String, String> details;

        /** Consecutive repeats folded into this entry */
        @Builder.Default
        private int occurrences = 1;
    }
}
