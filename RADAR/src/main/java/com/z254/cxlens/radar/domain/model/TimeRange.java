package com.z254.cxlens.radar.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Half-open time interval {@code [start, end)}.
 */
@Value
public class TimeRange {

    Instant start;
    Instant end;

    @JsonCreator
    public TimeRange(@JsonProperty("start") Instant start, @JsonProperty("end") Instant end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Time range bounds are required");
        }
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Time range end must be after start: " + start + " / " + end);
        }
        this.start = start;
        this.end = end;
    }

    public static TimeRange of(Instant start, Instant end) {
        return new TimeRange(start, end);
    }

    public static TimeRange lookback(Instant end, Duration lookback) {
        return new TimeRange(end.minus(lookback), end);
    }

    /**
     * Floor both bounds to multiples of {@code bucket} since the epoch, so that ranges
     * ending inside the same bucket map to the same detection window. A range that
     * collapses stays one bucket long.
     */
    public TimeRange alignedTo(Duration bucket) {
        if (bucket == null || bucket.isZero() || bucket.isNegative()) {
            throw new IllegalArgumentException("Bucket must be positive: " + bucket);
        }
        Instant alignedStart = floor(start, bucket);
        Instant alignedEnd = floor(end, bucket);
        if (!alignedEnd.isAfter(alignedStart)) {
            alignedEnd = alignedStart.plus(bucket);
        }
        return new TimeRange(alignedStart, alignedEnd);
    }

    private static Instant floor(Instant instant, Duration bucket) {
        long size = bucket.toMillis();
        long millis = instant.toEpochMilli();
        return Instant.ofEpochMilli(millis - Math.floorMod(millis, size));
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public Duration length() {
        return Duration.between(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
