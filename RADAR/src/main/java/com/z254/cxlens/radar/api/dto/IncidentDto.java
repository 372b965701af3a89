package com.z254.cxlens.radar.api.dto;

import com.z254.cxlens.radar.domain.model.DetectionVotes;
import com.z254.cxlens.radar.domain.model.SliceResult;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * DTO for incident representation in API responses.
 */
@Data
@Builder
public class IncidentDto {
    private String id;
    private String metricName;
    private String cohort;
    private Map<String, String> cohortDimensions;
    private Instant windowStart;
    private Instant windowEnd;
    private Instant evaluatedAt;
    private String status;
    private String severity;
    private String direction;
    private double baselineValue;
    private double currentValue;
    private double delta;
    private double deltaPercent;
    private DetectionVotes detectionVotes;
    private List<SliceResult> topSlices;
    private long totalOrdersAffected;
    private String description;
    private long revision;
    private Instant detectedAt;
    private Instant updatedAt;
    private Instant resolvedAt;
}
