package com.z254.cxlens.radar.api.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * DTO for an RCA report, causes flattened in rank order.
 */
@Data
@Builder
public class RcaReportDto {
    private String incidentId;
    private String metricName;
    private String direction;
    private long incidentRevision;
    private Instant generatedAt;
    private int hypothesesTested;
    private String summary;
    private String narrative;
    private List<Cause> rankedCauses;

    @Data
    @Builder
    public static class Cause {
        private int rank;
        private String hypothesisId;
        private String name;
        private String category;
        private List<String> implicatedFeatures;
        private double confidence;
        private double impact;
        private double combinedScore;
        private Double attributionScore;
        private Double diffInDiffScore;
        private Double correlationScore;
        private Double statisticalScore;
        private Map<String, Evidence> evidence;
    }

    @Data
    @Builder
    public static class Evidence {
        private Double score;
        private String note;
        private Map<String, Object> details;
    }
}
