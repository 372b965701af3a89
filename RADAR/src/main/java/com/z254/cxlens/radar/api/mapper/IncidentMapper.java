package com.z254.cxlens.radar.api.mapper;

import com.z254.cxlens.radar.api.dto.IncidentDto;
import com.z254.cxlens.radar.domain.model.Incident;

import java.util.List;

/**
 * Mapper for incident to DTO conversion.
 */
public final class IncidentMapper {

    private IncidentMapper() {}

    public static IncidentDto toDto(Incident incident) {
        return IncidentDto.builder()
                .id(incident.getId())
                .metricName(incident.getMetricName())
                .cohort(incident.getCohort().label())
                .cohortDimensions(incident.getCohort().getDimensions())
                .windowStart(incident.getDetectionWindow().getStart())
                .windowEnd(incident.getDetectionWindow().getEnd())
                .evaluatedAt(incident.getEvaluatedAt())
                .status(incident.getStatus().name())
                .severity(incident.getSeverity() != null ? incident.getSeverity().name() : null)
                .direction(incident.getDirection() != null ? incident.getDirection().name() : null)
                .baselineValue(incident.getBaselineValue())
                .currentValue(incident.getCurrentValue())
                .delta(incident.getDelta())
                .deltaPercent(incident.getDeltaPercent())
                .detectionVotes(incident.getDetectionVotes())
                .topSlices(List.copyOf(incident.getTopSlices()))
                .totalOrdersAffected(incident.getTotalOrdersAffected())
                .description(incident.getDescription())
                .revision(incident.getRevision())
                .detectedAt(incident.getDetectedAt())
                .updatedAt(incident.getUpdatedAt())
                .resolvedAt(incident.getResolvedAt())
                .build();
    }
}
