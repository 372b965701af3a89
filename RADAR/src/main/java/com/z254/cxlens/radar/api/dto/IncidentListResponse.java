package com.z254.cxlens.radar.api.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Response DTO for incident list.
 */
@Data
@Builder
public class IncidentListResponse {
    private List<IncidentDto> incidents;
    private long total;
}
