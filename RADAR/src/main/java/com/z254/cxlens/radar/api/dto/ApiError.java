package com.z254.cxlens.radar.api.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Error body returned by every API endpoint.
 */
@Data
@Builder
public class ApiError {
    private int status;
    private String error;
    private String message;
    private Instant timestamp;
}
