package com.z254.cxlens.radar.exception;

public class IncidentNotFoundException extends RuntimeException {

    public IncidentNotFoundException(String incidentId) {
        super("Incident not found: " + incidentId);
    }
}
