package com.z254.cxlens.radar.exception;

import com.z254.cxlens.radar.domain.model.Incident;

/**
 * Raised when an incident status change would move backwards (e.g. resolved to new).
 */
public class IllegalStatusTransitionException extends RuntimeException {

    public IllegalStatusTransitionException(String incidentId,
                                            Incident.Status from,
                                            Incident.Status to) {
        super("Incident " + incidentId + " cannot move from " + from + " to " + to);
    }
}
