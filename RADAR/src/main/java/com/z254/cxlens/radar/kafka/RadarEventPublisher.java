package com.z254.cxlens.radar.kafka;

import com.z254.cxlens.radar.domain.model.Incident;
import com.z254.cxlens.radar.domain.model.RcaReport;

/**
 * Hands detection and RCA output to downstream consumers.
 */
public interface RadarEventPublisher {

    void publishIncident(Incident incident, boolean created);

    void publishReport(RcaReport report);
}
