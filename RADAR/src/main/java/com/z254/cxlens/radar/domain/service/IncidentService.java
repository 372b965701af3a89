package com.z254.cxlens.radar.domain.service;

import com.z254.cxlens.radar.domain.model.Incident;
import com.z254.cxlens.radar.domain.model.IncidentKey;
import com.z254.cxlens.radar.domain.model.Severity;
import com.z254.cxlens.radar.domain.repository.IncidentRepository;
import com.z254.cxlens.radar.exception.IllegalStatusTransitionException;
import com.z254.cxlens.radar.exception.IncidentNotFoundException;
import com.z254.cxlens.radar.observability.RadarMetrics;
import com.z254.cxlens.radar.observability.RadarStructuredLogger;
import com.z254.cxlens.radar.observability.RadarStructuredLogger.IncidentEventType;
import lombok.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Central service for managing incident lifecycle state.
 * <p>
 * Creation is idempotent on {@code (metric, cohort, detection window)}: a re-run
 * over the same window refreshes the existing record instead of adding another.
 */
@Service
public class IncidentService {

    /**
     * Severity first (HIGH before LOW), then the larger relative swing.
     */
    public static final Comparator<Incident> RANKING = Comparator
            .comparingInt((Incident i) -> i.getSeverity().rank()).reversed()
            .thenComparing(Comparator.comparingDouble((Incident i) -> Math.abs(i.getDeltaPercent())).reversed())
            .thenComparing(Incident::getId);

    private final IncidentRepository incidentRepository;
    private final RadarMetrics metrics;
    private final RadarStructuredLogger structuredLogger;
    private final Clock clock;

    public IncidentService(IncidentRepository incidentRepository,
                           RadarMetrics metrics,
                           RadarStructuredLogger structuredLogger,
                           Clock clock) {
        this.incidentRepository = incidentRepository;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    /**
     * Create the incident for the candidate's key, or refresh the existing one.
     * Status, id and first detection time of an existing incident are preserved.
     */
    public UpsertResult upsert(Incident candidate) {
        Instant now = clock.instant();
        IncidentKey key = candidate.getKey();
        AtomicBoolean created = new AtomicBoolean(false);

        Incident stored = incidentRepository.compute(key, (k, existing) -> {
            if (existing == null) {
                created.set(true);
                return initializeIncident(candidate, now);
            }
            refresh(existing, candidate, now);
            return existing;
        });

        if (created.get()) {
            metrics.recordIncidentCreated();
            structuredLogger.logIncidentEvent(stored.getId(), IncidentEventType.CREATED,
                    "Incident created: " + stored.getDescription(),
                    Map.of("key", key.asString(),
                            "severity", stored.getSeverity().name(),
                            "deltaPercent", stored.getDeltaPercent()));
        } else {
            metrics.recordIncidentUpdated();
            structuredLogger.logIncidentEvent(stored.getId(), IncidentEventType.UPDATED,
                    "Incident refreshed by re-detection",
                    Map.of("key", key.asString(), "revision", stored.getRevision()));
        }
        return new UpsertResult(stored, created.get());
    }

    /**
     * Move an incident forward in its lifecycle.
     *
     * @throws IncidentNotFoundException        if no incident has the id
     * @throws IllegalStatusTransitionException if the move would go backwards
     */
    public Incident transition(String incidentId, Incident.Status next) {
        Instant now = clock.instant();
        AtomicBoolean resolvedNow = new AtomicBoolean(false);
        Incident.Status[] previous = new Incident.Status[1];

        Incident incident = incidentRepository.update(incidentId, current -> {
            previous[0] = current.getStatus();
            if (!current.transitionTo(next, now)) {
                throw new IllegalStatusTransitionException(incidentId, current.getStatus(), next);
            }
            resolvedNow.set(previous[0] != Incident.Status.RESOLVED && next == Incident.Status.RESOLVED);
            return current;
        }).orElseThrow(() -> new IncidentNotFoundException(incidentId));

        if (resolvedNow.get()) {
            metrics.recordIncidentResolved();
        }
        if (previous[0] != next) {
            structuredLogger.logIncidentEvent(incidentId, IncidentEventType.STATUS_CHANGED,
                    "Incident status changed",
                    Map.of("from", previous[0].name(), "to", next.name()));
        }
        return incident;
    }

    /**
     * Note a finished RCA pass on the incident timeline.
     */
    public void recordRcaCompleted(String incidentId, String summary) {
        Instant now = clock.instant();
        incidentRepository.update(incidentId, incident -> {
            incident.addTimelineEvent(Incident.TimelineEventType.RCA_COMPLETED, summary, now);
            return incident;
        });
    }

    public Optional<Incident> getIncident(String incidentId) {
        return incidentRepository.findById(incidentId);
    }

    public Incident requireIncident(String incidentId) {
        return getIncident(incidentId).orElseThrow(() -> new IncidentNotFoundException(incidentId));
    }

    /**
     * List incidents matching the optional filters, ranked by severity then swing size.
     */
    public List<Incident> listIncidents(Incident.Status status, Severity severity,
                                        String metricName, Integer limit) {
        return incidentRepository.findAll().stream()
                .filter(incident -> status == null || incident.getStatus() == status)
                .filter(incident -> severity == null || incident.getSeverity() == severity)
                .filter(incident -> metricName == null || incident.getMetricName().equalsIgnoreCase(metricName))
                .sorted(RANKING)
                .limit(limit == null || limit <= 0 ? Long.MAX_VALUE : limit)
                .toList();
    }

    /**
     * Open (non-resolved) incidents in ranking order.
     */
    public List<Incident> rankOpenIncidents() {
        return incidentRepository.findAll().stream()
                .filter(Incident::isActive)
                .sorted(RANKING)
                .toList();
    }

    public IncidentSummary summary() {
        Map<Incident.Status, Long> byStatus = new EnumMap<>(Incident.Status.class);
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        for (Incident.Status s : Incident.Status.values()) {
            byStatus.put(s, 0L);
        }
        for (Severity s : Severity.values()) {
            bySeverity.put(s, 0L);
        }
        List<Incident> all = incidentRepository.findAll();
        long active = 0;
        for (Incident incident : all) {
            byStatus.merge(incident.getStatus(), 1L, Long::sum);
            bySeverity.merge(incident.getSeverity(), 1L, Long::sum);
            if (incident.isActive()) {
                active++;
            }
        }
        return new IncidentSummary(all.size(), active, byStatus, bySeverity);
    }

    private Incident initializeIncident(Incident candidate, Instant now) {
        Incident incident = Incident.builder()
                .id("inc-" + UUID.randomUUID().toString().substring(0, 12))
                .metricName(candidate.getMetricName())
                .cohort(candidate.getCohort())
                .detectionWindow(candidate.getDetectionWindow())
                .detectedAt(now)
                .updatedAt(now)
                .status(Incident.Status.NEW)
                .revision(1)
                .build();
        copyDetectionFields(incident, candidate);
        incident.addTimelineEvent(Incident.TimelineEventType.CREATED, incident.getDescription(), now);
        return incident;
    }

    private void refresh(Incident existing, Incident candidate, Instant now) {
        copyDetectionFields(existing, candidate);
        existing.setUpdatedAt(now);
        existing.setRevision(existing.getRevision() + 1);
        existing.addTimelineEvent(Incident.TimelineEventType.REDETECTED,
                "Re-detected with severity " + candidate.getSeverity(), now);
    }

    private void copyDetectionFields(Incident target, Incident source) {
        target.setEvaluatedAt(source.getEvaluatedAt());
        target.setBaselineValue(source.getBaselineValue());
        target.setCurrentValue(source.getCurrentValue());
        target.setDelta(source.getDelta());
        target.setDeltaPercent(source.getDeltaPercent());
        target.setSeverity(source.getSeverity());
        target.setDirection(source.getDirection());
        target.setDetectionVotes(source.getDetectionVotes());
        target.setTopSlices(new ArrayList<>(source.getTopSlices()));
        target.setDescription(source.getDescription());
    }

    /**
     * Outcome of an upsert: the stored incident and whether it was newly created.
     */
    @Value
    public static class UpsertResult {
        Incident incident;
        boolean created;
    }

    @Value
    public static class IncidentSummary {
        long total;
        long active;
        Map<Incident.Status, Long> byStatus;
        Map<Severity, Long> bySeverity;
    }
}
