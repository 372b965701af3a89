package com.z254.cxlens.radar.domain.repository;

import com.z254.cxlens.radar.domain.model.Incident;
import com.z254.cxlens.radar.domain.model.IncidentKey;

import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

/**
 * Repository abstraction for incident persistence.
 * <p>
 * Incidents are keyed by {@link IncidentKey}; writes for one key are atomic so
 * concurrent detection passes can never create two incidents for the same key.
 */
public interface IncidentRepository {

    /**
     * Atomically create or update the incident stored under the given key.
     * The remapping function receives the current incident, or null when absent,
     * and returns the incident to store.
     */
    Incident compute(IncidentKey key, BiFunction<IncidentKey, Incident, Incident> remapping);

    /**
     * Atomically apply an update to an existing incident.
     */
    Optional<Incident> update(String id, UnaryOperator<Incident> updater);

    Optional<Incident> findById(String id);

    Optional<Incident> findByKey(IncidentKey key);

    List<Incident> findAll();
}
