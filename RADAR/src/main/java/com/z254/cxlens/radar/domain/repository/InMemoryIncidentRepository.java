package com.z254.cxlens.radar.domain.repository;

import com.z254.cxlens.radar.domain.model.Incident;
import com.z254.cxlens.radar.domain.model.IncidentKey;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

/**
 * In-memory repository; per-key atomicity comes from {@link ConcurrentHashMap#compute}.
 */
@Repository
public class InMemoryIncidentRepository implements IncidentRepository {

    private final Map<IncidentKey, Incident> store = new ConcurrentHashMap<>();
    private final Map<String, IncidentKey> keysById = new ConcurrentHashMap<>();

    @Override
    public Incident compute(IncidentKey key, BiFunction<IncidentKey, Incident, Incident> remapping) {
        Incident stored = store.compute(key, remapping);
        keysById.put(stored.getId(), key);
        return stored;
    }

    @Override
    public Optional<Incident> update(String id, UnaryOperator<Incident> updater) {
        IncidentKey key = keysById.get(id);
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(store.computeIfPresent(key, (k, incident) -> updater.apply(incident)));
    }

    @Override
    public Optional<Incident> findById(String id) {
        IncidentKey key = keysById.get(id);
        return key == null ? Optional.empty() : Optional.ofNullable(store.get(key));
    }

    @Override
    public Optional<Incident> findByKey(IncidentKey key) {
        return Optional.ofNullable(store.get(key));
    }

    @Override
    public List<Incident> findAll() {
        return new ArrayList<>(store.values());
    }
}
