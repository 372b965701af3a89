package com.z254.cxlens.radar.rca;

import com.z254.cxlens.radar.config.RadarProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Designated change timestamps per hypothesis (a policy rollout, a model deploy).
 * A hypothesis without one cannot be checked with diff-in-diff.
 */
@Component
public class ChangeEventRegistry {

    private final Map<String, Instant> changes = new ConcurrentHashMap<>();

    @Autowired
    public ChangeEventRegistry(RadarProperties properties) {
        this(properties.getRca().getChangeEvents());
    }

    public ChangeEventRegistry(Map<String, Instant> changes) {
        if (changes != null) {
            this.changes.putAll(changes);
        }
    }

    public Optional<Instant> changeFor(String hypothesisId) {
        return Optional.ofNullable(changes.get(hypothesisId));
    }

    public void register(String hypothesisId, Instant changedAt) {
        changes.put(hypothesisId, changedAt);
    }

    public Map<String, Instant> all() {
        return Map.copyOf(changes);
    }
}
