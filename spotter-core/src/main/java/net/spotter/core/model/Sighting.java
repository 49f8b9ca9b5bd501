package net.spotter.core.model;

import java.time.Instant;
import java.util.Map;

public record Sighting(
        String spawnId,
        GeoPoint position,
        Instant observedAt,
        Instant expiresAt,
        Map<String, String> attributes
) {
    public Sighting {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static Sighting of(Observation o) {
        return new Sighting(o.spawnId(), o.position(), o.observedAt(), o.expiresAt(), o.attributes());
    }
}
