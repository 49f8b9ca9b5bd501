package net.spotter.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/** 한 스폰 지점에 대한 1회 관측. present=false 는 "방문했으나 없었음" */
public record Observation(
        GeoPoint position,
        Instant observedAt,
        Instant expiresAt,          // 타이머를 알 수 없으면 null
        boolean present,
        Map<String, String> attributes
) {
    public Observation {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(observedAt, "observedAt");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static Observation sighting(GeoPoint p, Instant at, Instant expiresAt, Map<String, String> attrs) {
        return new Observation(p, at, expiresAt, true, attrs);
    }

    public static Observation miss(GeoPoint p, Instant at) {
        return new Observation(p, at, null, false, Map.of());
    }

    public String spawnId() { return position.key(); }
}
